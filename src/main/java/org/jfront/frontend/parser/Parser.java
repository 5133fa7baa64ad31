package org.jfront.frontend.parser;

import org.jfront.frontend.lexer.Position;
import org.jfront.frontend.lexer.Token;
import org.jfront.frontend.lexer.TokenType;
import org.jfront.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static org.jfront.frontend.parser.ExpectedToken.text;

/**
 * A recursive-descent parser for Java source. It consumes tokens from a {@link TokenCursor}
 * and produces an immutable syntax tree rooted in a {@link CompilationUnit}.
 * <p>
 * Each grammar production has one procedure. A procedure either consumes exactly the tokens of
 * its production or throws a {@link SyntaxException}, leaving an unspecified prefix consumed.
 * Where the grammar is ambiguous the parser tries alternatives speculatively inside a
 * {@link TokenCursor.Marker} scope, which rewinds the cursor unless the attempt commits.
 * <p>
 * A parser instance is single-use and not thread-safe.
 */
public class Parser implements ParsingContext {

    private static final ExpectedToken IDENTIFIER = ExpectedToken.kind(TokenType.IDENTIFIER);
    private static final ExpectedToken BASIC_TYPE = ExpectedToken.kind(TokenType.BASIC_TYPE);

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "&=", "|=", "^=", "%=", "<<=", ">>=", ">>>=");
    private static final Set<String> PREFIX_OPERATORS = Set.of("++", "--", "!", "~", "+", "-");
    private static final Set<String> POSTFIX_OPERATORS = Set.of("++", "--");
    private static final Set<String> NOT_YIELD_FOLLOWERS = Set.of(
            "=", "+=", "-=", "*=", "/=", "&=", "|=", "^=", "%=", "<<=", ">>=", ">>>=",
            ".", "[", "++", "--", ":", "->", "::", ";");

    private final TokenCursor cursor;
    private final ParseTrace trace;
    private boolean yieldAllowed = false;

    /**
     * Represents a primary expression whose selectors have not been parsed yet.
     */
    @FunctionalInterface
    private interface PrimaryFactory {
        Expression build(List<Selector> selectors);
    }

    private record SwitchBlock(List<SwitchStatementCase> cases, List<SwitchRule> rules) {
    }

    private record CastHead(Type type, List<ReferenceType> additionalBounds) {
    }

    public Parser(TokenCursor cursor) {
        this(cursor, false);
    }

    /**
     * @param cursor The cursor over the tokens to parse.
     * @param debug If {@code true}, every traced production is logged at DEBUG level.
     */
    public Parser(TokenCursor cursor, boolean debug) {
        this.cursor = cursor;
        this.trace = new ParseTrace(debug);
    }

    public Parser(Iterator<Token> tokens, boolean debug) {
        this(new TokenCursor(tokens), debug);
    }

    /**
     * Parses a complete compilation unit and verifies that no tokens remain.
     * @return The root of the syntax tree.
     */
    public CompilationUnit parse() {
        CompilationUnit unit = parseCompilationUnit();
        expectEndOfInput();
        return unit;
    }

    /**
     * @throws SyntaxException if any token other than the end-of-input sentinel remains.
     */
    public void expectEndOfInput() {
        if (!isAtEnd()) {
            throw new SyntaxException("Expected end of input", peek());
        }
    }

    // ------------------------------------------------------------------------------------------
    // Token primitives

    @Override
    public boolean match(ExpectedToken... expected) {
        if (!check(expected)) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            cursor.advance();
        }
        return true;
    }

    @Override
    public boolean check(ExpectedToken... expected) {
        requireExpectations(expected);
        for (int i = 0; i < expected.length; i++) {
            if (!expected[i].matches(cursor.peek(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Token consume(ExpectedToken... expected) {
        requireExpectations(expected);
        Token last = null;
        for (ExpectedToken expectation : expected) {
            Token token = cursor.peek();
            if (!expectation.matches(token)) {
                throw new SyntaxException("Expected " + expectation, token);
            }
            last = cursor.advance();
        }
        return last;
    }

    @Override
    public Token advance() {
        return cursor.advance();
    }

    @Override
    public Token peek() {
        return cursor.peek();
    }

    @Override
    public Token peek(int offset) {
        return cursor.peek(offset);
    }

    @Override
    public Token previous() {
        return cursor.last();
    }

    @Override
    public boolean isAtEnd() {
        return cursor.isAtEnd();
    }

    private boolean match(String... texts) {
        return match(expectations(texts));
    }

    private boolean check(String... texts) {
        return check(expectations(texts));
    }

    private Token consume(String... texts) {
        return consume(expectations(texts));
    }

    private static ExpectedToken[] expectations(String... texts) {
        ExpectedToken[] expected = new ExpectedToken[texts.length];
        for (int i = 0; i < texts.length; i++) {
            expected[i] = text(texts[i]);
        }
        return expected;
    }

    private static void requireExpectations(ExpectedToken[] expected) {
        if (expected == null || expected.length == 0) {
            throw new ParserUsageException("At least one expected token is required");
        }
    }

    private String identifier() {
        return consume(IDENTIFIER).text();
    }

    private boolean isIdentifier(int offset, String name) {
        Token token = peek(offset);
        return token.type() == TokenType.IDENTIFIER && token.is(name);
    }

    private static boolean isAnyOf(Token token, String... texts) {
        if (token.isEndOfInput()) {
            return false;
        }
        for (String text : texts) {
            if (token.is(text)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs a speculative parse. On failure the cursor is rewound and {@code null} is returned;
     * a {@code null} result from the body rewinds as well.
     */
    private <T> T attempt(String production, Supplier<T> body) {
        try (TokenCursor.Marker marker = cursor.mark()) {
            T result = body.get();
            if (result != null) {
                marker.commit();
            }
            return result;
        } catch (SyntaxException e) {
            trace.backtrack(production, e);
            return null;
        }
    }

    /**
     * Checks whether a production would parse here, without consuming anything.
     */
    private boolean probe(String production, Runnable body) {
        try (TokenCursor.Marker ignored = cursor.mark()) {
            body.run();
            return true;
        } catch (SyntaxException e) {
            trace.backtrack(production, e);
            return false;
        }
    }

    private <T> T withYieldAllowed(boolean allowed, Supplier<T> body) {
        boolean saved = yieldAllowed;
        yieldAllowed = allowed;
        try {
            return body.get();
        } finally {
            yieldAllowed = saved;
        }
    }

    private static SyntaxException furthest(SyntaxException first, SyntaxException second) {
        Position a = first.getToken() == null ? null : first.getToken().position();
        Position b = second.getToken() == null ? null : second.getToken().position();
        if (b == null) {
            return second;
        }
        if (a == null) {
            return first;
        }
        return a.compareTo(b) > 0 ? first : second;
    }

    // ------------------------------------------------------------------------------------------
    // Identifiers

    private String qualifiedIdentifier() {
        StringBuilder name = new StringBuilder(identifier());
        while (match(".")) {
            name.append('.').append(identifier());
        }
        return name.toString();
    }

    private List<String> qualifiedIdentifierList() {
        List<String> names = new ArrayList<>();
        do {
            names.add(qualifiedIdentifier());
        } while (match(","));
        return names;
    }

    // ------------------------------------------------------------------------------------------
    // Compilation unit

    /**
     * Parses a compilation unit: an optional package declaration, imports, and top-level type and
     * method declarations. Stray semicolons between declarations are skipped.
     * @return The compilation unit.
     */
    public CompilationUnit parseCompilationUnit() {
        return trace.trace("compilationUnit", cursor, this::compilationUnit);
    }

    private CompilationUnit compilationUnit() {
        Token first = peek();
        PackageDeclaration packageDeclaration = null;
        List<Annotation> packageAnnotations = List.of();

        if (isAnnotation(0)) {
            try (TokenCursor.Marker marker = cursor.mark()) {
                List<Annotation> annotations = parseAnnotations();
                if (check("package")) {
                    packageAnnotations = annotations;
                    marker.commit();
                }
            }
        }
        if (match("package")) {
            String name = qualifiedIdentifier();
            consume(";");
            packageDeclaration = new PackageDeclaration(first.position(), packageAnnotations, name, first.javadoc());
        }

        List<Import> imports = new ArrayList<>();
        while (check("import")) {
            imports.add(importDeclaration());
        }

        List<Declaration> types = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(";")) {
                continue;
            }
            types.add(topLevelDeclaration());
        }
        return new CompilationUnit(first.position(), packageDeclaration, imports, types);
    }

    private Import importDeclaration() {
        Token start = consume("import");
        boolean isStatic = match("static");
        StringBuilder path = new StringBuilder(identifier());
        boolean wildcard = false;
        while (match(".")) {
            if (match("*")) {
                wildcard = true;
                break;
            }
            path.append('.').append(identifier());
        }
        consume(";");
        return new Import(start.position(), path.toString(), isStatic, wildcard);
    }

    private Declaration topLevelDeclaration() {
        return trace.trace("topLevelDeclaration", cursor, () -> {
            Modifiers modifiers = parseModifiers();
            if (isTypeDeclarationStart(0)) {
                return typeDeclarationRest(modifiers);
            }
            List<TypeParameter> typeParameters = check("<") ? typeParameters() : List.of();
            Type returnType = match("void") ? null : parseType();
            String name = identifier();
            return methodDeclarationRest(modifiers, typeParameters, returnType, name);
        });
    }

    // ------------------------------------------------------------------------------------------
    // Modifiers and annotations

    private Modifiers parseModifiers() {
        Token first = peek();
        Set<String> modifiers = new LinkedHashSet<>();
        List<Annotation> annotations = new ArrayList<>();
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.MODIFIER || isSealedModifier(0)) {
                advance();
                addModifier(modifiers, token);
            } else if (isAnnotation(0)) {
                annotations.add(annotation());
            } else {
                break;
            }
        }
        return new Modifiers(modifiers, annotations, first.javadoc(), first.position());
    }

    private Modifiers variableModifiers() {
        Token first = peek();
        Set<String> modifiers = new LinkedHashSet<>();
        List<Annotation> annotations = new ArrayList<>();
        while (true) {
            Token token = peek();
            if (match("final")) {
                addModifier(modifiers, token);
            } else if (isAnnotation(0)) {
                annotations.add(annotation());
            } else {
                break;
            }
        }
        return new Modifiers(modifiers, annotations, first.javadoc(), first.position());
    }

    private static void addModifier(Set<String> modifiers, Token token) {
        if (!modifiers.add(token.text())) {
            throw new SyntaxException("Repeated modifier '" + token.text() + "'", token);
        }
    }

    // 'sealed' is a modifier only in front of a declaration.
    private boolean isSealedModifier(int offset) {
        if (!isIdentifier(offset, "sealed")) {
            return false;
        }
        Token next = peek(offset + 1);
        return next.type() == TokenType.MODIFIER || next.type() == TokenType.ANNOTATION
                || isAnyOf(next, "class", "interface") || isIdentifier(offset + 1, "sealed");
    }

    private boolean isAnnotation(int offset) {
        return peek(offset).type() == TokenType.ANNOTATION && !peek(offset + 1).is("interface");
    }

    private boolean isAnnotationDeclaration(int offset) {
        return peek(offset).type() == TokenType.ANNOTATION && peek(offset + 1).is("interface");
    }

    private List<Annotation> parseAnnotations() {
        List<Annotation> annotations = new ArrayList<>();
        do {
            annotations.add(annotation());
        } while (isAnnotation(0));
        return annotations;
    }

    private Annotation annotation() {
        Token at = consume(ExpectedToken.kind(TokenType.ANNOTATION));
        String name = qualifiedIdentifier();
        ElementValue value = null;
        List<ElementValuePair> pairs = List.of();
        if (match("(")) {
            if (check(IDENTIFIER, text("="))) {
                pairs = elementValuePairs();
            } else if (!check(")")) {
                value = elementValue();
            }
            consume(")");
        }
        return new Annotation(at.position(), name, value, pairs);
    }

    private List<ElementValuePair> elementValuePairs() {
        List<ElementValuePair> pairs = new ArrayList<>();
        do {
            Token name = consume(IDENTIFIER);
            consume("=");
            pairs.add(new ElementValuePair(name.position(), name.text(), elementValue()));
        } while (match(","));
        return pairs;
    }

    private ElementValue elementValue() {
        if (isAnnotation(0)) {
            return annotation();
        }
        if (check("{")) {
            return elementArrayValue();
        }
        return parseConditional(true);
    }

    private ElementArrayValue elementArrayValue() {
        Token open = consume("{");
        List<ElementValue> values = new ArrayList<>();
        while (!check("}")) {
            values.add(elementValue());
            if (!match(",")) {
                break;
            }
        }
        consume("}");
        return new ElementArrayValue(open.position(), values);
    }

    // ------------------------------------------------------------------------------------------
    // Type declarations

    private boolean isTypeDeclarationStart(int offset) {
        Token token = peek(offset);
        return isAnyOf(token, "class", "interface", "enum")
                || isAnnotationDeclaration(offset)
                || isRecordStart(offset);
    }

    private boolean isRecordStart(int offset) {
        return isIdentifier(offset, "record")
                && peek(offset + 1).type() == TokenType.IDENTIFIER
                && isAnyOf(peek(offset + 2), "(", "<");
    }

    private TypeDeclaration typeDeclarationRest(Modifiers modifiers) {
        return trace.trace("typeDeclaration", cursor, () -> {
            if (check("class")) {
                return classDeclaration(modifiers);
            }
            if (check("enum")) {
                return enumDeclaration(modifiers);
            }
            if (check("interface")) {
                return interfaceDeclaration(modifiers);
            }
            if (isAnnotationDeclaration(0)) {
                return annotationDeclaration(modifiers);
            }
            if (isRecordStart(0)) {
                return recordDeclaration(modifiers);
            }
            throw new SyntaxException("Expected type declaration", peek());
        });
    }

    private ClassDeclaration classDeclaration(Modifiers modifiers) {
        consume("class");
        String name = identifier();
        List<TypeParameter> typeParameters = check("<") ? typeParameters() : List.of();
        ReferenceType extendsType = match("extends") ? classType() : null;
        List<ReferenceType> implementsTypes = match("implements") ? classTypeList() : List.of();
        List<ReferenceType> permittedTypes = permits();
        List<Member> body = classBody(false);
        return new ClassDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                modifiers.documentation(), name, typeParameters, extendsType, implementsTypes, permittedTypes, body);
    }

    private InterfaceDeclaration interfaceDeclaration(Modifiers modifiers) {
        consume("interface");
        String name = identifier();
        List<TypeParameter> typeParameters = check("<") ? typeParameters() : List.of();
        List<ReferenceType> extendsTypes = match("extends") ? classTypeList() : List.of();
        List<ReferenceType> permittedTypes = permits();
        List<Member> body = classBody(true);
        return new InterfaceDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                modifiers.documentation(), name, typeParameters, extendsTypes, permittedTypes, body);
    }

    private List<ReferenceType> permits() {
        if (isIdentifier(0, "permits")) {
            advance();
            return classTypeList();
        }
        return List.of();
    }

    private EnumDeclaration enumDeclaration(Modifiers modifiers) {
        consume("enum");
        String name = identifier();
        List<ReferenceType> implementsTypes = match("implements") ? classTypeList() : List.of();
        consume("{");
        List<EnumConstantDeclaration> constants = new ArrayList<>();
        if (!match(",")) {
            while (!check(";") && !check("}")) {
                constants.add(enumConstant());
                if (!match(",")) {
                    break;
                }
            }
        }
        List<Member> body = new ArrayList<>();
        if (match(";")) {
            withYieldAllowed(false, () -> {
                while (!check("}")) {
                    requireMoreInput("}");
                    Member member = classBodyDeclaration(false);
                    if (member != null) {
                        body.add(member);
                    }
                }
                return null;
            });
        }
        consume("}");
        return new EnumDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                modifiers.documentation(), name, implementsTypes, constants, body);
    }

    private EnumConstantDeclaration enumConstant() {
        Token first = peek();
        List<Annotation> annotations = isAnnotation(0) ? parseAnnotations() : List.of();
        String name = identifier();
        List<Expression> arguments = check("(") ? arguments() : List.of();
        List<Member> body = check("{") ? classBody(false) : null;
        return new EnumConstantDeclaration(first.position(), annotations, first.javadoc(), name, arguments, body);
    }

    private AnnotationDeclaration annotationDeclaration(Modifiers modifiers) {
        consume(ExpectedToken.kind(TokenType.ANNOTATION), text("interface"));
        String name = identifier();
        consume("{");
        List<Member> body = new ArrayList<>();
        while (!check("}")) {
            requireMoreInput("}");
            if (match(";")) {
                continue;
            }
            body.add(annotationTypeElement());
        }
        consume("}");
        return new AnnotationDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                modifiers.documentation(), name, body);
    }

    private Member annotationTypeElement() {
        Modifiers modifiers = parseModifiers();
        if (isTypeDeclarationStart(0)) {
            return typeDeclarationRest(modifiers);
        }
        Type type = parseType();
        String name = identifier();
        if (match("(")) {
            consume(")");
            int dimensions = arrayDimensions();
            ElementValue defaultValue = match("default") ? elementValue() : null;
            consume(";");
            return new AnnotationMethod(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                    modifiers.documentation(), withExtraDimensions(type, dimensions), name, defaultValue);
        }
        List<VariableDeclarator> declarators = fieldDeclaratorsRest(previous(), name);
        consume(";");
        return new ConstantDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                modifiers.documentation(), type, declarators);
    }

    private RecordDeclaration recordDeclaration(Modifiers modifiers) {
        advance(); // 'record'
        String name = identifier();
        List<TypeParameter> typeParameters = check("<") ? typeParameters() : List.of();
        List<FormalParameter> components = formalParameters();
        List<ReferenceType> implementsTypes = match("implements") ? classTypeList() : List.of();
        List<Member> body = classBody(false);
        return new RecordDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                modifiers.documentation(), name, typeParameters, components, implementsTypes, body);
    }

    // ------------------------------------------------------------------------------------------
    // Class bodies and members

    private List<Member> classBody(boolean inInterface) {
        return withYieldAllowed(false, () -> {
            consume("{");
            List<Member> members = new ArrayList<>();
            while (!check("}")) {
                requireMoreInput("}");
                Member member = classBodyDeclaration(inInterface);
                if (member != null) {
                    members.add(member);
                }
            }
            consume("}");
            return members;
        });
    }

    private Member classBodyDeclaration(boolean inInterface) {
        return trace.trace("classBodyDeclaration", cursor, () -> {
            Token token = peek();
            if (match(";")) {
                return null;
            }
            if (check("static", "{")) {
                advance();
                return new Initializer(token.position(), true, parseBlock());
            }
            if (check("{")) {
                return new Initializer(token.position(), false, parseBlock());
            }
            return memberDeclaration(parseModifiers(), inInterface);
        });
    }

    private Member memberDeclaration(Modifiers modifiers, boolean inInterface) {
        if (isTypeDeclarationStart(0)) {
            return typeDeclarationRest(modifiers);
        }
        List<TypeParameter> typeParameters = check("<") ? typeParameters() : List.of();

        if (check(IDENTIFIER, text("("))) {
            String name = identifier();
            List<FormalParameter> parameters = formalParameters();
            List<String> throwsTypes = match("throws") ? qualifiedIdentifierList() : List.of();
            BlockStatement body = parseBlock();
            return new ConstructorDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                    modifiers.documentation(), typeParameters, name, parameters, throwsTypes, body.statements(), false);
        }
        if (typeParameters.isEmpty() && check(IDENTIFIER, text("{"))) {
            // Compact canonical constructor of a record.
            String name = identifier();
            BlockStatement body = parseBlock();
            return new ConstructorDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                    modifiers.documentation(), List.of(), name, List.of(), List.of(), body.statements(), true);
        }

        Type type = match("void") ? null : parseType();
        Token nameToken = consume(IDENTIFIER);
        if (check("(")) {
            return methodDeclarationRest(modifiers, typeParameters, type, nameToken.text());
        }
        if (type == null || !typeParameters.isEmpty()) {
            throw new SyntaxException("Expected '('", peek());
        }
        List<VariableDeclarator> declarators = fieldDeclaratorsRest(nameToken, nameToken.text());
        consume(";");
        if (inInterface) {
            return new ConstantDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                    modifiers.documentation(), type, declarators);
        }
        return new FieldDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                modifiers.documentation(), type, declarators);
    }

    private MethodDeclaration methodDeclarationRest(Modifiers modifiers, List<TypeParameter> typeParameters,
                                                    Type returnType, String name) {
        List<FormalParameter> parameters = formalParameters();
        if (returnType != null) {
            returnType = withExtraDimensions(returnType, arrayDimensions());
        }
        List<String> throwsTypes = match("throws") ? qualifiedIdentifierList() : List.of();
        List<Statement> body = null;
        if (check("{")) {
            body = parseBlock().statements();
        } else {
            consume(";");
        }
        return new MethodDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                modifiers.documentation(), typeParameters, returnType, name, parameters, throwsTypes, body);
    }

    private List<VariableDeclarator> fieldDeclaratorsRest(Token nameToken, String name) {
        List<VariableDeclarator> declarators = new ArrayList<>();
        int dimensions = arrayDimensions();
        VariableInitializer initializer = match("=") ? variableInitializer() : null;
        declarators.add(new VariableDeclarator(nameToken.position(), name, dimensions, initializer));
        while (match(",")) {
            declarators.add(variableDeclarator());
        }
        return declarators;
    }

    private List<FormalParameter> formalParameters() {
        consume("(");
        List<FormalParameter> parameters = new ArrayList<>();
        if (match(")")) {
            return parameters;
        }
        while (true) {
            Modifiers modifiers = variableModifiers();
            Type type = parseType();
            boolean varargs = match("...");
            String name = identifier();
            type = withExtraDimensions(type, arrayDimensions());
            parameters.add(new FormalParameter(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                    type, name, varargs));
            // A varargs parameter must be the last one.
            if (varargs || !match(",")) {
                break;
            }
        }
        consume(")");
        return parameters;
    }

    // ------------------------------------------------------------------------------------------
    // Variables

    private List<VariableDeclarator> variableDeclarators() {
        List<VariableDeclarator> declarators = new ArrayList<>();
        do {
            declarators.add(variableDeclarator());
        } while (match(","));
        return declarators;
    }

    private VariableDeclarator variableDeclarator() {
        Token name = consume(IDENTIFIER);
        int dimensions = arrayDimensions();
        VariableInitializer initializer = match("=") ? variableInitializer() : null;
        return new VariableDeclarator(name.position(), name.text(), dimensions, initializer);
    }

    private VariableInitializer variableInitializer() {
        return check("{") ? arrayInitializer() : parseExpression();
    }

    private ArrayInitializer arrayInitializer() {
        Token open = consume("{");
        List<VariableInitializer> initializers = new ArrayList<>();
        if (match(",")) {
            consume("}");
            return new ArrayInitializer(open.position(), initializers);
        }
        while (!match("}")) {
            initializers.add(variableInitializer());
            if (!check("}")) {
                consume(",");
            }
        }
        return new ArrayInitializer(open.position(), initializers);
    }

    // ------------------------------------------------------------------------------------------
    // Types

    /**
     * Parses a basic or reference type, including trailing array dimensions.
     * @return The type.
     */
    public Type parseType() {
        return trace.trace("type", cursor, () -> {
            Type type;
            if (check(BASIC_TYPE)) {
                Token token = advance();
                type = new BasicType(token.position(), token.text(), 0);
            } else if (check(IDENTIFIER)) {
                type = referenceType(false);
            } else {
                throw new SyntaxException("Expected type", peek());
            }
            return withExtraDimensions(type, arrayDimensions());
        });
    }

    private static Type withExtraDimensions(Type type, int dimensions) {
        return dimensions == 0 ? type : type.withDimensions(type.dimensions() + dimensions);
    }

    private ReferenceType referenceType(boolean allowDiamond) {
        Token name = consume(IDENTIFIER);
        List<TypeArgument> arguments = check("<") ? typeArguments(allowDiamond) : List.of();
        ReferenceType subType = null;
        if (check(text("."), IDENTIFIER)) {
            advance();
            subType = referenceType(allowDiamond);
        }
        return new ReferenceType(name.position(), name.text(), arguments, subType, 0);
    }

    private ReferenceType classType() {
        ReferenceType type = referenceType(false);
        return type.withDimensions(arrayDimensions());
    }

    private List<ReferenceType> classTypeList() {
        List<ReferenceType> types = new ArrayList<>();
        do {
            types.add(classType());
        } while (match(","));
        return types;
    }

    private List<TypeArgument> typeArguments(boolean allowDiamond) {
        Token open = consume("<");
        List<TypeArgument> arguments = new ArrayList<>();
        if (check(">")) {
            if (!allowDiamond) {
                throw new SyntaxException("Diamond not allowed here", open);
            }
            advance();
            return arguments;
        }
        while (true) {
            arguments.add(typeArgument());
            if (match(">")) {
                return arguments;
            }
            consume(",");
        }
    }

    private TypeArgument typeArgument() {
        Token start = peek();
        String patternType = null;
        if (match("?")) {
            if (!check("extends") && !check("super")) {
                return new TypeArgument(start.position(), null, "?");
            }
            patternType = advance().text();
        }
        Type type = parseType();
        if (type instanceof BasicType && type.dimensions() == 0) {
            throw new SyntaxException("Expected reference type", start);
        }
        return new TypeArgument(start.position(), type, patternType);
    }

    private List<TypeArgument> nonWildcardTypeArguments() {
        consume("<");
        List<TypeArgument> arguments = new ArrayList<>();
        do {
            Token start = peek();
            arguments.add(new TypeArgument(start.position(), parseType(), null));
        } while (match(","));
        consume(">");
        return arguments;
    }

    private List<TypeParameter> typeParameters() {
        consume("<");
        List<TypeParameter> parameters = new ArrayList<>();
        do {
            Token name = consume(IDENTIFIER);
            List<ReferenceType> bounds = new ArrayList<>();
            if (match("extends")) {
                do {
                    bounds.add(referenceType(false));
                } while (match("&"));
            }
            parameters.add(new TypeParameter(name.position(), name.text(), bounds));
        } while (match(","));
        consume(">");
        return parameters;
    }

    private int arrayDimensions() {
        int dimensions = 0;
        while (match("[", "]")) {
            dimensions++;
        }
        return dimensions;
    }

    // ------------------------------------------------------------------------------------------
    // Blocks and statements

    private void requireMoreInput(String closing) {
        if (isAtEnd()) {
            throw new SyntaxException("Expected '" + closing + "'", peek());
        }
    }

    private BlockStatement parseBlock() {
        return trace.trace("block", cursor, () -> {
            Token open = consume("{");
            List<Statement> statements = new ArrayList<>();
            while (!check("}")) {
                requireMoreInput("}");
                statements.add(parseBlockStatement());
            }
            consume("}");
            return new BlockStatement(open.position(), statements);
        });
    }

    private Statement parseBlockStatement() {
        return trace.trace("blockStatement", cursor, this::blockStatement);
    }

    private Statement blockStatement() {
        if (check(IDENTIFIER, text(":")) || check("synchronized") || isYieldStatementStart()) {
            return parseStatement();
        }

        // Look past annotations and modifiers. Any modifier other than 'final' starts a local type.
        int i = 0;
        boolean foundModifiers = false;
        while (true) {
            Token token = peek(i);
            if (token.type() == TokenType.MODIFIER) {
                if (!token.is("final")) {
                    return localTypeDeclaration();
                }
                foundModifiers = true;
                i++;
            } else if (isSealedModifier(i)) {
                return localTypeDeclaration();
            } else if (isAnnotation(i)) {
                foundModifiers = true;
                i = skipAnnotation(i);
            } else {
                break;
            }
        }

        if (isTypeDeclarationStart(i)) {
            return localTypeDeclaration();
        }
        if (foundModifiers) {
            return localVariableDeclarationStatement();
        }
        Token token = peek();
        if (token.type() != TokenType.IDENTIFIER && token.type() != TokenType.BASIC_TYPE) {
            return parseStatement();
        }

        SyntaxException declarationFailure;
        try (TokenCursor.Marker marker = cursor.mark()) {
            LocalVariableDeclaration declaration = localVariableDeclarationStatement();
            marker.commit();
            return declaration;
        } catch (SyntaxException e) {
            trace.backtrack("localVariableDeclaration", e);
            declarationFailure = e;
        }
        try {
            return parseStatement();
        } catch (SyntaxException e) {
            throw furthest(declarationFailure, e);
        }
    }

    // Returns the offset just past the annotation starting at 'offset'.
    private int skipAnnotation(int offset) {
        int i = offset + 2;
        while (peek(i).is(".") && peek(i + 1).type() == TokenType.IDENTIFIER) {
            i += 2;
        }
        if (peek(i).is("(")) {
            int depth = 1;
            i++;
            while (depth > 0) {
                Token token = peek(i);
                if (token.isEndOfInput()) {
                    return i;
                }
                if (token.is("(")) {
                    depth++;
                } else if (token.is(")")) {
                    depth--;
                }
                i++;
            }
        }
        return i;
    }

    private LocalTypeDeclaration localTypeDeclaration() {
        Modifiers modifiers = parseModifiers();
        TypeDeclaration declaration = typeDeclarationRest(modifiers);
        return new LocalTypeDeclaration(declaration.position(), declaration);
    }

    private LocalVariableDeclaration localVariableDeclarationStatement() {
        LocalVariableDeclaration declaration = localVariableDeclaration();
        consume(";");
        return declaration;
    }

    private LocalVariableDeclaration localVariableDeclaration() {
        Modifiers modifiers = variableModifiers();
        Type type = parseType();
        List<VariableDeclarator> declarators = variableDeclarators();
        return new LocalVariableDeclaration(modifiers.position(), modifiers.modifiers(), modifiers.annotations(),
                type, declarators);
    }

    private boolean isYieldStatementStart() {
        if (!yieldAllowed || !isIdentifier(0, "yield")) {
            return false;
        }
        Token next = peek(1);
        return !next.isEndOfInput() && !NOT_YIELD_FOLLOWERS.contains(next.text());
    }

    private Statement parseStatement() {
        return trace.trace("statement", cursor, this::statement);
    }

    private Statement statement() {
        Token token = peek();
        Position position = token.position();

        if (isYieldStatementStart()) {
            advance();
            Expression value = parseExpression();
            consume(";");
            return new YieldStatement(position, value);
        }
        if (check("{")) {
            return parseBlock();
        }
        if (match(";")) {
            return new EmptyStatement(position);
        }
        if (check(IDENTIFIER, text(":"))) {
            String label = advance().text();
            advance();
            return new LabeledStatement(position, label, parseStatement());
        }
        if (match("if")) {
            Expression condition = parExpression();
            Statement thenStatement = parseStatement();
            Statement elseStatement = match("else") ? parseStatement() : null;
            return new IfStatement(position, condition, thenStatement, elseStatement);
        }
        if (match("assert")) {
            Expression condition = parseExpression();
            Expression value = match(":") ? parseExpression() : null;
            consume(";");
            return new AssertStatement(position, condition, value);
        }
        if (match("switch")) {
            Expression selector = parExpression();
            SwitchBlock block = switchBlock(false);
            return new SwitchStatement(position, selector, block.cases(), block.rules());
        }
        if (match("while")) {
            Expression condition = parExpression();
            return new WhileStatement(position, condition, parseStatement());
        }
        if (match("do")) {
            Statement body = parseStatement();
            consume("while");
            Expression condition = parExpression();
            consume(";");
            return new DoStatement(position, condition, body);
        }
        if (match("for")) {
            consume("(");
            ForLoopControl control = forControl();
            consume(")");
            return new ForStatement(position, control, parseStatement());
        }
        if (match("break")) {
            String label = check(IDENTIFIER) ? identifier() : null;
            consume(";");
            return new BreakStatement(position, label);
        }
        if (match("continue")) {
            String label = check(IDENTIFIER) ? identifier() : null;
            consume(";");
            return new ContinueStatement(position, label);
        }
        if (match("return")) {
            Expression value = check(";") ? null : parseExpression();
            consume(";");
            return new ReturnStatement(position, value);
        }
        if (match("throw")) {
            Expression value = parseExpression();
            consume(";");
            return new ThrowStatement(position, value);
        }
        if (match("synchronized")) {
            Expression lock = parExpression();
            return new SynchronizedStatement(position, lock, parseBlock());
        }
        if (match("try")) {
            return tryStatement(position);
        }

        Expression expression = parseExpression();
        consume(";");
        return new StatementExpression(position, expression);
    }

    private TryStatement tryStatement(Position position) {
        List<TryResource> resources = check("(") ? resourceSpecification() : List.of();
        BlockStatement block = parseBlock();
        List<CatchClause> catches = new ArrayList<>();
        while (check("catch")) {
            catches.add(catchClause());
        }
        BlockStatement finallyBlock = match("finally") ? parseBlock() : null;
        if (resources.isEmpty() && catches.isEmpty() && finallyBlock == null) {
            throw new SyntaxException("Expected catch/finally block", peek());
        }
        return new TryStatement(position, resources, block, catches, finallyBlock);
    }

    private List<TryResource> resourceSpecification() {
        consume("(");
        List<TryResource> resources = new ArrayList<>();
        while (true) {
            resources.add(resource());
            if (match(")")) {
                return resources;
            }
            consume(";");
            if (match(")")) {
                return resources;
            }
        }
    }

    private TryResource resource() {
        Token start = peek();
        TryResource declared = attempt("resourceDeclaration", () -> {
            Modifiers modifiers = variableModifiers();
            Type type = parseType();
            String name = identifier();
            type = withExtraDimensions(type, arrayDimensions());
            consume("=");
            Expression value = parseExpression();
            return new TryResource(modifiers.position(), modifiers.modifiers(), modifiers.annotations(), type, name, value);
        });
        if (declared != null) {
            return declared;
        }
        return new TryResource(start.position(), Set.of(), List.of(), null, null, parseExpression());
    }

    private CatchClause catchClause() {
        Token start = consume("catch");
        consume("(");
        Modifiers modifiers = variableModifiers();
        List<String> types = new ArrayList<>();
        do {
            types.add(qualifiedIdentifier());
        } while (match("|"));
        String name = identifier();
        consume(")");
        CatchClauseParameter parameter = new CatchClauseParameter(modifiers.position(), modifiers.modifiers(),
                modifiers.annotations(), types, name);
        return new CatchClause(start.position(), parameter, parseBlock());
    }

    private ForLoopControl forControl() {
        Token start = peek();
        boolean declares = probe("forVariable", () -> {
            variableModifiers();
            parseType();
            identifier();
        });

        LocalVariableDeclaration declaration = null;
        List<Expression> init = List.of();
        if (declares) {
            Modifiers modifiers = variableModifiers();
            Type type = parseType();
            Token name = consume(IDENTIFIER);
            int dimensions = arrayDimensions();
            if (match(":")) {
                VariableDeclarator variable = new VariableDeclarator(name.position(), name.text(), dimensions, null);
                LocalVariableDeclaration loopVariable = new LocalVariableDeclaration(modifiers.position(),
                        modifiers.modifiers(), modifiers.annotations(), type, List.of(variable));
                return new EnhancedForControl(start.position(), loopVariable, parseExpression());
            }
            List<VariableDeclarator> declarators = new ArrayList<>();
            VariableInitializer initializer = match("=") ? variableInitializer() : null;
            declarators.add(new VariableDeclarator(name.position(), name.text(), dimensions, initializer));
            while (match(",")) {
                declarators.add(variableDeclarator());
            }
            declaration = new LocalVariableDeclaration(modifiers.position(), modifiers.modifiers(),
                    modifiers.annotations(), type, declarators);
        } else if (!check(";")) {
            init = expressionList();
        }
        consume(";");
        Expression condition = check(";") ? null : parseExpression();
        consume(";");
        List<Expression> update = check(")") ? List.of() : expressionList();
        return new ForControl(start.position(), declaration, init, condition, update);
    }

    private List<Expression> expressionList() {
        List<Expression> expressions = new ArrayList<>();
        do {
            expressions.add(parseExpression());
        } while (match(","));
        return expressions;
    }

    // ------------------------------------------------------------------------------------------
    // Switch blocks

    private SwitchBlock switchBlock(boolean isExpression) {
        return trace.trace("switchBlock", cursor, () -> {
            consume("{");
            List<SwitchStatementCase> cases = new ArrayList<>();
            List<SwitchRule> rules = new ArrayList<>();
            boolean[] sawDefault = {false};

            while (!check("}")) {
                requireMoreInput("}");
                Token start = peek();
                List<CaseLabel> labels = new ArrayList<>();
                Expression guard = switchLabel(labels, sawDefault);

                if (check("->")) {
                    if (!cases.isEmpty()) {
                        throw new SyntaxException("Different case kinds used in the switch", start);
                    }
                    advance();
                    rules.add(new SwitchRule(start.position(), labels, guard, switchRuleAction()));
                    continue;
                }

                consume(":");
                if (!rules.isEmpty()) {
                    throw new SyntaxException("Different case kinds used in the switch", start);
                }
                while (check("case") || check("default")) {
                    Token label = peek();
                    Expression nextGuard = switchLabel(labels, sawDefault);
                    if (nextGuard != null) {
                        if (guard != null) {
                            throw new SyntaxException("Multiple 'when' clauses for one switch label group", label);
                        }
                        guard = nextGuard;
                    }
                    if (check("->")) {
                        throw new SyntaxException("Different case kinds used in the switch", label);
                    }
                    consume(":");
                }

                List<Statement> statements = new ArrayList<>();
                boolean yieldInGroup = isExpression || yieldAllowed;
                withYieldAllowed(yieldInGroup, () -> {
                    while (!check("case") && !check("default") && !check("}")) {
                        requireMoreInput("}");
                        statements.add(parseBlockStatement());
                    }
                    return null;
                });
                cases.add(new SwitchStatementCase(start.position(), labels, guard, statements));
            }
            consume("}");
            return new SwitchBlock(cases, rules);
        });
    }

    /**
     * Parses {@code default} or {@code case label, label... [when guard]} into {@code labels}.
     * @return The guard, or {@code null}.
     */
    private Expression switchLabel(List<CaseLabel> labels, boolean[] sawDefault) {
        Token token = peek();
        if (match("default")) {
            addDefaultLabel(labels, token, sawDefault);
            return null;
        }
        consume("case");
        do {
            Token labelToken = peek();
            if (match("default")) {
                addDefaultLabel(labels, labelToken, sawDefault);
            } else {
                labels.add(parseCaseLabel());
            }
        } while (match(","));
        if (isIdentifier(0, "when")) {
            advance();
            return parseConditional(false);
        }
        return null;
    }

    private static void addDefaultLabel(List<CaseLabel> labels, Token token, boolean[] sawDefault) {
        if (sawDefault[0]) {
            throw new SyntaxException("Multiple default labels", token);
        }
        sawDefault[0] = true;
        labels.add(new DefaultLabel(token.position()));
    }

    private CaseLabel parseCaseLabel() {
        return trace.trace("caseLabel", cursor, () -> {
            Pattern pattern = attempt("pattern", this::pattern);
            if (pattern != null) {
                return pattern;
            }
            return parseConditional(false);
        });
    }

    private AstNode switchRuleAction() {
        if (check("{")) {
            return withYieldAllowed(true, this::parseBlock);
        }
        if (check("throw")) {
            return parseStatement();
        }
        Expression expression = parseExpression();
        consume(";");
        return expression;
    }

    // ------------------------------------------------------------------------------------------
    // Patterns

    private Pattern pattern() {
        return trace.trace("pattern", cursor, () -> {
            Modifiers modifiers = variableModifiers();
            Type type = parseType();
            if (check("(")) {
                if (!(type instanceof ReferenceType referenceType) || type.dimensions() > 0) {
                    throw new SyntaxException("Expected record type", peek());
                }
                return recordPatternRest(modifiers.position(), referenceType);
            }
            if (check(IDENTIFIER) && !isAnyOf(peek(1), ".", "(", "[")) {
                String name = identifier();
                return new TypePattern(modifiers.position(), modifiers.modifiers(), modifiers.annotations(), type, name);
            }
            throw new SyntaxException("Expected pattern", peek());
        });
    }

    private RecordPattern recordPatternRest(Position position, ReferenceType type) {
        consume("(");
        List<Pattern> components = new ArrayList<>();
        if (!match(")")) {
            do {
                components.add(pattern());
            } while (match(","));
            consume(")");
        }
        return new RecordPattern(position, type, components);
    }

    // ------------------------------------------------------------------------------------------
    // Expressions

    /**
     * Parses an expression, including assignments and lambdas.
     * @return The expression.
     */
    public Expression parseExpression() {
        return trace.trace("expression", cursor, () -> {
            Expression target = parseConditional(true);
            Token token = peek();
            if (token.type() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(token.text())) {
                advance();
                Expression value = parseExpression();
                return new Assignment(target.position(), target, token.text(), value);
            }
            return target;
        });
    }

    /**
     * Parses a conditional expression. Case labels and guards are parsed with lambdas disabled so
     * that the arrow of a switch rule is never taken for a lambda arrow.
     */
    private Expression parseConditional(boolean lambdaAllowed) {
        return trace.trace("conditional", cursor, () -> {
            Expression condition = binary(lambdaAllowed);
            if (match("?")) {
                Expression ifTrue = parseExpression();
                consume(":");
                Expression ifFalse = parseConditional(lambdaAllowed);
                return new TernaryExpression(condition.position(), condition, ifTrue, ifFalse);
            }
            if (lambdaAllowed && check("->") && condition instanceof MemberReference name
                    && name.qualifier() == null && name.selectors().isEmpty()) {
                InferredFormalParameter parameter = new InferredFormalParameter(name.position(), name.member());
                return new LambdaExpression(name.position(), List.of(parameter), lambdaBody());
            }
            return condition;
        });
    }

    private Expression binary(boolean lambdaAllowed) {
        Expression first = unary(lambdaAllowed);
        if (!isInfixOperatorNext()) {
            return first;
        }
        List<Expression> operands = new ArrayList<>();
        List<InfixOperators.Operator> operators = new ArrayList<>();
        operands.add(first);
        while (isInfixOperatorNext()) {
            Token token = peek();
            if (match("instanceof")) {
                operators.add(typeTest(token));
                operands.add(null);
            } else {
                operators.add(InfixOperators.Operator.binary(token, infixOperator()));
                operands.add(unary(lambdaAllowed));
            }
        }
        return InfixOperators.fold(operands, operators);
    }

    private boolean isInfixOperatorNext() {
        Token token = peek();
        return token.is("instanceof")
                || (token.type() == TokenType.OPERATOR && InfixOperators.isInfix(token.text()));
    }

    // Shift operators arrive as adjacent '>' tokens so that nested type arguments can close.
    private String infixOperator() {
        Token token = advance();
        String symbol = token.text();
        if (symbol.equals(">")) {
            Token previousToken = token;
            while (symbol.length() < 3 && isAdjacentCloseAngle(previousToken, peek())) {
                previousToken = advance();
                symbol += ">";
            }
        }
        return symbol;
    }

    private static boolean isAdjacentCloseAngle(Token previousToken, Token next) {
        return next.is(">") && next.type() == TokenType.OPERATOR
                && next.line() == previousToken.line() && next.column() == previousToken.column() + 1;
    }

    private InfixOperators.Operator typeTest(Token instanceofToken) {
        if (check("final") || isAnnotation(0)) {
            return new InfixOperators.Operator(instanceofToken, "instanceof", null, pattern());
        }
        Type type;
        try (TokenCursor.Marker marker = cursor.mark()) {
            type = parseType();
            marker.commit();
        } catch (SyntaxException e) {
            trace.backtrack("instanceofType", e);
            throw new SyntaxException("Expected type after 'instanceof'", peek());
        }
        if (check("(")) {
            if (!(type instanceof ReferenceType referenceType) || type.dimensions() > 0) {
                throw new SyntaxException("Expected record type", peek());
            }
            Pattern pattern = recordPatternRest(type.position(), referenceType);
            return new InfixOperators.Operator(instanceofToken, "instanceof", null, pattern);
        }
        if (check(IDENTIFIER) && !isAnyOf(peek(1), ".", "(", "[")) {
            Pattern pattern = new TypePattern(type.position(), Set.of(), List.of(), type, identifier());
            return new InfixOperators.Operator(instanceofToken, "instanceof", null, pattern);
        }
        return new InfixOperators.Operator(instanceofToken, "instanceof", type, null);
    }

    private Expression unary(boolean lambdaAllowed) {
        return trace.trace("unary", cursor, () -> {
            Token token = peek();
            if (token.type() == TokenType.OPERATOR && PREFIX_OPERATORS.contains(token.text())) {
                advance();
                return new UnaryExpression(token.position(), token.text(), unary(lambdaAllowed));
            }

            if (check("(")) {
                if (lambdaAllowed) {
                    List<LambdaParameter> parameters = attempt("lambdaParameters", () -> {
                        List<LambdaParameter> result = lambdaParameters();
                        return check("->") ? result : null;
                    });
                    if (parameters != null) {
                        return new LambdaExpression(token.position(), parameters, lambdaBody());
                    }
                }
                CastHead cast = attempt("cast", this::castHead);
                if (cast != null) {
                    return new Cast(token.position(), cast.type(), cast.additionalBounds(), unary(lambdaAllowed));
                }
            }

            if (isTypeMethodReferenceCandidate()) {
                MethodReference reference = attempt("typeMethodReference", this::typeMethodReference);
                if (reference != null) {
                    return reference;
                }
            }

            Expression expression = primaryWithSelectors();
            if (match("::")) {
                return expressionMethodReference(expression);
            }
            while (peek().type() == TokenType.OPERATOR && POSTFIX_OPERATORS.contains(peek().text())) {
                Token operator = advance();
                expression = new PostfixExpression(expression.position(), operator.text(), expression);
            }
            return expression;
        });
    }

    // The method reference binds to the primary, so a preceding cast applies to the whole reference.
    private MethodReference expressionMethodReference(Expression target) {
        List<TypeArgument> typeArguments = check("<") ? nonWildcardTypeArguments() : List.of();
        String method = match("new") ? "new" : identifier();
        return new MethodReference(target.position(), target, null, typeArguments, method);
    }

    private List<LambdaParameter> lambdaParameters() {
        List<LambdaParameter> parameters = new ArrayList<>();
        if (check(text("("), IDENTIFIER, text(",")) || check(text("("), IDENTIFIER, text(")")) || check("(", ")")) {
            consume("(");
            if (!check(")")) {
                do {
                    Token name = consume(IDENTIFIER);
                    parameters.add(new InferredFormalParameter(name.position(), name.text()));
                } while (match(","));
            }
            consume(")");
            return parameters;
        }
        parameters.addAll(formalParameters());
        return parameters;
    }

    private AstNode lambdaBody() {
        consume("->");
        if (check("{")) {
            return withYieldAllowed(false, this::parseBlock);
        }
        return parseExpression();
    }

    /**
     * Parses {@code (Type)} when it is followed by something a cast can apply to. A reference type
     * cast is never followed by a prefix {@code +}, {@code -}, {@code ++} or {@code --}, which are
     * taken as binary or postfix operators instead.
     */
    private CastHead castHead() {
        consume("(");
        Type type = parseType();
        List<ReferenceType> additionalBounds = new ArrayList<>();
        while (match("&")) {
            additionalBounds.add(classType());
        }
        consume(")");
        Token next = peek();
        boolean operandFollows = next.type() == TokenType.IDENTIFIER
                || next.type() == TokenType.BASIC_TYPE
                || next.type().isLiteral()
                || isAnyOf(next, "(", "this", "super", "new", "!", "~", "switch", "void");
        if (type instanceof BasicType) {
            operandFollows = operandFollows || isAnyOf(next, "+", "-", "++", "--");
        }
        if (!operandFollows) {
            throw new SyntaxException("Expected cast operand", next);
        }
        return new CastHead(type, additionalBounds);
    }

    private boolean isTypeMethodReferenceCandidate() {
        if (check(BASIC_TYPE)) {
            return true;
        }
        int i = 0;
        while (peek(i).type() == TokenType.IDENTIFIER && peek(i + 1).is(".")) {
            i += 2;
        }
        return peek(i).type() == TokenType.IDENTIFIER && isAnyOf(peek(i + 1), "<", "[");
    }

    private MethodReference typeMethodReference() {
        Type type = parseType();
        consume("::");
        List<TypeArgument> typeArguments = check("<") ? nonWildcardTypeArguments() : List.of();
        String method = match("new") ? "new" : identifier();
        return new MethodReference(type.position(), null, type, typeArguments, method);
    }

    private Expression parExpression() {
        consume("(");
        Expression expression = parseExpression();
        consume(")");
        return expression;
    }

    private List<Expression> arguments() {
        consume("(");
        List<Expression> arguments = new ArrayList<>();
        if (match(")")) {
            return arguments;
        }
        do {
            arguments.add(parseExpression());
        } while (match(","));
        consume(")");
        return arguments;
    }

    // ------------------------------------------------------------------------------------------
    // Primaries

    private Expression primaryWithSelectors() {
        PrimaryFactory factory = trace.trace("primary", cursor, this::primary);
        List<Selector> selectors = new ArrayList<>();
        while (check(".") || check("[")) {
            selectors.add(selector());
        }
        return factory.build(selectors);
    }

    private PrimaryFactory primary() {
        Token token = peek();
        Position position = token.position();

        if (token.type().isLiteral()) {
            advance();
            return selectors -> new Literal(position, token.type(), token.text(), token.value(), selectors);
        }
        if (check("(")) {
            Expression expression = parExpression();
            return selectors -> new ParenthesizedExpression(position, expression, selectors);
        }
        if (match("this")) {
            if (check("(")) {
                List<Expression> arguments = arguments();
                return selectors -> new ExplicitConstructorInvocation(position, List.of(), arguments, selectors);
            }
            return selectors -> new This(position, null, selectors);
        }
        if (check("super", "::")) {
            advance();
            return selectors -> new SuperReference(position, null, selectors);
        }
        if (match("super")) {
            return superSuffix(position, null, List.of());
        }
        if (match("new")) {
            return creator(position);
        }
        if (check("<")) {
            List<TypeArgument> typeArguments = nonWildcardTypeArguments();
            if (match("this")) {
                List<Expression> arguments = arguments();
                return selectors -> new ExplicitConstructorInvocation(position, typeArguments, arguments, selectors);
            }
            if (match("super")) {
                return superSuffix(position, null, typeArguments);
            }
            String name = identifier();
            List<Expression> arguments = arguments();
            return selectors -> new MethodInvocation(position, null, typeArguments, name, arguments, selectors);
        }
        if (check(IDENTIFIER)) {
            return identifierPrimary(position);
        }
        if (check(BASIC_TYPE)) {
            Token name = advance();
            BasicType type = new BasicType(name.position(), name.text(), arrayDimensions());
            consume(".", "class");
            return selectors -> new ClassReference(position, type, selectors);
        }
        if (match("void")) {
            consume(".", "class");
            return selectors -> new VoidClassReference(position, selectors);
        }
        if (match("switch")) {
            Expression selector = parExpression();
            SwitchBlock block = switchBlock(true);
            return selectors -> new SwitchExpression(position, selector, block.cases(), block.rules(), selectors);
        }
        throw new SyntaxException("Expected expression", token);
    }

    // A dotted name followed by an optional suffix: a call, '.class', '.this', '.super', '.new' and so on.
    private PrimaryFactory identifierPrimary(Position position) {
        List<Token> names = new ArrayList<>();
        names.add(advance());
        while (check(text("."), IDENTIFIER)) {
            advance();
            names.add(advance());
        }
        String qualifier = joinNames(names, names.size() - 1);
        String member = names.get(names.size() - 1).text();

        if (check("[", "]")) {
            int dimensions = arrayDimensions();
            consume(".", "class");
            ReferenceType type = referenceTypeOf(names, 0, dimensions);
            return selectors -> new ClassReference(position, type, selectors);
        }
        if (check("(")) {
            List<Expression> arguments = arguments();
            return selectors -> new MethodInvocation(position, qualifier, List.of(), member, arguments, selectors);
        }
        if (match(".", "class")) {
            ReferenceType type = referenceTypeOf(names, 0, 0);
            return selectors -> new ClassReference(position, type, selectors);
        }
        String fullName = joinNames(names, names.size());
        if (match(".", "this")) {
            return selectors -> new This(position, fullName, selectors);
        }
        if (check(".", "<")) {
            advance();
            List<TypeArgument> typeArguments = nonWildcardTypeArguments();
            if (match("super")) {
                return superSuffix(position, fullName, typeArguments);
            }
            String name = identifier();
            List<Expression> arguments = arguments();
            return selectors -> new MethodInvocation(position, fullName, typeArguments, name, arguments, selectors);
        }
        if (check(".", "new")) {
            Selector creator = selector();
            return selectors -> new MemberReference(position, qualifier, member, prepend(creator, selectors));
        }
        if (check(".", "super", "::")) {
            advance();
            advance();
            return selectors -> new SuperReference(position, fullName, selectors);
        }
        if (match(".", "super")) {
            return superSuffix(position, fullName, List.of());
        }
        return selectors -> new MemberReference(position, qualifier, member, selectors);
    }

    private static String joinNames(List<Token> names, int count) {
        if (count == 0) {
            return null;
        }
        StringBuilder joined = new StringBuilder(names.get(0).text());
        for (int i = 1; i < count; i++) {
            joined.append('.').append(names.get(i).text());
        }
        return joined.toString();
    }

    private static ReferenceType referenceTypeOf(List<Token> names, int index, int dimensions) {
        Token name = names.get(index);
        ReferenceType subType = index + 1 < names.size() ? referenceTypeOf(names, index + 1, 0) : null;
        return new ReferenceType(name.position(), name.text(), List.of(), subType, dimensions);
    }

    private static List<Selector> prepend(Selector first, List<Selector> rest) {
        List<Selector> selectors = new ArrayList<>(rest.size() + 1);
        selectors.add(first);
        selectors.addAll(rest);
        return selectors;
    }

    private PrimaryFactory superSuffix(Position position, String qualifier, List<TypeArgument> typeArguments) {
        if (match(".")) {
            List<TypeArgument> methodTypeArguments = check("<") ? nonWildcardTypeArguments() : typeArguments;
            String name = identifier();
            if (check("(")) {
                List<Expression> arguments = arguments();
                return selectors -> new SuperMethodInvocation(position, qualifier, methodTypeArguments, name,
                        arguments, selectors);
            }
            return selectors -> new SuperMemberReference(position, qualifier, name, selectors);
        }
        List<Expression> arguments = arguments();
        return selectors -> new SuperConstructorInvocation(position, qualifier, typeArguments, arguments, selectors);
    }

    private PrimaryFactory creator(Position position) {
        List<TypeArgument> constructorTypeArguments = check("<") ? nonWildcardTypeArguments() : List.of();
        if (check(BASIC_TYPE)) {
            Token name = advance();
            return arrayCreatorRest(position, new BasicType(name.position(), name.text(), 0));
        }
        ReferenceType type = referenceType(true);
        if (check("[")) {
            if (!constructorTypeArguments.isEmpty()) {
                throw new SyntaxException("Array creator not allowed with generic constructor type arguments", peek());
            }
            return arrayCreatorRest(position, type);
        }
        List<Expression> arguments = arguments();
        List<Member> body = check("{") ? classBody(false) : null;
        return selectors -> new ClassCreator(position, constructorTypeArguments, type, arguments, body, selectors);
    }

    private PrimaryFactory arrayCreatorRest(Position position, Type elementType) {
        if (check("[", "]")) {
            int dimensions = arrayDimensions();
            ArrayInitializer initializer = arrayInitializer();
            return selectors -> new ArrayCreator(position, elementType, List.of(), dimensions, initializer, selectors);
        }
        List<Expression> dimensions = new ArrayList<>();
        while (check("[") && !check("[", "]")) {
            consume("[");
            dimensions.add(parseExpression());
            consume("]");
        }
        if (dimensions.isEmpty()) {
            throw new SyntaxException("Expected array dimension", peek());
        }
        int emptyDimensions = arrayDimensions();
        return selectors -> new ArrayCreator(position, elementType, dimensions, emptyDimensions, null, selectors);
    }

    private InnerClassCreator innerCreator(Position position) {
        List<TypeArgument> constructorTypeArguments = check("<") ? nonWildcardTypeArguments() : List.of();
        Token name = consume(IDENTIFIER);
        List<TypeArgument> typeArguments = check("<") ? typeArguments(true) : List.of();
        ReferenceType type = new ReferenceType(name.position(), name.text(), typeArguments, null, 0);
        List<Expression> arguments = arguments();
        List<Member> body = check("{") ? classBody(false) : null;
        return new InnerClassCreator(position, constructorTypeArguments, type, arguments, body, List.of());
    }

    private Selector selector() {
        return trace.trace("selector", cursor, () -> {
            Token token = peek();
            if (match("[")) {
                Expression index = parseExpression();
                consume("]");
                return new ArraySelector(token.position(), index);
            }
            consume(".");
            Token next = peek();
            Position position = next.position();
            if (check(IDENTIFIER)) {
                String name = advance().text();
                if (check("(")) {
                    return new MethodInvocation(position, null, List.of(), name, arguments(), List.of());
                }
                return new MemberReference(position, null, name, List.of());
            }
            if (check("<")) {
                List<TypeArgument> typeArguments = nonWildcardTypeArguments();
                String name = identifier();
                return new MethodInvocation(position, null, typeArguments, name, arguments(), List.of());
            }
            if (match("this")) {
                return new This(position, null, List.of());
            }
            if (match("super")) {
                Expression suffix = superSuffix(position, null, List.of()).build(List.of());
                return (Selector) suffix;
            }
            if (match("new")) {
                return innerCreator(position);
            }
            throw new SyntaxException("Expected selector", next);
        });
    }
}
