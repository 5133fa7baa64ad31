package org.jfront.frontend.parser;

import org.jfront.api.JavaFrontEnd;
import org.jfront.frontend.lexer.TokenType;
import org.jfront.frontend.parser.ast.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for expression parsing: precedence, lambdas, casts, method references,
 * creators and selectors.
 */
public class ParserExpressionTest {

    private static Expression parse(String source) {
        return JavaFrontEnd.parseExpression(source);
    }

    private static String text(Expression expression) {
        return ((Literal) expression).text();
    }

    /**
     * Verifies that multiplication binds tighter than addition.
     */
    @Test
    @Tag("unit")
    void testPrecedence() {
        // Act
        BinaryOperation sum = (BinaryOperation) parse("1 + 2 * 3");

        // Assert
        assertThat(sum.operator()).isEqualTo("+");
        assertThat(text(sum.left())).isEqualTo("1");
        BinaryOperation product = (BinaryOperation) sum.right();
        assertThat(product.operator()).isEqualTo("*");
        assertThat(text(product.left())).isEqualTo("2");
        assertThat(text(product.right())).isEqualTo("3");
    }

    /**
     * Verifies that subtraction associates to the left.
     */
    @Test
    @Tag("unit")
    void testLeftAssociativity() {
        // Act
        BinaryOperation outer = (BinaryOperation) parse("1 - 2 - 3");

        // Assert
        assertThat(text(outer.right())).isEqualTo("3");
        BinaryOperation inner = (BinaryOperation) outer.left();
        assertThat(text(inner.left())).isEqualTo("1");
        assertThat(text(inner.right())).isEqualTo("2");
    }

    @Test
    @Tag("unit")
    void testAssignmentIsRightAssociative() {
        // Act
        Assignment outer = (Assignment) parse("a = b += c");

        // Assert
        assertThat(outer.operator()).isEqualTo("=");
        assertThat(outer.value()).isInstanceOfSatisfying(Assignment.class,
                inner -> assertThat(inner.operator()).isEqualTo("+="));
    }

    @Test
    @Tag("unit")
    void testNestedTernary() {
        // Act
        TernaryExpression ternary = (TernaryExpression) parse("a ? b : c ? d : e");

        // Assert
        assertThat(ternary.ifFalse()).isInstanceOf(TernaryExpression.class);
    }

    /**
     * Adjacent closing angle brackets in an expression are read back as one shift operator.
     */
    @Test
    @Tag("unit")
    void testShiftOperatorsAreRecombined() {
        // Act
        BinaryOperation signed = (BinaryOperation) parse("a >> 2");
        BinaryOperation unsigned = (BinaryOperation) parse("a >>> 2");
        BinaryOperation left = (BinaryOperation) parse("a << 2");

        // Assert
        assertThat(signed.operator()).isEqualTo(">>");
        assertThat(unsigned.operator()).isEqualTo(">>>");
        assertThat(left.operator()).isEqualTo("<<");
    }

    @Test
    @Tag("unit")
    void testSeparatedAngleBracketsAreNotAShift() {
        // Act & Assert
        assertThatThrownBy(() -> parse("a > > 2"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Expected expression");
    }

    @Test
    @Tag("unit")
    void testUnaryAndPostfixOperators() {
        // Act
        UnaryExpression not = (UnaryExpression) parse("!a");
        UnaryExpression negated = (UnaryExpression) parse("-1");
        UnaryExpression preIncrement = (UnaryExpression) parse("++i");
        PostfixExpression postIncrement = (PostfixExpression) parse("i++");

        // Assert
        assertThat(not.operator()).isEqualTo("!");
        assertThat(negated.operand()).isInstanceOf(Literal.class);
        assertThat(preIncrement.operator()).isEqualTo("++");
        assertThat(postIncrement.operator()).isEqualTo("++");
    }

    /**
     * Verifies the three lambda parameter forms and both body forms.
     */
    @Test
    @Tag("unit")
    void testLambdas() {
        // Act
        LambdaExpression single = (LambdaExpression) parse("x -> x * 2");
        LambdaExpression inferred = (LambdaExpression) parse("(a, b) -> a + b");
        LambdaExpression typed = (LambdaExpression) parse("(int a, String b) -> { return a; }");
        LambdaExpression empty = (LambdaExpression) parse("() -> 42");

        // Assert
        assertThat(single.parameters()).singleElement().isInstanceOfSatisfying(InferredFormalParameter.class,
                parameter -> assertThat(parameter.name()).isEqualTo("x"));
        assertThat(single.body()).isInstanceOf(BinaryOperation.class);
        assertThat(inferred.parameters()).hasSize(2).allMatch(p -> p instanceof InferredFormalParameter);
        assertThat(typed.parameters()).hasSize(2).allMatch(p -> p instanceof FormalParameter);
        assertThat(typed.body()).isInstanceOf(BlockStatement.class);
        assertThat(empty.parameters()).isEmpty();
        assertThat(empty.body()).isInstanceOf(Literal.class);
    }

    /**
     * Verifies casts to basic, reference and intersection types.
     */
    @Test
    @Tag("unit")
    void testCasts() {
        // Act
        Cast toInt = (Cast) parse("(int) x");
        Cast negated = (Cast) parse("(int) -x");
        Cast generic = (Cast) parse("(List<String>) o");
        Cast intersection = (Cast) parse("(Runnable & Serializable) () -> {}");

        // Assert
        assertThat(toInt.type()).isInstanceOf(BasicType.class);
        assertThat(negated.expression()).isInstanceOf(UnaryExpression.class);
        assertThat(generic.type()).isInstanceOfSatisfying(ReferenceType.class,
                type -> assertThat(type.arguments()).hasSize(1));
        assertThat(intersection.type().name()).isEqualTo("Runnable");
        assertThat(intersection.additionalBounds()).extracting(ReferenceType::name).containsExactly("Serializable");
        assertThat(intersection.expression()).isInstanceOf(LambdaExpression.class);
    }

    /**
     * A parenthesized name followed by a binary operator is not a cast.
     */
    @Test
    @Tag("unit")
    void testParenthesizedNameBeforeOperatorIsNotACast() {
        // Act
        BinaryOperation sum = (BinaryOperation) parse("(a) + b");

        // Assert
        assertThat(sum.left()).isInstanceOf(ParenthesizedExpression.class);
    }

    @Test
    @Tag("unit")
    void testMethodReferences() {
        // Act
        MethodReference named = (MethodReference) parse("String::valueOf");
        MethodReference arrayConstructor = (MethodReference) parse("int[]::new");
        MethodReference generic = (MethodReference) parse("List<String>::size");
        MethodReference onThis = (MethodReference) parse("this::run");
        MethodReference onSuper = (MethodReference) parse("super::toString");

        // Assert
        assertThat(named.expression()).isInstanceOfSatisfying(MemberReference.class,
                reference -> assertThat(reference.member()).isEqualTo("String"));
        assertThat(named.method()).isEqualTo("valueOf");
        assertThat(arrayConstructor.type()).isEqualTo(new BasicType(arrayConstructor.position(), "int", 1));
        assertThat(arrayConstructor.method()).isEqualTo("new");
        assertThat(generic.type()).isInstanceOf(ReferenceType.class);
        assertThat(generic.expression()).isNull();
        assertThat(onThis.expression()).isInstanceOf(This.class);
        assertThat(onSuper.expression()).isInstanceOf(SuperReference.class);
    }

    /**
     * A method reference binds tighter than a cast or a binary operator.
     */
    @Test
    @Tag("unit")
    void testMethodReferenceOperandBinding() {
        // Act
        Cast cast = (Cast) parse("(Function<String, Integer>) Integer::parseInt");
        BinaryOperation sum = (BinaryOperation) parse("a + b::c");

        // Assert
        assertThat(cast.type().name()).isEqualTo("Function");
        assertThat(cast.expression()).isInstanceOfSatisfying(MethodReference.class, reference -> {
            assertThat(reference.method()).isEqualTo("parseInt");
            assertThat(reference.expression()).isInstanceOf(MemberReference.class);
        });
        assertThat(sum.left()).isInstanceOf(MemberReference.class);
        assertThat(sum.right()).isInstanceOfSatisfying(MethodReference.class,
                reference -> assertThat(reference.method()).isEqualTo("c"));
    }

    /**
     * Verifies array and class creators, including diamonds and anonymous classes.
     */
    @Test
    @Tag("unit")
    void testCreators() {
        // Act
        ArrayCreator sized = (ArrayCreator) parse("new int[3][]");
        ArrayCreator initialized = (ArrayCreator) parse("new String[] {\"a\"}");
        ClassCreator diamond = (ClassCreator) parse("new ArrayList<>()");
        ClassCreator anonymous = (ClassCreator) parse("new Runnable() { public void run() {} }");

        // Assert
        assertThat(sized.dimensions()).hasSize(1);
        assertThat(sized.emptyDimensions()).isEqualTo(1);
        assertThat(sized.initializer()).isNull();
        assertThat(initialized.initializer().initializers()).hasSize(1);
        assertThat(diamond.type().arguments()).isEmpty();
        assertThat(diamond.body()).isNull();
        assertThat(anonymous.body()).singleElement().isInstanceOf(MethodDeclaration.class);
    }

    @Test
    @Tag("unit")
    void testArrayCreatorNeedsDimensionOrInitializer() {
        // Act & Assert
        assertThatThrownBy(() -> parse("new int"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Expected array dimension");
    }

    @Test
    @Tag("unit")
    void testDiamondOutsideCreatorFails() {
        // Act & Assert
        assertThatThrownBy(() -> JavaFrontEnd.parseType("List<>"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Diamond not allowed here");
    }

    @Test
    @Tag("unit")
    void testBasicTypeArgumentFails() {
        // Act & Assert
        assertThatThrownBy(() -> JavaFrontEnd.parseType("List<int>"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Expected reference type");
    }

    @Test
    @Tag("unit")
    void testInnerClassCreator() {
        // Act
        MemberReference outer = (MemberReference) parse("outer.new Inner()");

        // Assert
        assertThat(outer.member()).isEqualTo("outer");
        assertThat(outer.selectors()).singleElement().isInstanceOfSatisfying(InnerClassCreator.class,
                creator -> assertThat(creator.type().name()).isEqualTo("Inner"));
    }

    /**
     * A dotted name is split into qualifier and member; the selectors that follow are kept in order.
     */
    @Test
    @Tag("unit")
    void testQualifiedNamesAndSelectors() {
        // Act
        MemberReference field = (MemberReference) parse("a.b.c");
        MethodInvocation call = (MethodInvocation) parse("foo.bar(1)[0].baz");

        // Assert
        assertThat(field.qualifier()).isEqualTo("a.b");
        assertThat(field.member()).isEqualTo("c");
        assertThat(call.qualifier()).isEqualTo("foo");
        assertThat(call.member()).isEqualTo("bar");
        assertThat(call.arguments()).hasSize(1);
        assertThat(call.selectors()).hasSize(2);
        assertThat(call.selectors().get(0)).isInstanceOf(ArraySelector.class);
        assertThat(call.selectors().get(1)).isInstanceOfSatisfying(MemberReference.class,
                reference -> assertThat(reference.member()).isEqualTo("baz"));
    }

    @Test
    @Tag("unit")
    void testExplicitGenericInvocation() {
        // Act
        MethodInvocation call = (MethodInvocation) parse("Collections.<String>emptyList()");

        // Assert
        assertThat(call.qualifier()).isEqualTo("Collections");
        assertThat(call.member()).isEqualTo("emptyList");
        assertThat(call.typeArguments()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testClassLiteralsAndQualifiedThis() {
        // Act
        ClassReference stringClass = (ClassReference) parse("String.class");
        ClassReference intArrayClass = (ClassReference) parse("int[].class");
        Expression voidClass = parse("void.class");
        This outerThis = (This) parse("Outer.this");

        // Assert
        assertThat(stringClass.type().name()).isEqualTo("String");
        assertThat(intArrayClass.type().dimensions()).isEqualTo(1);
        assertThat(voidClass).isInstanceOf(VoidClassReference.class);
        assertThat(outerThis.qualifier()).isEqualTo("Outer");
    }

    @Test
    @Tag("unit")
    void testLiteralWithSelectors() {
        // Act
        Literal literal = (Literal) parse("\"s\".length()");

        // Assert
        assertThat(literal.kind()).isEqualTo(TokenType.STRING);
        assertThat(literal.value()).isEqualTo("s");
        assertThat(literal.selectors()).singleElement().isInstanceOf(MethodInvocation.class);
    }

    /**
     * Verifies type tests with and without a binding, and record deconstruction.
     */
    @Test
    @Tag("unit")
    void testInstanceofPatterns() {
        // Act
        BinaryOperation guarded = (BinaryOperation) parse("obj instanceof String s && s.isEmpty()");
        InstanceOfExpression plain = (InstanceOfExpression) parse("obj instanceof java.util.List");
        InstanceOfExpression record = (InstanceOfExpression) parse("o instanceof Point(int x, var y)");
        InstanceOfExpression finalBinding = (InstanceOfExpression) parse("o instanceof final String s");

        // Assert
        assertThat(guarded.operator()).isEqualTo("&&");
        assertThat(guarded.left()).isInstanceOfSatisfying(InstanceOfExpression.class, test ->
                assertThat(test.pattern()).isInstanceOfSatisfying(TypePattern.class,
                        pattern -> assertThat(pattern.name()).isEqualTo("s")));
        assertThat(plain.type()).isInstanceOf(ReferenceType.class);
        assertThat(plain.pattern()).isNull();
        assertThat(record.pattern()).isInstanceOfSatisfying(RecordPattern.class,
                pattern -> assertThat(pattern.components()).hasSize(2));
        assertThat(finalBinding.pattern()).isInstanceOfSatisfying(TypePattern.class,
                pattern -> assertThat(pattern.modifiers()).containsExactly("final"));
    }

    @Test
    @Tag("unit")
    void testTrailingTokensAreRejected() {
        // Act & Assert
        assertThatThrownBy(() -> parse("1 2"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Expected end of input at line 1, column 3 (found '2')");
    }
}
