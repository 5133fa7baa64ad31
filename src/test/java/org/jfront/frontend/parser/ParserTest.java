package org.jfront.frontend.parser;

import org.jfront.api.JavaFrontEnd;
import org.jfront.frontend.lexer.Lexer;
import org.jfront.frontend.parser.ast.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Parser}, covering compilation units, declarations,
 * types and statements. Expressions and switches have their own test classes.
 */
public class ParserTest {

    private static ClassDeclaration parseClass(String source) {
        CompilationUnit unit = JavaFrontEnd.parseSource(source);
        return (ClassDeclaration) unit.types().get(0);
    }

    private static MethodDeclaration parseMethod(String body) {
        ClassDeclaration declaration = parseClass("class A { void m(int[] xs, String... rest) {" + body + "} }");
        return (MethodDeclaration) declaration.body().get(0);
    }

    /**
     * Verifies that the package declaration, imports and top-level types are recognized.
     */
    @Test
    @Tag("unit")
    void testCompilationUnitStructure() {
        // Arrange
        String source = "package a.b;\nimport java.util.List;\nimport static java.lang.Math.*;\npublic class A {}";

        // Act
        CompilationUnit unit = JavaFrontEnd.parseSource(source);

        // Assert
        assertThat(unit.packageDeclaration().name()).isEqualTo("a.b");
        assertThat(unit.imports()).extracting(Import::path, Import::isStatic, Import::wildcard)
                .containsExactly(
                        tuple("java.util.List", false, false),
                        tuple("java.lang.Math", true, true));
        assertThat(unit.types()).singleElement().isInstanceOfSatisfying(ClassDeclaration.class,
                declaration -> assertThat(declaration.name()).isEqualTo("A"));
    }

    @Test
    @Tag("unit")
    void testEmptySourceGivesEmptyUnit() {
        // Act
        CompilationUnit unit = JavaFrontEnd.parseSource("");

        // Assert
        assertThat(unit.packageDeclaration()).isNull();
        assertThat(unit.imports()).isEmpty();
        assertThat(unit.types()).isEmpty();
    }

    /**
     * Annotations in front of {@code package} belong to the package declaration; stray semicolons are skipped.
     */
    @Test
    @Tag("unit")
    void testAnnotatedPackageAndStraySemicolons() {
        // Arrange
        String source = "@Deprecated package p; ; class A {} ; class B {}";

        // Act
        CompilationUnit unit = JavaFrontEnd.parseSource(source);

        // Assert
        assertThat(unit.packageDeclaration().annotations()).extracting(Annotation::name).containsExactly("Deprecated");
        assertThat(unit.types()).hasSize(2);
    }

    /**
     * Verifies a class header and every kind of class member.
     */
    @Test
    @Tag("unit")
    void testClassDeclarationWithMembers() {
        // Arrange
        String source = """
                /** Doc. */
                public final class Box<T extends Comparable<T>> extends Base implements Runnable, java.io.Serializable {
                    private static final int SIZE = 10, OTHER;
                    protected int[] values;
                    static { init(); }
                    public Box(T value) throws IllegalStateException { this.value = value; }
                    public <R> List<R> map(Function<? super T, ? extends R> f) { return null; }
                    abstract void run();
                    class Inner {}
                }
                """;

        // Act
        ClassDeclaration box = parseClass(source);

        // Assert
        assertThat(box.name()).isEqualTo("Box");
        assertThat(box.documentation()).isEqualTo("/** Doc. */");
        assertThat(box.modifiers()).containsExactly("public", "final");
        assertThat(box.typeParameters()).extracting(TypeParameter::name).containsExactly("T");
        assertThat(box.typeParameters().get(0).bounds()).extracting(ReferenceType::name).containsExactly("Comparable");
        assertThat(box.extendsType().name()).isEqualTo("Base");
        assertThat(box.implementsTypes()).extracting(ReferenceType::qualifiedName)
                .containsExactly("Runnable", "java.io.Serializable");
        assertThat(box.body()).extracting(member -> member.getClass().getSimpleName()).containsExactly(
                "FieldDeclaration", "FieldDeclaration", "Initializer", "ConstructorDeclaration",
                "MethodDeclaration", "MethodDeclaration", "ClassDeclaration");

        FieldDeclaration constants = (FieldDeclaration) box.body().get(0);
        assertThat(constants.modifiers()).containsExactly("private", "static", "final");
        assertThat(constants.declarators()).extracting(VariableDeclarator::name).containsExactly("SIZE", "OTHER");
        assertThat(constants.declarators().get(1).initializer()).isNull();

        FieldDeclaration values = (FieldDeclaration) box.body().get(1);
        assertThat(values.type()).isEqualTo(new BasicType(values.type().position(), "int", 1));

        ConstructorDeclaration constructor = (ConstructorDeclaration) box.body().get(3);
        assertThat(constructor.throwsTypes()).containsExactly("IllegalStateException");
        assertThat(constructor.compact()).isFalse();

        MethodDeclaration map = (MethodDeclaration) box.body().get(4);
        assertThat(map.typeParameters()).extracting(TypeParameter::name).containsExactly("R");
        assertThat(map.parameters().get(0).type()).isInstanceOfSatisfying(ReferenceType.class, type ->
                assertThat(type.arguments()).extracting(TypeArgument::patternType).containsExactly("super", "extends"));

        MethodDeclaration run = (MethodDeclaration) box.body().get(5);
        assertThat(run.returnType()).isNull();
        assertThat(run.body()).isNull();
    }

    /**
     * The position of a declaration is the position of its first modifier.
     */
    @Test
    @Tag("unit")
    void testDeclarationPositionIncludesModifiers() {
        // Act
        ClassDeclaration declaration = parseClass("\n  public class A {}");

        // Assert
        assertThat(declaration.position().line()).isEqualTo(2);
        assertThat(declaration.position().column()).isEqualTo(3);
    }

    /**
     * Verifies interfaces with constants and default methods, and sealed hierarchies.
     */
    @Test
    @Tag("unit")
    void testInterfaceAndSealedTypes() {
        // Arrange
        String source = """
                public sealed interface Shape extends Comparable<Shape> permits Circle, Square {
                    double PI = 3.14;
                    double area();
                    default String name() { return "shape"; }
                }
                non-sealed class Square implements Shape {}
                """;

        // Act
        CompilationUnit unit = JavaFrontEnd.parseSource(source);

        // Assert
        InterfaceDeclaration shape = (InterfaceDeclaration) unit.types().get(0);
        assertThat(shape.modifiers()).containsExactly("public", "sealed");
        assertThat(shape.permittedTypes()).extracting(ReferenceType::name).containsExactly("Circle", "Square");
        assertThat(shape.body().get(0)).isInstanceOf(ConstantDeclaration.class);
        assertThat(((MethodDeclaration) shape.body().get(2)).modifiers()).containsExactly("default");

        ClassDeclaration square = (ClassDeclaration) unit.types().get(1);
        assertThat(square.modifiers()).containsExactly("non-sealed");
    }

    @Test
    @Tag("unit")
    void testEnumDeclaration() {
        // Arrange
        String source = """
                enum Color implements Supplier<String> {
                    RED("r"), GREEN { }, ;
                    private final String code = "";
                }
                """;

        // Act
        EnumDeclaration color = (EnumDeclaration) JavaFrontEnd.parseSource(source).types().get(0);

        // Assert
        assertThat(color.constants()).extracting(EnumConstantDeclaration::name).containsExactly("RED", "GREEN");
        assertThat(color.constants().get(0).arguments()).hasSize(1);
        assertThat(color.constants().get(0).body()).isNull();
        assertThat(color.constants().get(1).body()).isEmpty();
        assertThat(color.body()).singleElement().isInstanceOf(FieldDeclaration.class);
    }

    /**
     * Records take their components in the header and may declare a compact constructor.
     */
    @Test
    @Tag("unit")
    void testRecordDeclaration() {
        // Arrange
        String source = """
                record Point(int x, int y) implements Serializable {
                    Point { if (x < 0) throw new IllegalArgumentException(); }
                    static Point origin() { return new Point(0, 0); }
                }
                """;

        // Act
        RecordDeclaration point = (RecordDeclaration) JavaFrontEnd.parseSource(source).types().get(0);

        // Assert
        assertThat(point.components()).extracting(FormalParameter::name).containsExactly("x", "y");
        assertThat(point.implementsTypes()).extracting(ReferenceType::name).containsExactly("Serializable");
        ConstructorDeclaration compact = (ConstructorDeclaration) point.body().get(0);
        assertThat(compact.compact()).isTrue();
        assertThat(compact.body()).singleElement().isInstanceOf(IfStatement.class);
    }

    /**
     * A field or variable named {@code record} does not start a record declaration.
     */
    @Test
    @Tag("unit")
    void testRecordAsIdentifier() {
        // Act
        MethodDeclaration method = parseMethod("record r = null; record.run();");

        // Assert
        assertThat(method.body()).extracting(statement -> statement.getClass().getSimpleName())
                .containsExactly("LocalVariableDeclaration", "StatementExpression");
    }

    @Test
    @Tag("unit")
    void testAnnotationsAndAnnotationDeclaration() {
        // Arrange
        String source = """
                @interface Marker { String value() default "x"; int[] ids() default {1, 2}; }
                @Deprecated @SuppressWarnings({"a", "b"}) @Marker(value = "v", ids = 1) class D {}
                """;

        // Act
        CompilationUnit unit = JavaFrontEnd.parseSource(source);

        // Assert
        AnnotationDeclaration marker = (AnnotationDeclaration) unit.types().get(0);
        assertThat(marker.body()).extracting(member -> ((AnnotationMethod) member).name()).containsExactly("value", "ids");
        assertThat(((AnnotationMethod) marker.body().get(1)).defaultValue()).isInstanceOf(ElementArrayValue.class);

        ClassDeclaration d = (ClassDeclaration) unit.types().get(1);
        assertThat(d.annotations()).extracting(Annotation::name).containsExactly("Deprecated", "SuppressWarnings", "Marker");
        assertThat(d.annotations().get(1).value()).isInstanceOfSatisfying(ElementArrayValue.class,
                array -> assertThat(array.values()).hasSize(2));
        assertThat(d.annotations().get(2).pairs()).extracting(ElementValuePair::name).containsExactly("value", "ids");
    }

    /**
     * A compilation unit may contain top-level methods.
     */
    @Test
    @Tag("unit")
    void testTopLevelMethod() {
        // Act
        CompilationUnit unit = JavaFrontEnd.parseSource("void main() { System.out.println(1); }");

        // Assert
        assertThat(unit.types()).singleElement().isInstanceOfSatisfying(MethodDeclaration.class,
                method -> assertThat(method.name()).isEqualTo("main"));
    }

    /**
     * Verifies nested type arguments, where the closing {@code >>} arrives as two tokens.
     */
    @Test
    @Tag("unit")
    void testNestedGenericType() {
        // Act
        Type type = JavaFrontEnd.parseType("Map<String, List<int[]>>");

        // Assert
        ReferenceType map = (ReferenceType) type;
        assertThat(map.name()).isEqualTo("Map");
        assertThat(map.arguments()).hasSize(2);
        ReferenceType list = (ReferenceType) map.arguments().get(1).type();
        assertThat(list.arguments().get(0).type()).isEqualTo(new BasicType(list.arguments().get(0).position(), "int", 1));
    }

    @Test
    @Tag("unit")
    void testQualifiedArrayTypeAndWildcards() {
        // Act
        ReferenceType entry = (ReferenceType) JavaFrontEnd.parseType("java.util.Map.Entry<?, ? extends Number>[]");

        // Assert
        assertThat(entry.qualifiedName()).isEqualTo("java.util.Map.Entry");
        assertThat(entry.dimensions()).isEqualTo(1);
        assertThat(entry.innermost().arguments()).extracting(TypeArgument::patternType).containsExactly("?", "extends");
    }

    /**
     * Verifies every kind of statement in a method body.
     */
    @Test
    @Tag("unit")
    void testStatements() {
        // Arrange
        String body = """
                int total = 0;
                final var list = new ArrayList<String>();
                outer:
                for (int i = 0, j = 1; i < xs.length; i++, j--) {
                    if (xs[i] > 0) continue outer; else break;
                }
                for (String s : rest) total += s.length();
                for (;;) { break; }
                while (total > 0) total--;
                do { total++; } while (total < 10);
                try (var in = open(); out) { use(in); } catch (IOException | RuntimeException e) { throw e; } finally { close(); }
                synchronized (this) { notify(); }
                assert total > 0 : "positive";
                class Local {}
                ;
                return;
                """;

        // Act
        MethodDeclaration method = parseMethod(body);

        // Assert
        assertThat(method.parameters()).extracting(FormalParameter::varargs).containsExactly(false, true);
        assertThat(method.body()).extracting(statement -> statement.getClass().getSimpleName()).containsExactly(
                "LocalVariableDeclaration", "LocalVariableDeclaration", "LabeledStatement", "ForStatement",
                "ForStatement", "WhileStatement", "DoStatement", "TryStatement", "SynchronizedStatement",
                "AssertStatement", "LocalTypeDeclaration", "EmptyStatement", "ReturnStatement");

        LocalVariableDeclaration list = (LocalVariableDeclaration) method.body().get(1);
        assertThat(list.modifiers()).containsExactly("final");

        LabeledStatement outer = (LabeledStatement) method.body().get(2);
        assertThat(outer.label()).isEqualTo("outer");
        ForControl control = (ForControl) ((ForStatement) outer.statement()).control();
        assertThat(control.declaration().declarators()).extracting(VariableDeclarator::name).containsExactly("i", "j");
        assertThat(control.condition()).isInstanceOf(BinaryOperation.class);
        assertThat(control.update()).hasSize(2);

        ForStatement each = (ForStatement) method.body().get(4);
        assertThat(each.control()).isInstanceOfSatisfying(EnhancedForControl.class,
                enhanced -> assertThat(enhanced.variable().declarators().get(0).name()).isEqualTo("s"));

        TryStatement tryStatement = (TryStatement) method.body().get(7);
        assertThat(tryStatement.resources()).extracting(TryResource::name).containsExactly("in", null);
        assertThat(tryStatement.catches().get(0).parameter().types()).containsExactly("IOException", "RuntimeException");
        assertThat(tryStatement.finallyBlock()).isNotNull();

        AssertStatement assertStatement = (AssertStatement) method.body().get(9);
        assertThat(assertStatement.value()).isInstanceOf(Literal.class);
    }

    /**
     * An empty for header parses to a control with no parts.
     */
    @Test
    @Tag("unit")
    void testEmptyForControl() {
        // Act
        MethodDeclaration method = parseMethod("for (;;) {}");

        // Assert
        ForControl control = (ForControl) ((ForStatement) method.body().get(0)).control();
        assertThat(control.declaration()).isNull();
        assertThat(control.init()).isEmpty();
        assertThat(control.condition()).isNull();
        assertThat(control.update()).isEmpty();
    }

    /**
     * Statements that look like declarations at first are re-parsed as expressions.
     */
    @Test
    @Tag("unit")
    void testDeclarationAndExpressionStatementsAreDistinguished() {
        // Act
        MethodDeclaration method = parseMethod("List<String> names = List.of(); a.b.c = 2; foo(1); x++; int[] ys[] = {};");

        // Assert
        assertThat(method.body()).extracting(statement -> statement.getClass().getSimpleName()).containsExactly(
                "LocalVariableDeclaration", "StatementExpression", "StatementExpression", "StatementExpression",
                "LocalVariableDeclaration");
        LocalVariableDeclaration ys = (LocalVariableDeclaration) method.body().get(4);
        assertThat(ys.type().dimensions()).isEqualTo(1);
        assertThat(ys.declarators().get(0).dimensions()).isEqualTo(1);
        assertThat(ys.declarators().get(0).initializer()).isInstanceOf(ArrayInitializer.class);
    }

    /**
     * Backtracking leaves no open checkpoints behind.
     */
    @Test
    @Tag("unit")
    void testSpeculativeParsingClosesAllMarkers() {
        // Arrange
        TokenCursor cursor = new TokenCursor(new Lexer(
                "class A { void m() { foo(1); List<String> x = (List<String>) y; Runnable r = () -> {}; } }"));
        Parser parser = new Parser(cursor);

        // Act
        CompilationUnit unit = parser.parse();

        // Assert
        assertThat(cursor.markerDepth()).isZero();
        assertThat(unit.types()).hasSize(1);
    }

    /**
     * A parse produces the same tree when run twice over the same text.
     */
    @Test
    @Tag("unit")
    void testParsingIsDeterministic() {
        // Arrange
        String source = "class A { int f(int a) { return a > 0 ? a * 2 : -a; } }";

        // Act
        CompilationUnit first = JavaFrontEnd.parseSource(source);
        CompilationUnit second = JavaFrontEnd.parseSource(source);

        // Assert
        assertThat(first).isEqualTo(second);
        assertThat(first.getChildren()).containsExactly(first.types().get(0));
    }

    @Test
    @Tag("unit")
    void testChildrenFollowComponentOrder() {
        // Act
        IfStatement ifStatement = (IfStatement) parseMethod("if (a) b(); else c();").body().get(0);

        // Assert
        List<AstNode> children = ifStatement.getChildren();
        assertThat(children).containsExactly(ifStatement.condition(), ifStatement.thenStatement(), ifStatement.elseStatement());
    }
}
