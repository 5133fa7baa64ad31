package org.jfront.frontend.parser;

import org.jfront.api.JavaFrontEnd;
import org.jfront.frontend.TreeWalker;
import org.jfront.frontend.parser.ast.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for switch statements and switch expressions, their labels and patterns,
 * and the places where {@code yield} is a statement.
 */
public class ParserSwitchTest {

    private static List<Statement> parseBody(String body) {
        CompilationUnit unit = JavaFrontEnd.parseSource("class A { void m() {" + body + "} }");
        ClassDeclaration declaration = (ClassDeclaration) unit.types().get(0);
        return ((MethodDeclaration) declaration.body().get(0)).body();
    }

    /**
     * Consecutive labels with colons are grouped into one case with the statements that follow.
     */
    @Test
    @Tag("unit")
    void testColonSwitchStatement() {
        // Act
        SwitchStatement statement = (SwitchStatement) parseBody(
                "switch (x) { case 1: case 2: a(); break; default: b(); }").get(0);

        // Assert
        assertThat(statement.rules()).isEmpty();
        assertThat(statement.cases()).hasSize(2);
        assertThat(statement.cases().get(0).labels()).hasSize(2);
        assertThat(statement.cases().get(0).statements()).hasSize(2);
        assertThat(statement.cases().get(1).labels()).singleElement().isInstanceOf(DefaultLabel.class);
    }

    @Test
    @Tag("unit")
    void testArrowSwitchStatement() {
        // Act
        SwitchStatement statement = (SwitchStatement) parseBody(
                "switch (day) { case MONDAY, FRIDAY -> work(); case SUNDAY -> { rest(); } "
                        + "default -> throw new IllegalStateException(); }").get(0);

        // Assert
        assertThat(statement.cases()).isEmpty();
        assertThat(statement.rules()).hasSize(3);
        assertThat(statement.rules().get(0).labels()).hasSize(2);
        assertThat(statement.rules().get(0).action()).isInstanceOf(MethodInvocation.class);
        assertThat(statement.rules().get(1).action()).isInstanceOf(BlockStatement.class);
        assertThat(statement.rules().get(2).action()).isInstanceOf(ThrowStatement.class);
    }

    /**
     * {@code yield} is a statement inside the block of an arrow rule of a switch expression.
     */
    @Test
    @Tag("unit")
    void testSwitchExpressionWithYield() {
        // Act
        SwitchExpression expression = (SwitchExpression) JavaFrontEnd.parseExpression(
                "switch (k) { case 1 -> 10; case 2 -> { int t = k * 2; yield t; } default -> { yield 0; } }");

        // Assert
        assertThat(expression.rules()).hasSize(3);
        assertThat(expression.rules().get(0).action()).isInstanceOf(Literal.class);
        BlockStatement block = (BlockStatement) expression.rules().get(1).action();
        assertThat(block.statements()).extracting(statement -> statement.getClass().getSimpleName())
                .containsExactly("LocalVariableDeclaration", "YieldStatement");
    }

    @Test
    @Tag("unit")
    void testColonSwitchExpressionWithYield() {
        // Act
        SwitchExpression expression = (SwitchExpression) JavaFrontEnd.parseExpression(
                "switch (k) { case 1: yield 10; default: yield 0; }");

        // Assert
        assertThat(expression.cases()).hasSize(2);
        assertThat(expression.cases()).allSatisfy(group ->
                assertThat(group.statements()).singleElement().isInstanceOf(YieldStatement.class));
    }

    /**
     * Outside a switch expression {@code yield} is an ordinary name.
     */
    @Test
    @Tag("unit")
    void testYieldAsIdentifierOutsideSwitch() {
        // Act
        List<Statement> body = parseBody("int yield = 1; yield = 2;");

        // Assert
        assertThat(body.get(0)).isInstanceOf(LocalVariableDeclaration.class);
        assertThat(body.get(1)).isInstanceOfSatisfying(StatementExpression.class,
                statement -> assertThat(statement.expression()).isInstanceOf(Assignment.class));
    }

    /**
     * Once the switch expression has closed, {@code yield} is an ordinary name again.
     */
    @Test
    @Tag("unit")
    void testYieldAsIdentifierAfterSwitchExpression() {
        // Act
        List<Statement> body = parseBody("int r = switch (x) { case 1 -> { yield 1; } default -> 0; }; yield(r);");

        // Assert
        assertThat(body).hasSize(2);
        assertThat(TreeWalker.collect(body.get(0), YieldStatement.class)).hasSize(1);
        assertThat(body.get(1)).isInstanceOfSatisfying(StatementExpression.class, statement ->
                assertThat(statement.expression()).isInstanceOfSatisfying(MethodInvocation.class,
                        call -> assertThat(call.member()).isEqualTo("yield")));
    }

    /**
     * A lambda body inside a switch expression arm does not inherit the right to yield.
     */
    @Test
    @Tag("unit")
    void testYieldIsResetInsideLambdaBody() {
        // Act
        SwitchExpression expression = (SwitchExpression) JavaFrontEnd.parseExpression(
                "switch (k) { case 1 -> { Runnable r = () -> { yield(); }; yield 1; } default -> 0; }");

        // Assert
        List<YieldStatement> yields = TreeWalker.collect(expression, YieldStatement.class);
        assertThat(yields).hasSize(1);
        List<MethodInvocation> calls = TreeWalker.collect(expression, MethodInvocation.class);
        assertThat(calls).extracting(MethodInvocation::member).containsExactly("yield");
    }

    /**
     * Verifies type patterns with guards, record patterns and the combined {@code case null, default} label.
     */
    @Test
    @Tag("unit")
    void testPatternLabels() {
        // Act
        SwitchExpression expression = (SwitchExpression) JavaFrontEnd.parseExpression(
                "switch (o) { case Integer i when i > 0 -> 1; case String s -> 2; "
                        + "case Point(int x, int y) -> 3; case null, default -> 4; }");

        // Assert
        List<SwitchRule> rules = expression.rules();
        assertThat(rules).hasSize(4);
        assertThat(rules.get(0).labels()).singleElement().isInstanceOfSatisfying(TypePattern.class,
                pattern -> assertThat(pattern.name()).isEqualTo("i"));
        assertThat(rules.get(0).guard()).isInstanceOf(BinaryOperation.class);
        assertThat(rules.get(1).guard()).isNull();
        assertThat(rules.get(2).labels()).singleElement().isInstanceOfSatisfying(RecordPattern.class,
                pattern -> assertThat(pattern.components()).hasSize(2));
        assertThat(rules.get(3).labels()).hasSize(2);
        assertThat(rules.get(3).labels().get(0)).isInstanceOf(Literal.class);
        assertThat(rules.get(3).labels().get(1)).isInstanceOf(DefaultLabel.class);
    }

    /**
     * A constant name as a label is an expression, not a pattern.
     */
    @Test
    @Tag("unit")
    void testConstantLabel() {
        // Act
        SwitchStatement statement = (SwitchStatement) parseBody("switch (c) { case RED: break; }").get(0);

        // Assert
        assertThat(statement.cases().get(0).labels()).singleElement().isInstanceOfSatisfying(MemberReference.class,
                reference -> assertThat(reference.member()).isEqualTo("RED"));
    }

    @Test
    @Tag("unit")
    void testMixedCaseKindsFail() {
        // Act & Assert
        assertThatThrownBy(() -> parseBody("switch (x) { case 1 -> a(); case 2: b(); }"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Different case kinds used in the switch");
    }

    @Test
    @Tag("unit")
    void testMultipleDefaultLabelsFail() {
        // Act & Assert
        assertThatThrownBy(() -> parseBody("switch (x) { default: a(); default: b(); }"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Multiple default labels");
    }

    @Test
    @Tag("unit")
    void testMultipleGuardsInOneGroupFail() {
        // Act & Assert
        assertThatThrownBy(() -> parseBody("switch (o) { case A a when x: case B b when y: break; }"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Multiple 'when' clauses for one switch label group");
    }
}
