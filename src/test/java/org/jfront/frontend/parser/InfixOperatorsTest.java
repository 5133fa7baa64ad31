package org.jfront.frontend.parser;

import org.jfront.frontend.lexer.Position;
import org.jfront.frontend.lexer.Token;
import org.jfront.frontend.lexer.TokenType;
import org.jfront.frontend.parser.ast.BinaryOperation;
import org.jfront.frontend.parser.ast.Expression;
import org.jfront.frontend.parser.ast.InstanceOfExpression;
import org.jfront.frontend.parser.ast.Literal;
import org.jfront.frontend.parser.ast.ReferenceType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the precedence folding in {@link InfixOperators}.
 */
public class InfixOperatorsTest {

    private static Literal number(String text, int column) {
        return new Literal(new Position(1, column), TokenType.DECIMAL_INTEGER, text, text, List.of());
    }

    private static InfixOperators.Operator operator(String symbol, int column) {
        Token token = new Token(TokenType.OPERATOR, symbol, new Position(1, column));
        return InfixOperators.Operator.binary(token, symbol);
    }

    /**
     * Multiplication binds tighter than addition.
     */
    @Test
    @Tag("unit")
    void testHigherPrecedenceNestsDeeper() {
        // Arrange
        List<Expression> operands = List.of(number("1", 1), number("2", 5), number("3", 9));
        List<InfixOperators.Operator> operators = List.of(operator("+", 3), operator("*", 7));

        // Act
        Expression folded = InfixOperators.fold(operands, operators);

        // Assert
        assertThat(folded).isInstanceOf(BinaryOperation.class);
        BinaryOperation sum = (BinaryOperation) folded;
        assertThat(sum.operator()).isEqualTo("+");
        assertThat(((Literal) sum.left()).text()).isEqualTo("1");
        assertThat(sum.right()).isInstanceOfSatisfying(BinaryOperation.class,
                product -> assertThat(product.operator()).isEqualTo("*"));
    }

    /**
     * Operators of equal precedence associate to the left.
     */
    @Test
    @Tag("unit")
    void testEqualPrecedenceNestsLeft() {
        // Arrange
        List<Expression> operands = List.of(number("1", 1), number("2", 5), number("3", 9));
        List<InfixOperators.Operator> operators = List.of(operator("-", 3), operator("-", 7));

        // Act
        BinaryOperation folded = (BinaryOperation) InfixOperators.fold(operands, operators);

        // Assert
        assertThat(folded.left()).isInstanceOf(BinaryOperation.class);
        assertThat(((Literal) folded.right()).text()).isEqualTo("3");
        assertThat(folded.position()).isEqualTo(new Position(1, 1));
    }

    /**
     * A type test takes no right operand and may be combined with lower precedence operators.
     */
    @Test
    @Tag("unit")
    void testTypeTestFollowedByLogicalOperator() {
        // Arrange
        Token instanceofToken = new Token(TokenType.KEYWORD, "instanceof", new Position(1, 3));
        ReferenceType type = new ReferenceType(new Position(1, 14), "String", List.of(), null, 0);
        List<Expression> operands = Arrays.asList(number("1", 1), null, number("2", 24));
        List<InfixOperators.Operator> operators = List.of(
                new InfixOperators.Operator(instanceofToken, "instanceof", type, null),
                operator("&&", 21));

        // Act
        BinaryOperation folded = (BinaryOperation) InfixOperators.fold(operands, operators);

        // Assert
        assertThat(folded.operator()).isEqualTo("&&");
        assertThat(folded.left()).isInstanceOfSatisfying(InstanceOfExpression.class,
                test -> assertThat(test.type()).isSameAs(type));
    }

    @Test
    @Tag("unit")
    void testTypeTestFollowedByArithmeticFails() {
        // Arrange
        Token instanceofToken = new Token(TokenType.KEYWORD, "instanceof", new Position(1, 3));
        ReferenceType type = new ReferenceType(new Position(1, 14), "String", List.of(), null, 0);
        List<Expression> operands = Arrays.asList(number("1", 1), null, number("2", 24));
        List<InfixOperators.Operator> operators = List.of(
                new InfixOperators.Operator(instanceofToken, "instanceof", type, null),
                operator("+", 21));

        // Act & Assert
        assertThatThrownBy(() -> InfixOperators.fold(operands, operators))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Unexpected operator '+' after type test");
    }

    @Test
    @Tag("unit")
    void testMismatchedChainIsUsageError() {
        // Arrange
        List<Expression> operands = List.of(number("1", 1));
        List<InfixOperators.Operator> operators = List.of(operator("+", 3));

        // Act & Assert
        assertThatThrownBy(() -> InfixOperators.fold(operands, operators))
                .isInstanceOf(ParserUsageException.class);
    }
}
