package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * A prefix operator applied to an operand: {@code ++ -- ! ~ + -}.
 */
public record UnaryExpression(Position position, String operator, Expression operand) implements Expression {
}
