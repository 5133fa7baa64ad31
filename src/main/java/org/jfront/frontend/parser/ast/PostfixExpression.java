package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * A postfix increment or decrement.
 */
public record PostfixExpression(Position position, String operator, Expression operand) implements Expression {
}
