package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * A binary infix operation. Operations of equal precedence nest to the left.
 */
public record BinaryOperation(Position position, String operator, Expression left, Expression right) implements Expression {
}
