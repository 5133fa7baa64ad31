package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * Produces the value of an enclosing switch expression.
 */
public record YieldStatement(Position position, Expression expression) implements Statement {
}
