package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * An expression used as a statement, such as an assignment or a method call.
 */
public record StatementExpression(Position position, Expression expression) implements Statement {
}
