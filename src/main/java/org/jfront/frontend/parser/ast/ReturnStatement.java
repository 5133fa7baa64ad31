package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the {@code return} keyword is.
 * @param expression The returned value, or {@code null}.
 */
public record ReturnStatement(Position position, Expression expression) implements Statement {
}
