package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the {@code if} keyword is.
 * @param condition The parenthesized condition.
 * @param thenStatement The statement executed when the condition holds.
 * @param elseStatement The {@code else} branch, or {@code null}.
 */
public record IfStatement(
        Position position,
        Expression condition,
        Statement thenStatement,
        Statement elseStatement
) implements Statement {
}
