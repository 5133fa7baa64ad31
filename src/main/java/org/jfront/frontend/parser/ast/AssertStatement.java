package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the {@code assert} keyword is.
 * @param condition The asserted condition.
 * @param value The detail message expression after {@code :}, or {@code null}.
 */
public record AssertStatement(Position position, Expression condition, Expression value) implements Statement {
}
