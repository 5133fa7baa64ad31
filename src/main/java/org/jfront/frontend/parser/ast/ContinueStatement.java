package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the {@code continue} keyword is.
 * @param label The target label, or {@code null}.
 */
public record ContinueStatement(Position position, String label) implements Statement {
}
