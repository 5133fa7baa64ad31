package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the {@code break} keyword is.
 * @param label The target label, or {@code null}.
 */
public record BreakStatement(Position position, String label) implements Statement {
}
