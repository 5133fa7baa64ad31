package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the {@code for} keyword is.
 * @param control Either a {@link ForControl} or an {@link EnhancedForControl}.
 * @param body The loop body.
 */
public record ForStatement(Position position, ForLoopControl control, Statement body) implements Statement {
}
