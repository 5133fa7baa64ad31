package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * An instance or static initializer block.
 *
 * @param position Where the block (or the {@code static} keyword) begins.
 * @param isStatic Whether the initializer is static.
 * @param block The initializer's body.
 */
public record Initializer(Position position, boolean isStatic, BlockStatement block) implements Member {
}
