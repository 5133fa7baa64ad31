package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the {@code import} keyword is.
 * @param path The imported name, without a trailing {@code .*}.
 * @param isStatic Whether this is a static import.
 * @param wildcard Whether the import ends with {@code .*}.
 */
public record Import(Position position, String path, boolean isStatic, boolean wildcard) implements AstNode {
}
