package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the variable name is.
 * @param name The variable name.
 * @param dimensions Array dimensions written after the name, as in {@code int a[]}.
 * @param initializer The initializer, or {@code null}.
 */
public record VariableDeclarator(
        Position position,
        String name,
        int dimensions,
        VariableInitializer initializer
) implements AstNode {
}
