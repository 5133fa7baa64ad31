package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * A primitive type such as {@code int} or {@code boolean[]}.
 */
public record BasicType(Position position, String name, int dimensions) implements Type {

    @Override
    public BasicType withDimensions(int dimensions) {
        return new BasicType(position, name, dimensions);
    }
}
