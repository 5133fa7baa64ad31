package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A brace-enclosed array initializer such as {@code {1, 2, {3}}}.
 */
public record ArrayInitializer(Position position, List<VariableInitializer> initializers) implements VariableInitializer {

    public ArrayInitializer {
        initializers = NodeLists.copyOf(initializers);
    }
}
