package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A class literal such as {@code String.class} or {@code int[].class}.
 */
public record ClassReference(Position position, Type type, List<Selector> selectors) implements Primary {

    public ClassReference {
        selectors = NodeLists.copyOf(selectors);
    }
}
