package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

public record VoidClassReference(Position position, List<Selector> selectors) implements Primary {

    public VoidClassReference {
        selectors = NodeLists.copyOf(selectors);
    }
}
