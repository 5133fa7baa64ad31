package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A bare {@code super} used as the qualifier of a method reference, as in {@code super::toString}.
 */
public record SuperReference(Position position, String qualifier, List<Selector> selectors) implements Primary {

    public SuperReference {
        selectors = NodeLists.copyOf(selectors);
    }
}
