package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * {@code this}, optionally qualified by an enclosing class name ({@code Outer.this}).
 */
public record This(Position position, String qualifier, List<Selector> selectors) implements Primary, Selector {

    public This {
        selectors = NodeLists.copyOf(selectors);
    }
}
