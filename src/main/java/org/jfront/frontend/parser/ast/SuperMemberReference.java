package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * {@code super.field}, or {@code Outer.super.field} with a qualifier.
 */
public record SuperMemberReference(
        Position position,
        String qualifier,
        String member,
        List<Selector> selectors
) implements Primary, Selector {

    public SuperMemberReference {
        selectors = NodeLists.copyOf(selectors);
    }
}
