package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * @param position Where the parameter name is.
 * @param name The type variable.
 * @param bounds The bounds joined by {@code &} in the {@code extends} clause.
 */
public record TypeParameter(Position position, String name, List<ReferenceType> bounds) implements AstNode {

    public TypeParameter {
        bounds = NodeLists.copyOf(bounds);
    }
}
