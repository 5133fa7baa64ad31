package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * @param position Where the opening parenthesis is.
 * @param type The target type.
 * @param additionalBounds The further interface types of an intersection cast such as
 *                         {@code (Runnable & Serializable)}; empty for an ordinary cast.
 * @param expression The converted operand.
 */
public record Cast(Position position, Type type, List<ReferenceType> additionalBounds, Expression expression)
        implements Expression {

    public Cast {
        additionalBounds = NodeLists.copyOf(additionalBounds);
    }
}
