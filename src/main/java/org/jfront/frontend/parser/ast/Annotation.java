package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * An annotation application. A marker annotation has neither a value nor pairs;
 * {@code @A(x)} has a value; {@code @A(k = x)} has pairs.
 *
 * @param position Where the {@code @} is.
 * @param name The qualified annotation type name.
 * @param value The single element value, or {@code null}.
 * @param pairs The element-value pairs.
 */
public record Annotation(
        Position position,
        String name,
        ElementValue value,
        List<ElementValuePair> pairs
) implements ElementValue {

    public Annotation {
        pairs = NodeLists.copyOf(pairs);
    }
}
