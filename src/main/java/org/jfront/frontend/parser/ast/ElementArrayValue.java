package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A brace-enclosed list of annotation element values.
 */
public record ElementArrayValue(Position position, List<ElementValue> values) implements ElementValue {

    public ElementArrayValue {
        values = NodeLists.copyOf(values);
    }
}
