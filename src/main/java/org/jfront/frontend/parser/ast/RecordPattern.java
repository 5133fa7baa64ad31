package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A deconstruction pattern such as {@code Point(int x, var y)}. Components may nest.
 */
public record RecordPattern(Position position, ReferenceType type, List<Pattern> components) implements Pattern {

    public RecordPattern {
        components = NodeLists.copyOf(components);
    }
}
