package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * A type pattern binding a variable, as in {@code obj instanceof String s}.
 *
 * @param position Where the pattern begins.
 * @param modifiers The modifiers, normally at most {@code final}.
 * @param annotations The annotations applied to the binding.
 * @param type The tested type.
 * @param name The binding variable.
 */
public record TypePattern(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        Type type,
        String name
) implements Pattern {

    public TypePattern {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
    }
}
