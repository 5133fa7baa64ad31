package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * A method, constructor or lambda parameter, or a record component.
 *
 * @param position Where the parameter begins, including modifiers and annotations.
 * @param modifiers The modifiers, normally at most {@code final}.
 * @param annotations The annotations applied to the parameter.
 * @param type The declared type, including any dimensions written after the name.
 * @param name The parameter name.
 * @param varargs Whether the parameter is declared with {@code ...}.
 */
public record FormalParameter(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        Type type,
        String name,
        boolean varargs
) implements LambdaParameter {

    public FormalParameter {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
    }
}
