package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * @param position Where the parameter begins.
 * @param modifiers The modifiers, normally at most {@code final}.
 * @param annotations The annotations applied to the parameter.
 * @param types The caught exception types; more than one for a multi-catch.
 * @param name The parameter name.
 */
public record CatchClauseParameter(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        List<String> types,
        String name
) implements AstNode {

    public CatchClauseParameter {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        types = NodeLists.copyOf(types);
    }
}
