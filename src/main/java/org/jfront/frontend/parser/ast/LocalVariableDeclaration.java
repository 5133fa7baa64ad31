package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * A local variable declaration, used as a statement and inside {@code for} headers.
 *
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifiers, normally at most {@code final}.
 * @param annotations The annotations applied to the variables.
 * @param type The declared type; {@code var} appears as a reference type named {@code var}.
 * @param declarators One declarator per declared name.
 */
public record LocalVariableDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        Type type,
        List<VariableDeclarator> declarators
) implements Statement {

    public LocalVariableDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        declarators = NodeLists.copyOf(declarators);
    }
}
