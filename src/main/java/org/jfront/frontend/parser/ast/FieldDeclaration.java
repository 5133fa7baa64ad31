package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * A field of a class, enum or record.
 *
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations applied to the field.
 * @param documentation The documentation comment, or {@code null}.
 * @param type The declared type.
 * @param declarators One declarator per declared name.
 */
public record FieldDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        Type type,
        List<VariableDeclarator> declarators
) implements Declaration, Member {

    public FieldDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        declarators = NodeLists.copyOf(declarators);
    }
}
