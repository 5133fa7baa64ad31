package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations applied to the record.
 * @param documentation The documentation comment, or {@code null}.
 * @param name The simple name.
 * @param typeParameters The generic type parameters.
 * @param components The record components.
 * @param implementsTypes The implemented interfaces.
 * @param body The member declarations.
 */
public record RecordDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        String name,
        List<TypeParameter> typeParameters,
        List<FormalParameter> components,
        List<ReferenceType> implementsTypes,
        List<Member> body
) implements TypeDeclaration {

    public RecordDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        typeParameters = NodeLists.copyOf(typeParameters);
        components = NodeLists.copyOf(components);
        implementsTypes = NodeLists.copyOf(implementsTypes);
        body = NodeLists.copyOf(body);
    }
}
