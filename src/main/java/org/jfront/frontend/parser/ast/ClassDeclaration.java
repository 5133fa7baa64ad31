package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * A class declaration, top-level, nested or local.
 *
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations applied to the class.
 * @param documentation The documentation comment, or {@code null}.
 * @param name The simple name.
 * @param typeParameters The generic type parameters.
 * @param extendsType The superclass, or {@code null}.
 * @param implementsTypes The implemented interfaces.
 * @param permittedTypes The types named in a {@code permits} clause.
 * @param body The member declarations.
 */
public record ClassDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        String name,
        List<TypeParameter> typeParameters,
        ReferenceType extendsType,
        List<ReferenceType> implementsTypes,
        List<ReferenceType> permittedTypes,
        List<Member> body
) implements TypeDeclaration {

    public ClassDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        typeParameters = NodeLists.copyOf(typeParameters);
        implementsTypes = NodeLists.copyOf(implementsTypes);
        permittedTypes = NodeLists.copyOf(permittedTypes);
        body = NodeLists.copyOf(body);
    }
}
