package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations applied to the interface.
 * @param documentation The documentation comment, or {@code null}.
 * @param name The simple name.
 * @param typeParameters The generic type parameters.
 * @param extendsTypes The extended interfaces.
 * @param permittedTypes The types named in a {@code permits} clause.
 * @param body The member declarations. Fields are {@link ConstantDeclaration}s.
 */
public record InterfaceDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        String name,
        List<TypeParameter> typeParameters,
        List<ReferenceType> extendsTypes,
        List<ReferenceType> permittedTypes,
        List<Member> body
) implements TypeDeclaration {

    public InterfaceDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        typeParameters = NodeLists.copyOf(typeParameters);
        extendsTypes = NodeLists.copyOf(extendsTypes);
        permittedTypes = NodeLists.copyOf(permittedTypes);
        body = NodeLists.copyOf(body);
    }
}
