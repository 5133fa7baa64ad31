package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations applied to the enum.
 * @param documentation The documentation comment, or {@code null}.
 * @param name The simple name.
 * @param implementsTypes The implemented interfaces.
 * @param constants The enum constants in declaration order.
 * @param body The member declarations following the constants.
 */
public record EnumDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        String name,
        List<ReferenceType> implementsTypes,
        List<EnumConstantDeclaration> constants,
        List<Member> body
) implements TypeDeclaration {

    public EnumDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        implementsTypes = NodeLists.copyOf(implementsTypes);
        constants = NodeLists.copyOf(constants);
        body = NodeLists.copyOf(body);
    }
}
