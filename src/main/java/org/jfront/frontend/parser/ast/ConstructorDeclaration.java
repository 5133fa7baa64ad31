package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations applied to the constructor.
 * @param documentation The documentation comment, or {@code null}.
 * @param typeParameters The generic type parameters.
 * @param name The constructor name, which is the name of the enclosing type.
 * @param parameters The formal parameters, empty for a compact record constructor.
 * @param throwsTypes The qualified names listed in the {@code throws} clause.
 * @param body The statements of the body.
 * @param compact Whether this is a compact canonical constructor of a record.
 */
public record ConstructorDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        List<TypeParameter> typeParameters,
        String name,
        List<FormalParameter> parameters,
        List<String> throwsTypes,
        List<Statement> body,
        boolean compact
) implements Declaration, Member {

    public ConstructorDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        typeParameters = NodeLists.copyOf(typeParameters);
        parameters = NodeLists.copyOf(parameters);
        throwsTypes = NodeLists.copyOf(throwsTypes);
        body = NodeLists.copyOf(body);
    }
}
