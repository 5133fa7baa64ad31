package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations applied to the method.
 * @param documentation The documentation comment, or {@code null}.
 * @param typeParameters The generic type parameters.
 * @param returnType The return type, or {@code null} for {@code void}.
 * @param name The method name.
 * @param parameters The formal parameters.
 * @param throwsTypes The qualified names listed in the {@code throws} clause.
 * @param body The statements of the body, or {@code null} for abstract and native methods.
 */
public record MethodDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        List<TypeParameter> typeParameters,
        Type returnType,
        String name,
        List<FormalParameter> parameters,
        List<String> throwsTypes,
        List<Statement> body
) implements Declaration, Member {

    public MethodDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        typeParameters = NodeLists.copyOf(typeParameters);
        parameters = NodeLists.copyOf(parameters);
        throwsTypes = NodeLists.copyOf(throwsTypes);
        body = body == null ? null : List.copyOf(body);
    }
}
