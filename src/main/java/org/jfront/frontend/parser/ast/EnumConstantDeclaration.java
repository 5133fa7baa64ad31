package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * @param position Where the constant begins, including its annotations.
 * @param annotations The annotations applied to the constant.
 * @param documentation The documentation comment, or {@code null}.
 * @param name The constant's name.
 * @param arguments The constructor arguments.
 * @param body The constant-specific class body, or {@code null} if there is none.
 */
public record EnumConstantDeclaration(
        Position position,
        List<Annotation> annotations,
        String documentation,
        String name,
        List<Expression> arguments,
        List<Member> body
) implements AstNode {

    public EnumConstantDeclaration {
        annotations = NodeLists.copyOf(annotations);
        arguments = NodeLists.copyOf(arguments);
        body = body == null ? null : List.copyOf(body);
    }
}
