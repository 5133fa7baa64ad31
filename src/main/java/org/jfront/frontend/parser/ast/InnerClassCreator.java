package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * {@code outer.new Inner(args)}. Appears as a selector of the outer instance expression.
 */
public record InnerClassCreator(
        Position position,
        List<TypeArgument> constructorTypeArguments,
        ReferenceType type,
        List<Expression> arguments,
        List<Member> body,
        List<Selector> selectors
) implements Primary, Selector {

    public InnerClassCreator {
        constructorTypeArguments = NodeLists.copyOf(constructorTypeArguments);
        arguments = NodeLists.copyOf(arguments);
        body = body == null ? null : List.copyOf(body);
        selectors = NodeLists.copyOf(selectors);
    }
}
