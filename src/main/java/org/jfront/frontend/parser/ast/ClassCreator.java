package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * {@code new Type(args)}, optionally with an anonymous class body.
 *
 * @param position Where the {@code new} keyword is.
 * @param constructorTypeArguments Type arguments between {@code new} and the type.
 * @param type The instantiated type.
 * @param arguments The constructor arguments.
 * @param body The anonymous class body, or {@code null} when there is none.
 * @param selectors The selectors that follow.
 */
public record ClassCreator(
        Position position,
        List<TypeArgument> constructorTypeArguments,
        ReferenceType type,
        List<Expression> arguments,
        List<Member> body,
        List<Selector> selectors
) implements Primary {

    public ClassCreator {
        constructorTypeArguments = NodeLists.copyOf(constructorTypeArguments);
        arguments = NodeLists.copyOf(arguments);
        body = body == null ? null : List.copyOf(body);
        selectors = NodeLists.copyOf(selectors);
    }
}
