package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * {@code super(args)} inside a constructor, or {@code outer.super(args)} as a selector.
 */
public record SuperConstructorInvocation(
        Position position,
        String qualifier,
        List<TypeArgument> typeArguments,
        List<Expression> arguments,
        List<Selector> selectors
) implements Primary, Selector {

    public SuperConstructorInvocation {
        typeArguments = NodeLists.copyOf(typeArguments);
        arguments = NodeLists.copyOf(arguments);
        selectors = NodeLists.copyOf(selectors);
    }
}
