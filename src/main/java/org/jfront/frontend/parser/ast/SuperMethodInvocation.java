package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * {@code super.method(args)}, or {@code Interface.super.method(args)} with a qualifier.
 */
public record SuperMethodInvocation(
        Position position,
        String qualifier,
        List<TypeArgument> typeArguments,
        String member,
        List<Expression> arguments,
        List<Selector> selectors
) implements Primary, Selector {

    public SuperMethodInvocation {
        typeArguments = NodeLists.copyOf(typeArguments);
        arguments = NodeLists.copyOf(arguments);
        selectors = NodeLists.copyOf(selectors);
    }
}
