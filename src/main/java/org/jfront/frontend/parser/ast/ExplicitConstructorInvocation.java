package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * {@code this(args)} inside a constructor.
 */
public record ExplicitConstructorInvocation(
        Position position,
        List<TypeArgument> typeArguments,
        List<Expression> arguments,
        List<Selector> selectors
) implements Primary {

    public ExplicitConstructorInvocation {
        typeArguments = NodeLists.copyOf(typeArguments);
        arguments = NodeLists.copyOf(arguments);
        selectors = NodeLists.copyOf(selectors);
    }
}
