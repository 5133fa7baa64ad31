package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * @param position Where the invocation begins.
 * @param qualifier The dotted qualifier, or {@code null}.
 * @param typeArguments Explicit type arguments such as {@code Collections.<String>emptyList()}.
 * @param member The invoked method name.
 * @param arguments The call arguments.
 * @param selectors The selectors that follow.
 */
public record MethodInvocation(
        Position position,
        String qualifier,
        List<TypeArgument> typeArguments,
        String member,
        List<Expression> arguments,
        List<Selector> selectors
) implements Primary, Selector {

    public MethodInvocation {
        typeArguments = NodeLists.copyOf(typeArguments);
        arguments = NodeLists.copyOf(arguments);
        selectors = NodeLists.copyOf(selectors);
    }
}
