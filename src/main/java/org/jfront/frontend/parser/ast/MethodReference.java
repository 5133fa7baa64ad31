package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A method reference {@code qualifier::method}. The qualifier is either an expression
 * ({@code System.out::println}) or a type that only parses as a type ({@code int[]::clone},
 * {@code List<String>::size}).
 *
 * @param position Where the qualifier begins.
 * @param expression The qualifying expression, or {@code null}.
 * @param type The qualifying type, or {@code null}.
 * @param typeArguments Explicit type arguments after {@code ::}.
 * @param method The method name, or {@code new}.
 */
public record MethodReference(
        Position position,
        Expression expression,
        Type type,
        List<TypeArgument> typeArguments,
        String method
) implements Expression {

    public MethodReference {
        typeArguments = NodeLists.copyOf(typeArguments);
    }
}
