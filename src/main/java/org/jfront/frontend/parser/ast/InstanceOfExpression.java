package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * A runtime type test. Exactly one of {@code type} and {@code pattern} is set:
 * {@code o instanceof String} has a type, {@code o instanceof String s} and
 * {@code o instanceof Point(var x, var y)} have a pattern.
 *
 * @param position Where the tested expression begins.
 * @param expression The tested expression.
 * @param type The tested type of a test without binding, or {@code null}.
 * @param pattern The type or record pattern, or {@code null}.
 */
public record InstanceOfExpression(
        Position position,
        Expression expression,
        Type type,
        Pattern pattern
) implements Expression {
}
