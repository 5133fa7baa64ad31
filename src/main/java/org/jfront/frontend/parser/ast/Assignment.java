package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * @param position Where the assignment target begins.
 * @param target The assigned expression.
 * @param operator {@code =} or a compound assignment operator such as {@code +=}.
 * @param value The assigned value.
 */
public record Assignment(Position position, Expression target, String operator, Expression value) implements Expression {
}
