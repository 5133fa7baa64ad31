package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

public record TernaryExpression(
        Position position,
        Expression condition,
        Expression ifTrue,
        Expression ifFalse
) implements Expression {
}
