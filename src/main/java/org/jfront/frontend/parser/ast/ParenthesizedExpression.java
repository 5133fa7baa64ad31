package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

public record ParenthesizedExpression(Position position, Expression expression, List<Selector> selectors) implements Primary {

    public ParenthesizedExpression {
        selectors = NodeLists.copyOf(selectors);
    }
}
