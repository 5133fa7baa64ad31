package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A switch used as an expression. Same block structure as {@link SwitchStatement}.
 */
public record SwitchExpression(
        Position position,
        Expression expression,
        List<SwitchStatementCase> cases,
        List<SwitchRule> rules,
        List<Selector> selectors
) implements Primary {

    public SwitchExpression {
        cases = NodeLists.copyOf(cases);
        rules = NodeLists.copyOf(rules);
        selectors = NodeLists.copyOf(selectors);
    }
}
