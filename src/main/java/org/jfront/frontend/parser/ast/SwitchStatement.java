package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A switch statement. Exactly one of {@code cases} and {@code rules} is non-empty
 * unless the switch block is empty.
 *
 * @param position Where the {@code switch} keyword is.
 * @param expression The selector expression.
 * @param cases The colon-terminated statement groups.
 * @param rules The arrow rules.
 */
public record SwitchStatement(
        Position position,
        Expression expression,
        List<SwitchStatementCase> cases,
        List<SwitchRule> rules
) implements Statement {

    public SwitchStatement {
        cases = NodeLists.copyOf(cases);
        rules = NodeLists.copyOf(rules);
    }
}
