package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A group of colon-terminated labels and the statements that follow them.
 *
 * @param position Where the first label begins.
 * @param labels All labels of the group, e.g. both values of {@code case 1: case 2:}.
 * @param guard The {@code when} guard, or {@code null}.
 * @param statements The statements up to the next label or the end of the switch block.
 */
public record SwitchStatementCase(
        Position position,
        List<CaseLabel> labels,
        Expression guard,
        List<Statement> statements
) implements AstNode {

    public SwitchStatementCase {
        labels = NodeLists.copyOf(labels);
        statements = NodeLists.copyOf(statements);
    }
}
