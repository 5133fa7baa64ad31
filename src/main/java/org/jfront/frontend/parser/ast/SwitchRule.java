package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * An arrow rule: {@code case labels [when guard] -> action}.
 *
 * @param position Where the rule begins.
 * @param labels The labels before the arrow.
 * @param guard The {@code when} guard, or {@code null}.
 * @param action An {@link Expression}, a {@link BlockStatement} or a {@link ThrowStatement}.
 */
public record SwitchRule(
        Position position,
        List<CaseLabel> labels,
        Expression guard,
        AstNode action
) implements AstNode {

    public SwitchRule {
        labels = NodeLists.copyOf(labels);
    }
}
