package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * @param position Where the {@code try} keyword is.
 * @param resources The resources of a try-with-resources statement.
 * @param block The guarded block.
 * @param catches The catch clauses in source order.
 * @param finallyBlock The {@code finally} block, or {@code null}.
 */
public record TryStatement(
        Position position,
        List<TryResource> resources,
        BlockStatement block,
        List<CatchClause> catches,
        BlockStatement finallyBlock
) implements Statement {

    public TryStatement {
        resources = NodeLists.copyOf(resources);
        catches = NodeLists.copyOf(catches);
    }
}
