package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * The header of a classic {@code for} loop. At most one of {@code declaration} and
 * {@code init} is non-empty.
 *
 * @param position Where the header begins.
 * @param declaration The declared loop variables, or {@code null}.
 * @param init The initialization expressions when no variables are declared.
 * @param condition The loop condition, or {@code null}.
 * @param update The update expressions.
 */
public record ForControl(
        Position position,
        LocalVariableDeclaration declaration,
        List<Expression> init,
        Expression condition,
        List<Expression> update
) implements ForLoopControl {

    public ForControl {
        init = NodeLists.copyOf(init);
        update = NodeLists.copyOf(update);
    }
}
