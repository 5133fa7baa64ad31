package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * {@code new int[n][]} or {@code new int[] {1, 2}}.
 *
 * @param position Where the {@code new} keyword is.
 * @param type The element type.
 * @param dimensions The sized dimension expressions.
 * @param emptyDimensions The number of trailing {@code []} without a size.
 * @param initializer The array initializer, or {@code null}.
 * @param selectors The selectors that follow.
 */
public record ArrayCreator(
        Position position,
        Type type,
        List<Expression> dimensions,
        int emptyDimensions,
        ArrayInitializer initializer,
        List<Selector> selectors
) implements Primary {

    public ArrayCreator {
        dimensions = NodeLists.copyOf(dimensions);
        selectors = NodeLists.copyOf(selectors);
    }
}
