package org.jfront.frontend.parser.ast;

/**
 * A basic or reference type.
 */
public interface Type extends AstNode {

    String name();

    /**
     * @return The number of array dimensions, 0 for a non-array type.
     */
    int dimensions();

    /**
     * @param dimensions The new number of array dimensions.
     * @return A copy of this type with the given dimensions.
     */
    Type withDimensions(int dimensions);
}
