package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A class or interface type. A qualified name is a right-recursive chain:
 * {@code java.util.Map.Entry<K, V>} is {@code java} with sub type {@code util}, whose sub type is
 * {@code Map}, whose sub type is {@code Entry} carrying the type arguments.
 *
 * @param position Where this segment of the name is.
 * @param name The simple name of this segment.
 * @param arguments The type arguments of this segment; empty for none and for a diamond.
 * @param subType The next segment of a qualified name, or {@code null}.
 * @param dimensions The number of array dimensions, kept on the outermost segment.
 */
public record ReferenceType(
        Position position,
        String name,
        List<TypeArgument> arguments,
        ReferenceType subType,
        int dimensions
) implements Type {

    public ReferenceType {
        arguments = NodeLists.copyOf(arguments);
    }

    @Override
    public ReferenceType withDimensions(int dimensions) {
        return new ReferenceType(position, name, arguments, subType, dimensions);
    }

    /**
     * @return The dotted name of the whole chain, without type arguments.
     */
    public String qualifiedName() {
        return subType == null ? name : name + "." + subType.qualifiedName();
    }

    /**
     * @return The last segment of the chain.
     */
    public ReferenceType innermost() {
        return subType == null ? this : subType.innermost();
    }
}
