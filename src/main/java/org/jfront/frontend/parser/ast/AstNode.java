package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Nodes are immutable records. Every node is created exactly once, fully populated,
 * by the parser procedure that recognizes it.
 */
public interface AstNode {

    /**
     * @return Where the node begins in the source text.
     */
    Position position();

    /**
     * Returns a list of the direct child nodes, in declaration order of the record components.
     * This allows the TreeWalker to traverse the tree without knowing the specific
     * structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        RecordComponent[] components = getClass().getRecordComponents();
        if (components == null) {
            return children;
        }
        for (RecordComponent component : components) {
            Object value;
            try {
                value = component.getAccessor().invoke(this);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot read component '" + component.getName() + "' of " + getClass().getSimpleName(), e);
            }
            if (value instanceof AstNode node) {
                children.add(node);
            } else if (value instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element instanceof AstNode node) {
                        children.add(node);
                    }
                }
            }
        }
        return children;
    }
}
