package org.jfront.frontend;

import org.jfront.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing a syntax tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * so that tools over the tree do not depend on the full set of node types.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     *                 A handler is invoked only for nodes of exactly that class.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single node and its children recursively, parents before children.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Collects every node of the given type in the tree below and including {@code root},
     * in pre-order. Subtypes match as well, so {@code collect(root, Statement.class)} finds
     * every kind of statement.
     *
     * @param root The root of the tree to search.
     * @param type The node type to filter by.
     * @param <T> The node type.
     * @return The matching nodes in the order they appear in the source.
     */
    public static <T extends AstNode> List<T> collect(AstNode root, Class<T> type) {
        List<T> result = new ArrayList<>();
        collect(root, type, result);
        return result;
    }

    private static <T extends AstNode> void collect(AstNode node, Class<T> type, List<T> result) {
        if (node == null) {
            return;
        }
        if (type.isInstance(node)) {
            result.add(type.cast(node));
        }
        for (AstNode child : node.getChildren()) {
            collect(child, type, result);
        }
    }
}
