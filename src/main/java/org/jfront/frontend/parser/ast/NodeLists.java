package org.jfront.frontend.parser.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Copies collections handed to node constructors so that nodes stay immutable.
 */
final class NodeLists {

    private NodeLists() {
        // Utility class
    }

    static <T> List<T> copyOf(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    // Modifiers keep their source order.
    static Set<String> copyOf(Set<String> set) {
        return set == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }
}
