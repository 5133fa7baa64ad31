package org.jfront.frontend.parser.ast;

import java.util.List;
import java.util.Set;

/**
 * A node that may carry modifiers, annotations and a documentation comment.
 */
public interface Declaration extends AstNode {

    Set<String> modifiers();

    List<Annotation> annotations();

    /**
     * @return The raw documentation comment preceding the declaration, or {@code null}.
     */
    String documentation();
}
