package org.jfront.frontend.parser;

import org.jfront.frontend.lexer.Position;
import org.jfront.frontend.parser.ast.Annotation;

import java.util.List;
import java.util.Set;

/**
 * The modifiers, annotations and documentation comment collected in front of a declaration.
 *
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations in source order.
 * @param documentation The documentation comment attached to the first token, or {@code null}.
 * @param position Where the first token of the declaration is.
 */
public record Modifiers(Set<String> modifiers, List<Annotation> annotations, String documentation, Position position) {

    public boolean isEmpty() {
        return modifiers.isEmpty() && annotations.isEmpty();
    }
}
