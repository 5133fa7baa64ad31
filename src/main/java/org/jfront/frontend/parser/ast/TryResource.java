package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * A resource of a try-with-resources statement. A declared resource has a type and a name;
 * a resource that refers to an existing variable has only a value.
 *
 * @param position Where the resource begins.
 * @param modifiers The modifiers of a declared resource.
 * @param annotations The annotations of a declared resource.
 * @param type The declared type, or {@code null}.
 * @param name The declared name, or {@code null}.
 * @param value The initializer of a declared resource, or the referenced variable.
 */
public record TryResource(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        Type type,
        String name,
        Expression value
) implements AstNode {

    public TryResource {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
    }
}
