package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * An annotation type declared with {@code @interface}.
 *
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The meta-annotations.
 * @param documentation The documentation comment, or {@code null}.
 * @param name The simple name.
 * @param body The elements, constants and nested types.
 */
public record AnnotationDeclaration(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        String name,
        List<Member> body
) implements TypeDeclaration {

    public AnnotationDeclaration {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
        body = NodeLists.copyOf(body);
    }
}
