package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;
import java.util.Set;

/**
 * An element of an annotation type, e.g. {@code String value() default "";}.
 *
 * @param position Where the declaration begins, including modifiers and annotations.
 * @param modifiers The modifier keywords in source order.
 * @param annotations The annotations applied to the element.
 * @param documentation The documentation comment, or {@code null}.
 * @param returnType The element type.
 * @param name The element name.
 * @param defaultValue The default value, or {@code null}.
 */
public record AnnotationMethod(
        Position position,
        Set<String> modifiers,
        List<Annotation> annotations,
        String documentation,
        Type returnType,
        String name,
        ElementValue defaultValue
) implements Declaration, Member {

    public AnnotationMethod {
        modifiers = NodeLists.copyOf(modifiers);
        annotations = NodeLists.copyOf(annotations);
    }
}
