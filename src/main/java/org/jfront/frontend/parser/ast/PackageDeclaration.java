package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * @param position Where the declaration begins, including its annotations.
 * @param annotations Package annotations, usually only found in {@code package-info.java}.
 * @param name The qualified package name.
 * @param documentation The documentation comment, or {@code null}.
 */
public record PackageDeclaration(
        Position position,
        List<Annotation> annotations,
        String name,
        String documentation
) implements AstNode {

    public PackageDeclaration {
        annotations = NodeLists.copyOf(annotations);
    }
}
