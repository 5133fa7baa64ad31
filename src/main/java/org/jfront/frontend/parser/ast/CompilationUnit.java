package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * The root of the tree: one source file.
 *
 * @param position Where the file's first token begins.
 * @param packageDeclaration The package declaration, or {@code null} for the unnamed package.
 * @param imports The import declarations in source order.
 * @param types The top-level type declarations, and any top-level methods.
 */
public record CompilationUnit(
        Position position,
        PackageDeclaration packageDeclaration,
        List<Import> imports,
        List<Declaration> types
) implements AstNode {

    public CompilationUnit {
        imports = NodeLists.copyOf(imports);
        types = NodeLists.copyOf(types);
    }
}
