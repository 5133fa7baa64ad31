package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * A class, interface, enum or record declared inside a block.
 */
public record LocalTypeDeclaration(Position position, TypeDeclaration declaration) implements Statement {
}
