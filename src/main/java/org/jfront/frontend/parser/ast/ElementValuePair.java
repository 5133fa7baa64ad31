package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

public record ElementValuePair(Position position, String name, ElementValue value) implements AstNode {
}
