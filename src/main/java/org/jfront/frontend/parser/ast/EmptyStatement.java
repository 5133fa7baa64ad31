package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

public record EmptyStatement(Position position) implements Statement {
}
