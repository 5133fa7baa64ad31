package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

public record ThrowStatement(Position position, Expression expression) implements Statement {
}
