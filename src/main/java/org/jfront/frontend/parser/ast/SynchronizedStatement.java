package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

public record SynchronizedStatement(Position position, Expression lock, BlockStatement block) implements Statement {
}
