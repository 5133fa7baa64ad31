package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

public record WhileStatement(Position position, Expression condition, Statement body) implements Statement {
}
