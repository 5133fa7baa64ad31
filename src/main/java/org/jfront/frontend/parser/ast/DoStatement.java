package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

public record DoStatement(Position position, Expression condition, Statement body) implements Statement {
}
