package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

public record BlockStatement(Position position, List<Statement> statements) implements Statement {

    public BlockStatement {
        statements = NodeLists.copyOf(statements);
    }
}
