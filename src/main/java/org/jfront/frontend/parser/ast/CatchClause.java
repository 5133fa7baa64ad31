package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

public record CatchClause(Position position, CatchClauseParameter parameter, BlockStatement block) implements AstNode {
}
