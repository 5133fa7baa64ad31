package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * A statement preceded by {@code label:}.
 */
public record LabeledStatement(Position position, String label, Statement statement) implements Statement {
}
