package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * An array access {@code [index]}.
 */
public record ArraySelector(Position position, Expression index) implements Selector {
}
