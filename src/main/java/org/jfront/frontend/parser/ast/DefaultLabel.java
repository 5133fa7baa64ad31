package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * The {@code default} label of a switch.
 */
public record DefaultLabel(Position position) implements CaseLabel {
}
