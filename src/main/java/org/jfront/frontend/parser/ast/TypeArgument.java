package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * An argument of a parameterized type.
 *
 * @param position Where the argument begins.
 * @param type The type, or {@code null} for an unbounded wildcard {@code ?}.
 * @param patternType {@code "?"} for an unbounded wildcard, {@code "extends"} or {@code "super"}
 *                    for a bounded one, {@code null} for a plain type argument.
 */
public record TypeArgument(Position position, Type type, String patternType) implements AstNode {
}
