package org.jfront.frontend.parser.ast;

/**
 * The parenthesized header of a {@code for} statement.
 */
public interface ForLoopControl extends AstNode {
}
