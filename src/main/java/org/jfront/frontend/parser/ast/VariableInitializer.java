package org.jfront.frontend.parser.ast;

/**
 * The right-hand side of a variable declarator: an expression or an array initializer.
 */
public interface VariableInitializer extends AstNode {
}
