package org.jfront.frontend.parser.ast;

/**
 * Anything that can appear in the body of a type declaration.
 */
public interface Member extends AstNode {
}
