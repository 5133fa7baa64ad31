package org.jfront.frontend.parser.ast;

/**
 * A statement inside a block.
 */
public interface Statement extends AstNode {
}
