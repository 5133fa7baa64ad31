package org.jfront.frontend.parser.ast;

/**
 * The value of an annotation element: an expression, a nested annotation or an element array.
 */
public interface ElementValue extends AstNode {
}
