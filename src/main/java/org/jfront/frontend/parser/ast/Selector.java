package org.jfront.frontend.parser.ast;

/**
 * A suffix applied to a primary expression: a field access, a method call, an array index and so on.
 */
public interface Selector extends AstNode {
}
