package org.jfront.frontend.parser.ast;

/**
 * One label of a switch case: a constant expression, {@code null}, {@code default} or a pattern.
 */
public interface CaseLabel extends AstNode {
}
