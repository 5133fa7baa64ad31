package org.jfront.frontend.parser.ast;

/**
 * An expression. Expressions may also initialize variables, supply annotation element values
 * and serve as constant case labels.
 */
public interface Expression extends VariableInitializer, ElementValue, CaseLabel {
}
