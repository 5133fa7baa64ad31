package org.jfront.frontend.parser.ast;

/**
 * A type pattern or a record deconstruction pattern.
 */
public interface Pattern extends CaseLabel {
}
