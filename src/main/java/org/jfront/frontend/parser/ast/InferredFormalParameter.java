package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * A lambda parameter written without a type.
 */
public record InferredFormalParameter(Position position, String name) implements LambdaParameter {
}
