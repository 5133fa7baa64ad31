package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * @param position Where the parameter list begins.
 * @param parameters {@link InferredFormalParameter}s or {@link FormalParameter}s.
 * @param body An {@link Expression} or a {@link BlockStatement}.
 */
public record LambdaExpression(Position position, List<LambdaParameter> parameters, AstNode body) implements Expression {

    public LambdaExpression {
        parameters = NodeLists.copyOf(parameters);
    }
}
