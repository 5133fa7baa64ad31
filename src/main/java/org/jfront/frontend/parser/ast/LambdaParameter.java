package org.jfront.frontend.parser.ast;

public interface LambdaParameter extends AstNode {

    String name();
}
