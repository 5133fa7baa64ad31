package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

/**
 * The header of an enhanced {@code for} loop: {@code variable : iterable}.
 *
 * @param position Where the header begins.
 * @param variable The loop variable, a declaration with exactly one declarator and no initializer.
 * @param iterable The array or {@code Iterable} being traversed.
 */
public record EnhancedForControl(
        Position position,
        LocalVariableDeclaration variable,
        Expression iterable
) implements ForLoopControl {
}
