package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;
import org.jfront.frontend.lexer.TokenType;

import java.util.List;

/**
 * @param position Where the literal is.
 * @param kind The literal token type.
 * @param text The literal as written, including quotes and suffixes.
 * @param value The decoded content for string, character and text block literals, otherwise the text.
 * @param selectors Selectors applied to the literal, e.g. {@code "a".length()}.
 */
public record Literal(
        Position position,
        TokenType kind,
        String text,
        String value,
        List<Selector> selectors
) implements Primary {

    public Literal {
        selectors = NodeLists.copyOf(selectors);
    }
}
