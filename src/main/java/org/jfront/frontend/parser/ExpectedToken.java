package org.jfront.frontend.parser;

import org.jfront.frontend.lexer.Token;
import org.jfront.frontend.lexer.TokenType;

/**
 * What the parser expects next: either a token spelled exactly as some text, or any token of a kind.
 */
public sealed interface ExpectedToken permits ExpectedToken.Text, ExpectedToken.Kind {

    /**
     * @param token The token to test.
     * @return {@code true} if the token satisfies this expectation.
     */
    boolean matches(Token token);

    static ExpectedToken text(String text) {
        return new Text(text);
    }

    static ExpectedToken kind(TokenType type) {
        return new Kind(type);
    }

    record Text(String text) implements ExpectedToken {
        @Override
        public boolean matches(Token token) {
            return !token.isEndOfInput() && token.is(text);
        }

        @Override
        public String toString() {
            return "'" + text + "'";
        }
    }

    record Kind(TokenType type) implements ExpectedToken {
        @Override
        public boolean matches(Token token) {
            return token.type() == type;
        }

        @Override
        public String toString() {
            return type.name().toLowerCase().replace('_', ' ');
        }
    }
}
