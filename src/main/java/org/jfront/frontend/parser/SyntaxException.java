package org.jfront.frontend.parser;

import org.jfront.frontend.lexer.Token;

/**
 * Thrown when the token stream does not match the grammar.
 */
public class SyntaxException extends RuntimeException {

    private final String description;
    private final Token token;

    /**
     * @param description What was expected or what went wrong.
     * @param token The offending token, possibly the end-of-input sentinel.
     */
    public SyntaxException(String description, Token token) {
        super(format(description, token));
        this.description = description;
        this.token = token;
    }

    private static String format(String description, Token token) {
        if (token == null || token.position() == null) {
            return description + " (Unexpected end of input)";
        }
        return String.format("%s at line %d, column %d (found '%s')",
                description, token.line(), token.column(), token.text());
    }

    public String getDescription() {
        return description;
    }

    public Token getToken() {
        return token;
    }
}
