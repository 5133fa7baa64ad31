package org.jfront.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * <p>
 * Tokens are compared by identity: two scans of the same text never produce equal tokens,
 * and the end-of-input sentinel is equal to nothing but itself.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final String value;
    private final Position position;
    private final String javadoc;

    /**
     * Creates a new token.
     *
     * @param type The type of the token.
     * @param text The exact text of the token from the source code.
     * @param value The logical value. For string, character and text block literals this is the
     *              escape-decoded content without delimiters, otherwise the same as {@code text}.
     * @param position Where the token begins, {@code null} only for the end-of-input sentinel.
     * @param javadoc The documentation comment immediately preceding the token, or {@code null}.
     */
    public Token(TokenType type, String text, String value, Position position, String javadoc) {
        this.type = type;
        this.text = text;
        this.value = value;
        this.position = position;
        this.javadoc = javadoc;
    }

    public Token(TokenType type, String text, Position position) {
        this(type, text, text, position, null);
    }

    /**
     * Creates a fresh end-of-input sentinel.
     * @return A token of type {@link TokenType#END_OF_INPUT} without a position.
     */
    public static Token endOfInput() {
        return new Token(TokenType.END_OF_INPUT, "", "", null, null);
    }

    public TokenType type() {
        return type;
    }

    public String text() {
        return text;
    }

    public String value() {
        return value;
    }

    public Position position() {
        return position;
    }

    public String javadoc() {
        return javadoc;
    }

    public int line() {
        return position == null ? -1 : position.line();
    }

    public int column() {
        return position == null ? -1 : position.column();
    }

    public boolean isEndOfInput() {
        return type == TokenType.END_OF_INPUT;
    }

    /**
     * @param other The text to compare with.
     * @return {@code true} if this token is spelled exactly as {@code other}.
     */
    public boolean is(String other) {
        return text.equals(other);
    }

    @Override
    public String toString() {
        if (position == null) {
            return type.name();
        }
        return type + " \"" + text + "\" at " + position;
    }
}
