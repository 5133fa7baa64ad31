package org.jfront.frontend.lexer;

/**
 * Thrown by the {@link Lexer} when the source text cannot be split into tokens.
 * In best-effort mode the lexer records these instead of throwing them.
 */
public class LexerException extends RuntimeException {

    private final String description;
    private final String character;
    private final int line;
    private final int column;

    /**
     * @param description A short description of the problem, e.g. "Unterminated text block".
     * @param character The offending character, or an empty string at end of input.
     * @param line The line on which the problem was detected.
     * @param column The column on which the problem was detected.
     * @param sourceLine The text of that line, used for the message.
     */
    public LexerException(String description, String character, int line, int column, String sourceLine) {
        super(String.format("%s at \"%s\", line %s: %s", description, character, line, sourceLine.strip()));
        this.description = description;
        this.character = character;
        this.line = line;
        this.column = column;
    }

    public String getDescription() {
        return description;
    }

    public String getCharacter() {
        return character;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
