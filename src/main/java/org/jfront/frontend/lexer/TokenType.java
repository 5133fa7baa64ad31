package org.jfront.frontend.lexer;

/**
 * Defines all possible types of tokens the {@link Lexer} can recognize.
 */
public enum TokenType {
    IDENTIFIER,
    KEYWORD,
    MODIFIER,
    BASIC_TYPE,

    // Literals
    DECIMAL_INTEGER,
    OCTAL_INTEGER,
    BINARY_INTEGER,
    HEX_INTEGER,
    DECIMAL_FLOATING_POINT,
    HEX_FLOATING_POINT,
    BOOLEAN,
    CHARACTER,
    STRING,
    TEXT_BLOCK,
    NULL,

    SEPARATOR,
    OPERATOR,
    ANNOTATION,

    // Produced only by the token cursor once the underlying sequence is exhausted.
    END_OF_INPUT;

    /**
     * @return {@code true} for every literal kind, including {@code null} and the boolean literals.
     */
    public boolean isLiteral() {
        return isInteger() || isFloatingPoint() || switch (this) {
            case BOOLEAN, CHARACTER, STRING, TEXT_BLOCK, NULL -> true;
            default -> false;
        };
    }

    public boolean isInteger() {
        return this == DECIMAL_INTEGER || this == OCTAL_INTEGER || this == BINARY_INTEGER || this == HEX_INTEGER;
    }

    public boolean isFloatingPoint() {
        return this == DECIMAL_FLOATING_POINT || this == HEX_FLOATING_POINT;
    }

    /**
     * Modifiers and basic type names are reserved words as well.
     * @return {@code true} if tokens of this type are spelled with a reserved word.
     */
    public boolean isKeyword() {
        return this == KEYWORD || this == MODIFIER || this == BASIC_TYPE;
    }
}
