package org.jfront.frontend.lexer;

import org.jfront.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * Java source text into a sequence of tokens.
 * <p>
 * Tokens are produced lazily: each call to {@link #next()} scans just far enough to
 * recognize one more token. The lexer is single-pass; to scan the same text again,
 * create a new instance.
 * <p>
 * Unicode escapes ({@code \}{@code uXXXX}) are replaced in a pre-pass over the whole text,
 * so they may spell any part of the program, including keywords and operators.
 */
public class Lexer implements Iterator<Token> {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    static final Set<String> KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
            "const", "continue", "default", "do", "double", "else", "enum", "extends", "final",
            "finally", "float", "for", "goto", "if", "implements", "import", "instanceof", "int",
            "interface", "long", "native", "new", "package", "private", "protected", "public",
            "return", "short", "static", "strictfp", "super", "switch", "synchronized", "this",
            "throw", "throws", "transient", "try", "void", "volatile", "while");

    static final Set<String> MODIFIERS = Set.of(
            "abstract", "default", "final", "native", "private", "protected", "public", "static",
            "strictfp", "synchronized", "transient", "volatile", "non-sealed");

    static final Set<String> BASIC_TYPES = Set.of(
            "boolean", "byte", "char", "double", "float", "int", "long", "short");

    static final Set<String> OPERATORS = Set.of(
            ">>>=", ">>=", "<<=", "%=", "^=", "|=", "&=", "/=", "*=", "-=", "+=", "<<", "--", "++",
            "||", "&&", "!=", ">=", "<=", "==", "%", "^", "|", "&", "/", "*", "-", "+", ":", "?",
            "~", "!", "<", ">", "=", "...", "->", "::");

    private static final List<Charset> SOURCE_CHARSETS = List.of(StandardCharsets.UTF_8, StandardCharsets.ISO_8859_1);

    private static final int MAX_OPERATOR_LENGTH = 4;
    private static final String SEPARATORS = "(){}[];,.";
    private static final String DECIMAL_DIGITS = "0123456789";
    private static final String HEX_DIGITS = "0123456789abcdefABCDEF";
    private static final String OCTAL_DIGITS = "01234567";
    private static final String BINARY_DIGITS = "01";

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final boolean ignoreErrors;
    private final List<LexerException> errors = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = -1;
    private Position tokenPosition;
    private String pendingJavadoc;
    private Token lookahead;

    /**
     * Creates a new Lexer that fails on the first lexical error.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, false);
    }

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param ignoreErrors If {@code true}, lexical errors are recorded and scanning continues.
     */
    public Lexer(String source, boolean ignoreErrors) {
        this(source, null, "<memory>", ignoreErrors);
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine that lexical errors are additionally reported to, may be {@code null}.
     * @param fileName The name of the file being scanned, for error reporting.
     * @param ignoreErrors If {@code true}, lexical errors are recorded and scanning continues.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String fileName, boolean ignoreErrors) {
        this.diagnostics = diagnostics;
        this.fileName = fileName;
        this.ignoreErrors = ignoreErrors;
        this.source = decodeUnicodeEscapes(source);
    }

    /**
     * Decodes raw source bytes, trying UTF-8 first and ISO-8859-1 second.
     * @param data The bytes of a source file.
     * @return The source text.
     * @throws LexerException if no supported charset decodes the bytes.
     */
    public static String decode(byte[] data) {
        for (Charset charset : SOURCE_CHARSETS) {
            try {
                return charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(data))
                        .toString();
            } catch (CharacterCodingException e) {
                LOG.debug("Source is not valid {}: {}", charset, e.getMessage());
            }
        }
        throw new LexerException("Could not decode input data", "", 1, 1, "");
    }

    /**
     * Scans all remaining tokens.
     * @return The recognized tokens in source order.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    /**
     * @return The errors recorded so far in best-effort mode.
     */
    public List<LexerException> errors() {
        return Collections.unmodifiableList(errors);
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null) {
            lookahead = scanNext();
        }
        return lookahead != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens");
        }
        Token token = lookahead;
        lookahead = null;
        return token;
    }

    private Token scanNext() {
        while (!isAtEnd()) {
            start = current;
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                lineComment();
            } else if (c == '/' && peekNext() == '*') {
                blockComment();
            } else {
                tokenPosition = new Position(line, current - lineStart);
                Token token = scanToken(c);
                if (token != null) {
                    return token;
                }
            }
        }
        return null;
    }

    private Token scanToken(char c) {
        if (source.startsWith("...", current)) {
            moveTo(current + 3);
            return addToken(TokenType.OPERATOR);
        }
        if (c == '@') {
            advance();
            return addToken(TokenType.ANNOTATION);
        }
        if (c == '.' && isDigit(peekNext())) {
            return decimalFloatingPoint();
        }
        if (SEPARATORS.indexOf(c) >= 0) {
            advance();
            return addToken(TokenType.SEPARATOR);
        }
        if (c == '"') {
            return source.startsWith("\"\"\"", current) ? textBlock() : quoted('"', TokenType.STRING);
        }
        if (c == '\'') {
            return quoted('\'', TokenType.CHARACTER);
        }
        if (isDigit(c)) {
            return number();
        }
        int codePoint = source.codePointAt(current);
        if (isIdentifierStart(codePoint)) {
            return identifier();
        }
        for (int length = MAX_OPERATOR_LENGTH; length > 0; length--) {
            if (current + length <= source.length() && OPERATORS.contains(source.substring(current, current + length))) {
                moveTo(current + length);
                return addToken(TokenType.OPERATOR);
            }
        }

        error("Could not process token", current);
        moveTo(current + Character.charCount(codePoint));
        return null;
    }

    // ---- comments ----

    private void lineComment() {
        int end = source.indexOf('\n', current);
        moveTo(end < 0 ? source.length() : end);
    }

    private void blockComment() {
        int close = source.indexOf("*/", current + 2);
        if (close < 0) {
            error("Unterminated block comment", current);
            moveTo(source.length());
            return;
        }
        String comment = source.substring(current, close + 2);
        if (comment.startsWith("/**") && comment.length() > 4) {
            pendingJavadoc = comment;
        }
        moveTo(close + 2);
    }

    // ---- identifiers and keywords ----

    private Token identifier() {
        int end = current;
        while (end < source.length()) {
            int codePoint = source.codePointAt(end);
            if (end > current && !isIdentifierPart(codePoint)) {
                break;
            }
            end += Character.charCount(codePoint);
        }
        String word = source.substring(current, end);
        if (word.equals("non") && source.startsWith("-sealed", end) && !isIdentifierPartAt(end + 7)) {
            end += 7;
            word = "non-sealed";
        }
        moveTo(end);

        if (MODIFIERS.contains(word)) {
            return addToken(TokenType.MODIFIER);
        } else if (BASIC_TYPES.contains(word)) {
            return addToken(TokenType.BASIC_TYPE);
        } else if (KEYWORDS.contains(word)) {
            return addToken(TokenType.KEYWORD);
        } else if (word.equals("true") || word.equals("false")) {
            return addToken(TokenType.BOOLEAN);
        } else if (word.equals("null")) {
            return addToken(TokenType.NULL);
        }
        return addToken(TokenType.IDENTIFIER);
    }

    private boolean isIdentifierPartAt(int index) {
        return index < source.length() && isIdentifierPart(source.codePointAt(index));
    }

    static boolean isIdentifierStart(int codePoint) {
        switch (Character.getType(codePoint)) {
            case Character.UPPERCASE_LETTER:
            case Character.LOWERCASE_LETTER:
            case Character.TITLECASE_LETTER:
            case Character.MODIFIER_LETTER:
            case Character.OTHER_LETTER:
            case Character.LETTER_NUMBER:
            case Character.CONNECTOR_PUNCTUATION:
            case Character.CURRENCY_SYMBOL:
                return true;
            default:
                return false;
        }
    }

    static boolean isIdentifierPart(int codePoint) {
        if (isIdentifierStart(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.COMBINING_SPACING_MARK
                || type == Character.NON_SPACING_MARK
                || type == Character.DECIMAL_DIGIT_NUMBER;
    }

    // ---- numbers ----

    private Token number() {
        char next = peekNext();
        if (peek() == '0' && (next == 'x' || next == 'X')) {
            return hexNumber();
        }
        if (peek() == '0' && (next == 'b' || next == 'B')) {
            moveTo(current + 2);
            readDigits(BINARY_DIGITS);
            return integerSuffix(TokenType.BINARY_INTEGER);
        }
        if (peek() == '0' && (OCTAL_DIGITS.indexOf(next) >= 0 || next == '_') && !continuesAsDecimalFloat()) {
            advance();
            readDigits(OCTAL_DIGITS);
            return integerSuffix(TokenType.OCTAL_INTEGER);
        }

        readDigits(DECIMAL_DIGITS);
        if ("eEfFdD".indexOf(peek()) >= 0 || (peek() == '.' && peekNext() != '.')) {
            return decimalFloatingPoint();
        }
        return integerSuffix(TokenType.DECIMAL_INTEGER);
    }

    // Literals such as 017.5 or 09e1 are decimal even though they start with a zero.
    private boolean continuesAsDecimalFloat() {
        int i = current;
        while (i < source.length() && (isDigit(source.charAt(i)) || source.charAt(i) == '_')) {
            i++;
        }
        return i < source.length() && ".eEfFdD".indexOf(source.charAt(i)) >= 0;
    }

    private Token decimalFloatingPoint() {
        if (peek() == '.') {
            advance();
            readDigits(DECIMAL_DIGITS);
        }
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            readDigits(DECIMAL_DIGITS);
        }
        if ("fFdD".indexOf(peek()) >= 0) {
            advance();
        }
        return addToken(TokenType.DECIMAL_FLOATING_POINT);
    }

    private Token hexNumber() {
        moveTo(current + 2);
        readDigits(HEX_DIGITS);
        if (peek() != '.' && peek() != 'p' && peek() != 'P') {
            return integerSuffix(TokenType.HEX_INTEGER);
        }

        if (peek() == '.') {
            advance();
            readDigits(HEX_DIGITS);
        }
        if (peek() != 'p' && peek() != 'P') {
            error("Invalid hex float literal", current);
            return addToken(TokenType.HEX_FLOATING_POINT);
        }
        advance();
        if (peek() == '+' || peek() == '-') {
            advance();
        }
        readDigits(DECIMAL_DIGITS);
        if ("fFdD".indexOf(peek()) >= 0) {
            advance();
        }
        return addToken(TokenType.HEX_FLOATING_POINT);
    }

    private Token integerSuffix(TokenType type) {
        if (peek() == 'l' || peek() == 'L') {
            advance();
        }
        return addToken(type);
    }

    private void readDigits(String digits) {
        while (!isAtEnd() && (digits.indexOf(peek()) >= 0 || peek() == '_')) {
            advance();
        }
    }

    // ---- string, character and text block literals ----

    private Token quoted(char delimiter, TokenType type) {
        int i = current + 1;
        while (i < source.length() && source.charAt(i) != delimiter && !isLineTerminator(source.charAt(i))) {
            i += source.charAt(i) == '\\' ? 2 : 1;
        }
        if (i >= source.length() || source.charAt(i) != delimiter) {
            error("Unterminated character/string literal", Math.min(i, source.length()));
            int end = Math.min(i, source.length());
            String value = decodeEscapes(source.substring(current + 1, end), false, current + 1);
            moveTo(end);
            return addToken(type, value);
        }
        String value = decodeEscapes(source.substring(current + 1, i), false, current + 1);
        moveTo(i + 1);
        return addToken(type, value);
    }

    private Token textBlock() {
        int contentStart = current + 3;
        int i = contentStart;
        int close = -1;
        while (i < source.length()) {
            if (source.charAt(i) == '\\') {
                i += 2;
            } else if (source.startsWith("\"\"\"", i)) {
                close = i;
                break;
            } else {
                i++;
            }
        }
        if (close < 0) {
            error("Unterminated text block", current);
            close = source.length();
        }
        String content = TextBlocks.stripIndent(source.substring(contentStart, close));
        String value = decodeEscapes(content, true, current);
        moveTo(Math.min(close + 3, source.length()));
        return addToken(TokenType.TEXT_BLOCK, value);
    }

    /**
     * Replaces escape sequences with the characters they stand for.
     *
     * @param content The literal content without delimiters.
     * @param textBlock Whether a backslash before a line terminator is a line continuation.
     * @param errorIndex Where {@code content} starts in the source. For text blocks, where the literal starts.
     * @return The decoded content.
     */
    private String decodeEscapes(String content, boolean textBlock, int errorIndex) {
        if (content.indexOf('\\') < 0) {
            return content;
        }
        StringBuilder out = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c != '\\' || i + 1 >= content.length()) {
                out.append(c);
                i++;
                continue;
            }
            char escaped = content.charAt(i + 1);
            switch (escaped) {
                case 'b': out.append('\b'); i += 2; break;
                case 't': out.append('\t'); i += 2; break;
                case 'n': out.append('\n'); i += 2; break;
                case 'f': out.append('\f'); i += 2; break;
                case 'r': out.append('\r'); i += 2; break;
                case 's': out.append(' '); i += 2; break;
                case '"': out.append('"'); i += 2; break;
                case '\'': out.append('\''); i += 2; break;
                case '\\': out.append('\\'); i += 2; break;
                case '\n':
                    if (textBlock) {
                        i += 2;
                        break;
                    }
                    error("Illegal escape character", textBlock ? errorIndex : errorIndex + i + 1);
                    i += 2;
                    break;
                default:
                    if (OCTAL_DIGITS.indexOf(escaped) >= 0) {
                        int maxDigits = escaped <= '3' ? 3 : 2;
                        int end = i + 1;
                        while (end < content.length() && end - (i + 1) < maxDigits && OCTAL_DIGITS.indexOf(content.charAt(end)) >= 0) {
                            end++;
                        }
                        out.append((char) Integer.parseInt(content.substring(i + 1, end), 8));
                        i = end;
                    } else {
                        error("Illegal escape character", textBlock ? errorIndex : errorIndex + i + 1);
                        out.append(escaped);
                        i += 2;
                    }
            }
        }
        return out.toString();
    }

    // ---- unicode escapes ----

    private String decodeUnicodeEscapes(String raw) {
        if (raw.indexOf("\\u") < 0) {
            return raw;
        }
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c != '\\') {
                out.append(c);
                i++;
                continue;
            }
            int run = i;
            while (run < raw.length() && raw.charAt(run) == '\\') {
                run++;
            }
            // Only a backslash preceded by an even number of backslashes can start an escape.
            if (run >= raw.length() || raw.charAt(run) != 'u' || (run - i) % 2 == 0) {
                out.append(raw, i, run);
                i = run;
                continue;
            }
            out.append(raw, i, run - 1);
            int digits = run;
            while (digits < raw.length() && raw.charAt(digits) == 'u') {
                digits++;
            }
            if (digits + 4 <= raw.length() && isHex(raw, digits, digits + 4)) {
                out.append((char) Integer.parseInt(raw.substring(digits, digits + 4), 16));
                i = digits + 4;
            } else {
                recordError(buildError("Invalid unicode escape", raw, run - 1));
                out.append(raw, run - 1, digits);
                i = digits;
            }
        }
        return out.toString();
    }

    private static boolean isHex(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (HEX_DIGITS.indexOf(text.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    // ---- helpers ----

    private Token addToken(TokenType type) {
        return addToken(type, source.substring(start, current));
    }

    private Token addToken(TokenType type, String value) {
        String text = source.substring(start, current);
        Token token = new Token(type, text, value, tokenPosition, pendingJavadoc);
        pendingJavadoc = null;
        return token;
    }

    private void error(String description, int index) {
        recordError(buildError(description, source, index));
    }

    private LexerException buildError(String description, String text, int index) {
        int errorLineStart = text.lastIndexOf('\n', index - 1);
        int errorLine = 1;
        for (int i = 0; i < index && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                errorLine++;
            }
        }
        int lineEnd = text.indexOf('\n', errorLineStart + 1);
        String sourceLine = text.substring(errorLineStart + 1, lineEnd < 0 ? text.length() : lineEnd);
        String character = index < text.length() ? String.valueOf(text.charAt(index)) : "";
        return new LexerException(description, character, errorLine, index - errorLineStart, sourceLine);
    }

    private void recordError(LexerException error) {
        errors.add(error);
        if (diagnostics != null) {
            diagnostics.reportError(error.getMessage(), fileName, error.getLine());
        }
        if (!ignoreErrors) {
            throw error;
        }
        LOG.debug("Ignoring lexical error in {}: {}", fileName, error.getMessage());
    }

    private void moveTo(int index) {
        while (current < index) {
            advance();
        }
    }

    private char advance() {
        char c = source.charAt(current);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        current++;
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r';
    }
}
