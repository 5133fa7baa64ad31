package org.jfront.frontend.parser;

import org.jfront.frontend.lexer.Token;

/**
 * The token-level primitives a grammar procedure uses to inspect and consume the token stream.
 * Every primitive that takes expectations works on a sequence: the i-th expectation is matched
 * against the i-th upcoming token.
 */
public interface ParsingContext {

    /**
     * Consumes the upcoming tokens if they all match the expectations.
     * @param expected The expected tokens, in order.
     * @return {@code true} if the tokens matched and were consumed, {@code false} if nothing was consumed.
     * @throws ParserUsageException if no expectation is given.
     */
    boolean match(ExpectedToken... expected);

    /**
     * Checks the upcoming tokens against the expectations without consuming anything.
     * @param expected The expected tokens, in order.
     * @return {@code true} if every upcoming token matches its expectation.
     * @throws ParserUsageException if no expectation is given.
     */
    boolean check(ExpectedToken... expected);

    /**
     * Consumes one token per expectation, failing at the first token that does not match.
     * @param expected The expected tokens, in order.
     * @return The last consumed token.
     * @throws SyntaxException if a token does not match its expectation.
     * @throws ParserUsageException if no expectation is given.
     */
    Token consume(ExpectedToken... expected);

    /**
     * Consumes the next token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the next token without consuming it.
     * @return The next token, or the end-of-input sentinel.
     */
    Token peek();

    /**
     * Returns a token further ahead without consuming anything.
     * @param offset 0 for the next token.
     * @return The token at the offset, or the end-of-input sentinel.
     */
    Token peek(int offset);

    /**
     * Returns the previously consumed token.
     * @return The previous token, or {@code null} at the start.
     */
    Token previous();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
