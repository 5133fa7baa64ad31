package org.jfront.frontend.parser;

/**
 * Signals that the parsing API was used incorrectly, e.g. markers popped out of order.
 * Malformed source never causes this exception.
 */
public class ParserUsageException extends RuntimeException {

    public ParserUsageException(String message) {
        super(message);
    }
}
