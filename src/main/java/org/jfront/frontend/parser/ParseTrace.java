package org.jfront.frontend.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Logs entry into and exit from parse procedures when debug tracing is enabled.
 * Tracing never influences the result of a parse.
 */
public class ParseTrace {

    private static final Logger LOG = LoggerFactory.getLogger(ParseTrace.class);

    private final boolean enabled;
    private int depth = 0;

    public ParseTrace(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Runs a parse procedure, logging its entry, exit and any exception passing through.
     *
     * @param production The name of the grammar production.
     * @param cursor The cursor, used to show the lookahead token.
     * @param body The parse procedure.
     * @param <T> The type of node produced.
     * @return Whatever {@code body} returns.
     */
    public <T> T trace(String production, TokenCursor cursor, Supplier<T> body) {
        if (!enabled) {
            return body.get();
        }
        String indent = "  ".repeat(depth);
        LOG.debug("{}-> {} (next: {})", indent, production, cursor.peek());
        depth++;
        try {
            T result = body.get();
            LOG.debug("{}<- {} (next: {})", indent, production, cursor.peek());
            return result;
        } catch (RuntimeException e) {
            LOG.debug("{}<- {} failed: {}", indent, production, e.getMessage());
            throw e;
        } finally {
            depth--;
        }
    }

    /**
     * Records that a speculative attempt failed and was rolled back.
     */
    public void backtrack(String production, SyntaxException cause) {
        if (enabled) {
            LOG.debug("{}   backtracking from {}: {}", "  ".repeat(depth), production, cause.getMessage());
        }
    }
}
