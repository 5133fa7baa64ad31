package org.jfront.frontend.parser;

import org.jfront.frontend.lexer.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * A lookahead cursor over a lazily produced token sequence.
 * <p>
 * The cursor pulls tokens from the underlying iterator only when they are peeked or consumed.
 * Checkpoints ("markers") can be pushed and later popped either accepting the tokens consumed
 * since then, or rejecting them, in which case those tokens are replayed in order before any
 * further token is read. Every token consumed since the oldest open marker is buffered for that
 * purpose; without open markers the buffer only holds tokens that were peeked but not consumed.
 * <p>
 * Looking past the end of the sequence yields an end-of-input sentinel instead of failing.
 */
public class TokenCursor {

    private record Checkpoint(int position, Token last) {
    }

    private final Iterator<Token> source;
    private final List<Token> buffer = new ArrayList<>();
    private final Deque<Checkpoint> markers = new ArrayDeque<>();
    private final Token sentinel = Token.endOfInput();
    private int position = 0;
    private Token last;

    /**
     * @param source The token sequence, typically a {@link org.jfront.frontend.lexer.Lexer}.
     */
    public TokenCursor(Iterator<Token> source) {
        this.source = source;
    }

    public TokenCursor(List<Token> tokens) {
        this(tokens.iterator());
    }

    /**
     * @return The next token without consuming it.
     */
    public Token peek() {
        return peek(0);
    }

    /**
     * @param offset How far to look ahead; 0 is the next token.
     * @return The token at the offset, or the end-of-input sentinel past the end.
     */
    public Token peek(int offset) {
        if (offset < 0) {
            throw new ParserUsageException("Negative lookahead offset: " + offset);
        }
        while (buffer.size() <= position + offset) {
            if (!source.hasNext()) {
                return sentinel;
            }
            buffer.add(source.next());
        }
        return buffer.get(position + offset);
    }

    /**
     * Consumes the next token. At the end of input the sentinel is returned and nothing moves.
     * @return The consumed token.
     */
    public Token advance() {
        Token token = peek();
        if (token == sentinel) {
            return sentinel;
        }
        position++;
        last = token;
        compact();
        return token;
    }

    /**
     * @return The most recently consumed token, or {@code null} if none was consumed yet.
     */
    public Token last() {
        return last;
    }

    public boolean isAtEnd() {
        return peek() == sentinel;
    }

    /**
     * Opens a checkpoint at the current position.
     */
    public void pushMarker() {
        markers.push(new Checkpoint(position, last));
    }

    /**
     * Closes the most recent checkpoint.
     * @param accept {@code true} to keep the tokens consumed since the checkpoint,
     *               {@code false} to rewind to it.
     * @throws ParserUsageException if no checkpoint is open.
     */
    public void popMarker(boolean accept) {
        if (markers.isEmpty()) {
            throw new ParserUsageException("No marker to pop");
        }
        Checkpoint checkpoint = markers.pop();
        if (!accept) {
            position = checkpoint.position();
            last = checkpoint.last();
        }
        compact();
    }

    /**
     * @return The number of open checkpoints.
     */
    public int markerDepth() {
        return markers.size();
    }

    /**
     * Opens a scoped checkpoint for use in a try-with-resources statement. Unless
     * {@link Marker#commit()} is called before the scope ends, closing it rewinds the cursor,
     * including when the scope is left by an exception.
     *
     * @return The open marker.
     */
    public Marker mark() {
        pushMarker();
        return new Marker(markers.size());
    }

    private void compact() {
        if (markers.isEmpty() && position > 0) {
            buffer.subList(0, position).clear();
            position = 0;
        }
    }

    /**
     * A checkpoint bound to a lexical scope.
     */
    public final class Marker implements AutoCloseable {

        private final int depth;
        private boolean committed;
        private boolean closed;

        private Marker(int depth) {
            this.depth = depth;
        }

        /**
         * Keeps the tokens consumed inside the scope when it closes.
         */
        public void commit() {
            committed = true;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (markers.size() != depth) {
                throw new ParserUsageException("Markers must be closed in reverse order of creation");
            }
            closed = true;
            popMarker(committed);
        }
    }
}
