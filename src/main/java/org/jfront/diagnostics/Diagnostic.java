package org.jfront.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced while scanning or parsing a source file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue, or -1 if it is not tied to a line.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem that makes the source unusable. */
        ERROR,
        /** A problem that still yields a result. */
        WARNING
    }

    @Override
    public String toString() {
        if (lineNumber < 0) {
            return String.format("[%s] %s: %s", type, fileName, message);
        }
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
