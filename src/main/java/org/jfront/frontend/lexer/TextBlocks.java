package org.jfront.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes incidental whitespace from the raw content of a text block.
 */
public final class TextBlocks {

    private TextBlocks() {
        // Utility class
    }

    /**
     * Normalizes line terminators to {@code \n}, removes the indentation shared by all non-blank
     * lines and strips trailing whitespace from every line. Lines that contain only whitespace
     * become empty and do not take part in computing the shared indentation.
     * Escape sequences are left untouched.
     *
     * @param raw The characters between the opening and closing delimiters.
     * @return The content with incidental whitespace removed.
     */
    public static String stripIndent(String raw) {
        String normalized = raw.replace("\r\n", "\n").replace('\r', '\n');
        String[] lines = normalized.split("\n", -1);

        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isBlank()) {
                indent = Math.min(indent, leadingWhitespace(line));
            }
        }

        List<String> stripped = new ArrayList<>(lines.length);
        for (String line : lines) {
            if (line.isBlank()) {
                stripped.add("");
            } else {
                stripped.add(line.substring(indent).stripTrailing());
            }
        }
        return String.join("\n", stripped);
    }

    private static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }
}
