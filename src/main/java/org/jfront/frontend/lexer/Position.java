package org.jfront.frontend.lexer;

/**
 * A location in the source text. Positions order by line, then column.
 *
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 */
public record Position(int line, int column) implements Comparable<Position> {

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
