package org.parallang;

/**
 * Location of a character in the source text.
 *
 * @param offset 0-based index into the source string
 * @param line   1-based line number
 * @param column 1-based column, counted in code points
 */
public record Position(int offset, int line, int column) {
    public static final Position START = new Position(0, 1, 1);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
