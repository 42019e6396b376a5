package org.standoff.markup;

/**
 * A location in the markup source.
 *
 * @param line The 1-based line number.
 * @param column The 0-based column number.
 * @param offset The character offset from the start of the source.
 */
public record SourceLocation(int line, int column, int offset) {

    @Override
    public String toString() {
        return "{" + line + ":" + column + "}";
    }
}
