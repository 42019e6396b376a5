package org.standoff.segment;

/**
 * A character span of a string, {@code start} inclusive and {@code end} exclusive.
 *
 * @param start The start offset.
 * @param end The end offset.
 */
public record TextSpan(int start, int end) implements Comparable<TextSpan> {

    public boolean isEmpty() {
        return end <= start;
    }

    public TextSpan shift(int offset) {
        return new TextSpan(start + offset, end + offset);
    }

    @Override
    public int compareTo(TextSpan other) {
        int cmp = Integer.compare(start, other.start);
        return cmp != 0 ? cmp : Integer.compare(end, other.end);
    }
}
