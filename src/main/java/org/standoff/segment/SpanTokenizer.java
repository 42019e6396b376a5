package org.standoff.segment;

import java.util.List;

/**
 * Splits a string into spans. Offsets are relative to the string passed in.
 */
@FunctionalInterface
public interface SpanTokenizer {

    /**
     * Tokenizes a string.
     * @param text The string to split.
     * @return The spans, in order. Spans may be empty or contain only whitespace.
     */
    List<TextSpan> spanTokenize(String text);
}
