package org.standoff.corpus;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * The de-anchored text of a document together with its anchors.
 *
 * @param text The literal text.
 * @param positionToAnchor Anchors by position, in ascending position order.
 * @param anchorToPosition Positions by anchor.
 */
public record CorpusText(
        String text,
        NavigableMap<Integer, String> positionToAnchor,
        Map<String, Integer> anchorToPosition
) {

    public CorpusText {
        positionToAnchor = Collections.unmodifiableNavigableMap(new TreeMap<>(positionToAnchor));
        anchorToPosition = Collections.unmodifiableMap(new HashMap<>(anchorToPosition));
    }

    /**
     * Builds a corpus text from a position to anchor map, deriving the inverse map.
     *
     * @param text The literal text.
     * @param positionToAnchor Anchors by position.
     * @return The corpus text.
     */
    public static CorpusText of(String text, Map<Integer, String> positionToAnchor) {
        Map<String, Integer> inverse = new HashMap<>();
        positionToAnchor.forEach((position, anchor) -> {
            if (inverse.put(anchor, position) != null) {
                throw new IllegalArgumentException("Anchor bound to more than one position: " + anchor);
            }
        });
        return new CorpusText(text, new TreeMap<>(positionToAnchor), inverse);
    }

    public int length() {
        return text.length();
    }
}
