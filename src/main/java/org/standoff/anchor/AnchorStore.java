package org.standoff.anchor;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Bookkeeping of the anchors of one document: a bijection between text positions and
 * anchor identifiers. Anchors are created lazily, the first time a position is referenced.
 * <p>
 * A store is owned by exactly one document and must not be shared across documents.
 * It is not thread-safe.
 */
public class AnchorStore {

    private final IdentifierGenerator generator;
    private final String prefix;
    private final NavigableMap<Integer, String> positionToAnchor = new TreeMap<>();
    private final Map<String, Integer> anchorToPosition = new HashMap<>();

    /**
     * Creates an empty store.
     * @param generator The per-document identifier generator.
     * @param prefix The prefix of every anchor created by this store.
     */
    public AnchorStore(IdentifierGenerator generator, String prefix) {
        this.generator = generator;
        this.prefix = prefix;
    }

    /**
     * Creates a store pre-populated with anchors read from an existing corpus text.
     * Existing anchors are always reused; new ones never collide with them.
     *
     * @param generator The per-document identifier generator.
     * @param prefix The prefix of new anchors.
     * @param existing Existing position to anchor bindings.
     */
    public AnchorStore(IdentifierGenerator generator, String prefix, Map<Integer, String> existing) {
        this(generator, prefix);
        existing.forEach((position, anchor) -> {
            if (anchorToPosition.put(anchor, position) != null) {
                throw new IllegalArgumentException("Anchor bound to more than one position: " + anchor);
            }
            positionToAnchor.put(position, anchor);
        });
    }

    /**
     * Returns the anchor at the given position, creating it on first reference.
     *
     * @param position A non-negative text position.
     * @return The anchor bound to {@code position}.
     */
    public String anchorAt(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("Negative text position: " + position);
        }
        String anchor = positionToAnchor.get(position);
        if (anchor == null) {
            anchor = generator.newIdentifier(prefix, anchorToPosition.keySet());
            positionToAnchor.put(position, anchor);
            anchorToPosition.put(anchor, position);
        }
        return anchor;
    }

    /**
     * Returns the position of an anchor.
     * @param anchor The anchor to resolve.
     * @return The position, or {@code null} if the anchor is unknown.
     */
    public Integer positionOf(String anchor) {
        return anchorToPosition.get(anchor);
    }

    public boolean hasAnchorAt(int position) {
        return positionToAnchor.containsKey(position);
    }

    public int size() {
        return positionToAnchor.size();
    }

    /**
     * Returns a read-only view of the position to anchor map, in ascending position order.
     * @return The position to anchor map.
     */
    public NavigableMap<Integer, String> positionToAnchor() {
        return Collections.unmodifiableNavigableMap(positionToAnchor);
    }

    /**
     * Returns a read-only view of the anchor to position map.
     * @return The anchor to position map.
     */
    public Map<String, Integer> anchorToPosition() {
        return Collections.unmodifiableMap(anchorToPosition);
    }
}
