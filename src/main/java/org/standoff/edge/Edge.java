package org.standoff.edge;

import java.util.List;

/**
 * A named reference to one or more spans of anchored text. Discontinuous elements have
 * more than one span.
 *
 * @param name The element name.
 * @param spans The spans, never empty.
 */
public record Edge(String name, List<Span> spans) {

    public Edge {
        if (spans == null || spans.isEmpty()) {
            throw new IllegalArgumentException("An edge needs at least one span: " + name);
        }
        spans = List.copyOf(spans);
    }

    /**
     * Returns the encoded form, which is the only external identity of an edge.
     * @return The edge string.
     */
    public String encode() {
        return EdgeCodec.encode(name, spans);
    }

    @Override
    public String toString() {
        return encode();
    }
}
