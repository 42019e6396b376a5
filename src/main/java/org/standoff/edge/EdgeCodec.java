package org.standoff.edge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes edges as {@code name:start-end[:start-end...]} and reads the parts back.
 * <p>
 * The accessors split on the first or last separator only, so they stay well defined
 * for any anchor that contains no separator character.
 */
public final class EdgeCodec {

    /** Separates the name and the spans of an edge. */
    public static final String EDGE_SEPARATOR = ":";
    /** Separates the start and end anchor of a span. */
    public static final String SPAN_SEPARATOR = "-";

    private EdgeCodec() {
        // Private constructor to prevent instantiation
    }

    /**
     * Encodes an edge. Separator characters inside the name or the anchors are removed.
     *
     * @param name The element name.
     * @param spans The spans of the edge.
     * @return The edge string.
     */
    public static String encode(String name, List<Span> spans) {
        if (spans.isEmpty()) {
            throw new IllegalArgumentException("An edge needs at least one span: " + name);
        }
        StringBuilder sb = new StringBuilder(strip(name, EDGE_SEPARATOR));
        for (Span span : spans) {
            String joined = strip(span.start(), SPAN_SEPARATOR) + SPAN_SEPARATOR + strip(span.end(), SPAN_SEPARATOR);
            sb.append(EDGE_SEPARATOR).append(strip(joined, EDGE_SEPARATOR));
        }
        return sb.toString();
    }

    public static String encode(String name, Span... spans) {
        return encode(name, Arrays.asList(spans));
    }

    /**
     * Convenience for the common single-span edge.
     */
    public static String encode(String name, String start, String end) {
        return encode(name, List.of(new Span(start, end)));
    }

    /**
     * Returns the part before the first edge separator.
     * @param edge An edge string.
     * @return The element name.
     */
    public static String name(String edge) {
        int ix = edge.indexOf(EDGE_SEPARATOR);
        return ix < 0 ? edge : edge.substring(0, ix);
    }

    /**
     * Returns all spans of the edge, in order.
     * @param edge An edge string.
     * @return The spans.
     */
    public static List<Span> spans(String edge) {
        List<Span> spans = new ArrayList<>();
        int ix = edge.indexOf(EDGE_SEPARATOR);
        if (ix < 0) {
            return spans;
        }
        for (String part : edge.substring(ix + 1).split(EDGE_SEPARATOR, -1)) {
            int dash = part.indexOf(SPAN_SEPARATOR);
            if (dash < 0) {
                spans.add(new Span(part, ""));
            } else {
                spans.add(new Span(part.substring(0, dash), part.substring(dash + 1)));
            }
        }
        return spans;
    }

    /**
     * Returns the start anchor of the first span: the text between the first edge separator
     * and the following span separator.
     * @param edge An edge string.
     * @return The start anchor.
     */
    public static String start(String edge) {
        int ix = edge.indexOf(EDGE_SEPARATOR);
        String rest = ix < 0 ? "" : edge.substring(ix + 1);
        int dash = rest.indexOf(SPAN_SEPARATOR);
        return dash < 0 ? rest : rest.substring(0, dash);
    }

    /**
     * Returns the end anchor of the last span: the text after the last span separator.
     * @param edge An edge string.
     * @return The end anchor.
     */
    public static String end(String edge) {
        int ix = edge.lastIndexOf(SPAN_SEPARATOR);
        return ix < 0 ? edge : edge.substring(ix + 1);
    }

    /**
     * Decodes an edge string into its structured form.
     * @param edge An edge string.
     * @return The decoded edge.
     */
    public static Edge decode(String edge) {
        return new Edge(name(edge), spans(edge));
    }

    private static String strip(String value, String separator) {
        return value == null ? "" : value.replace(separator, "");
    }
}
