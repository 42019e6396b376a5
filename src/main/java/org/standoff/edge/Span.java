package org.standoff.edge;

/**
 * A pair of anchors delimiting a stretch of text.
 *
 * @param start The anchor at the start position.
 * @param end The anchor at the end position.
 */
public record Span(String start, String end) {
}
