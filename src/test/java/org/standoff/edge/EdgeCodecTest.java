package org.standoff.edge;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link EdgeCodec}.
 */
@Tag("unit")
class EdgeCodecTest {

    @Test
    void encodesSingleSpan() {
        assertThat(EdgeCodec.encode("w", "a1", "a2")).isEqualTo("w:a1-a2");
    }

    @Test
    void encodesDiscontinuousEdge() {
        String edge = EdgeCodec.encode("link", new Span("a1", "a2"), new Span("a3", "a4"));

        assertThat(edge).isEqualTo("link:a1-a2:a3-a4");
    }

    @Test
    void stripsSeparatorsFromParts() {
        assertThat(EdgeCodec.encode("x:y", "a-1", "b")).isEqualTo("xy:a1-b");
    }

    @Test
    void readsNameStartAndEnd() {
        // Arrange
        String edge = "link:a1-a2:a3-a4";

        // Act & Assert
        assertThat(EdgeCodec.name(edge)).isEqualTo("link");
        assertThat(EdgeCodec.start(edge)).isEqualTo("a1");
        assertThat(EdgeCodec.end(edge)).isEqualTo("a4");
        assertThat(EdgeCodec.spans(edge)).containsExactly(new Span("a1", "a2"), new Span("a3", "a4"));
    }

    @Test
    void edgeWithoutSeparatorsIsItsOwnNameAndEnd() {
        assertThat(EdgeCodec.name("plain")).isEqualTo("plain");
        assertThat(EdgeCodec.start("plain")).isEmpty();
        assertThat(EdgeCodec.end("plain")).isEqualTo("plain");
        assertThat(EdgeCodec.spans("plain")).isEmpty();
    }

    @Test
    void decodeGivesStructuredEdge() {
        Edge edge = EdgeCodec.decode("s:a1-a9");

        assertThat(edge.name()).isEqualTo("s");
        assertThat(edge.spans()).containsExactly(new Span("a1", "a9"));
        assertThat(edge.encode()).isEqualTo("s:a1-a9");
    }

    @Test
    void rejectsEdgeWithoutSpans() {
        assertThatThrownBy(() -> EdgeCodec.encode("w", List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Edge("w", List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
