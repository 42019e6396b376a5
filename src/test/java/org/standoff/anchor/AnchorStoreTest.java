package org.standoff.anchor;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnchorStoreTest {

    private static AnchorStore store(String prefix) {
        return new AnchorStore(new IdentifierGenerator(prefix, 100), prefix);
    }

    @Test
    void anchorAtIsIdempotent() {
        AnchorStore anchors = store("doc");

        String first = anchors.anchorAt(5);
        String second = anchors.anchorAt(5);

        assertThat(first).isEqualTo(second);
        assertThat(anchors.size()).isEqualTo(1);
    }

    @Test
    void mapsAreMutuallyInverse() {
        // Arrange
        AnchorStore anchors = store("doc");

        // Act
        String a = anchors.anchorAt(0);
        String b = anchors.anchorAt(7);
        String c = anchors.anchorAt(3);

        // Assert
        assertThat(a).isNotEqualTo(b).isNotEqualTo(c);
        assertThat(anchors.positionOf(a)).isEqualTo(0);
        assertThat(anchors.positionOf(b)).isEqualTo(7);
        assertThat(anchors.positionOf(c)).isEqualTo(3);
        assertThat(anchors.positionToAnchor().keySet()).containsExactly(0, 3, 7);
        anchors.positionToAnchor().forEach((position, anchor) ->
                assertThat(anchors.anchorToPosition()).containsEntry(anchor, position));
    }

    @Test
    void anchorsCarryThePrefix() {
        AnchorStore anchors = store("doc");

        assertThat(anchors.anchorAt(0)).startsWith("doc");
    }

    @Test
    void sameSeedAndCallOrderGiveSameAnchors() {
        AnchorStore first = store("doc");
        AnchorStore second = store("doc");

        for (int position : new int[]{0, 4, 2, 9}) {
            assertThat(first.anchorAt(position)).isEqualTo(second.anchorAt(position));
        }
    }

    @Test
    void unknownAnchorResolvesToNull() {
        AnchorStore anchors = store("doc");

        assertThat(anchors.positionOf("nope")).isNull();
        assertThat(anchors.hasAnchorAt(0)).isFalse();
    }

    @Test
    void existingAnchorsAreReused() {
        // Arrange
        AnchorStore anchors = new AnchorStore(new IdentifierGenerator("doc", 100), "doc", Map.of(0, "x0", 4, "x4"));

        // Act
        String reused = anchors.anchorAt(4);
        String created = anchors.anchorAt(2);

        // Assert
        assertThat(reused).isEqualTo("x4");
        assertThat(created).isNotIn("x0", "x4").startsWith("doc");
        assertThat(anchors.size()).isEqualTo(3);
    }

    @Test
    void rejectsAnAnchorBoundTwice() {
        assertThatThrownBy(() -> new AnchorStore(new IdentifierGenerator("doc"), "doc", Map.of(0, "x", 1, "x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("x");
    }

    @Test
    void rejectsNegativePositions() {
        assertThatThrownBy(() -> store("doc").anchorAt(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
