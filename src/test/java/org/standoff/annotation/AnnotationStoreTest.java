package org.standoff.annotation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnnotationStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void roundTripPreservesValuesAndOrder() throws IOException {
        // Arrange
        Map<String, String> annotation = new LinkedHashMap<>();
        annotation.put("w:b-c", "two words");
        annotation.put("w:a-b", "back\\slash");
        annotation.put("s:a-c", "line one\nline two");
        annotation.put("x:c-d", "literal \\n, not a newline");
        annotation.put("y:d-e", "");
        annotation.put("z:e-f", "carriage\rreturn");
        Path file = tempDir.resolve("values");

        // Act
        AnnotationStore.write(file, annotation);
        Map<String, String> read = AnnotationStore.read(file);

        // Assert
        assertThat(read).containsExactlyEntriesOf(annotation);
        assertThat(Files.readString(file, StandardCharsets.UTF_8).chars().filter(c -> c == '\n').count()).isEqualTo(6);
    }

    @Test
    void repeatedKeysSurviveAsSeparateEntries() throws IOException {
        // Arrange
        List<Map.Entry<String, String>> entries = List.of(Map.entry("k", "1"), Map.entry("j", "2"), Map.entry("k", "3"));
        Path file = tempDir.resolve("repeated");

        // Act
        AnnotationStore.write(file, entries);

        // Assert
        assertThat(AnnotationStore.readEntries(file)).containsExactlyElementsOf(entries);
        assertThat(AnnotationStore.readKeys(file)).containsExactly("k", "j", "k");
        assertThat(AnnotationStore.read(file)).containsExactly(Map.entry("k", "3"), Map.entry("j", "2"));
    }

    @Test
    void nullValueIsWrittenAsEmpty() throws IOException {
        Path file = tempDir.resolve("nulls");

        AnnotationStore.write(file, List.of(new AbstractMap.SimpleEntry<>("w:a-b", (String) null)));

        assertThat(AnnotationStore.read(file)).containsEntry("w:a-b", "");
    }

    @Test
    void writeCreatesParentDirectories() throws IOException {
        Path file = tempDir.resolve("nested/dir/tokens");

        AnnotationStore.write(file, Map.of("w:a-b", "x"));

        assertThat(AnnotationStore.exists(file)).isTrue();
        assertThat(AnnotationStore.exists(tempDir.resolve("nested/dir/missing"))).isFalse();
    }

    @Test
    void readKeysKeepsFileOrder() throws IOException {
        Path file = tempDir.resolve("keys");
        Files.writeString(file, "w:c-d x\nw:a-b y\n", StandardCharsets.UTF_8);

        assertThat(AnnotationStore.readKeys(file)).containsExactly("w:c-d", "w:a-b");
    }

    @Test
    void lineWithoutDelimiterIsCorrupt() throws IOException {
        // Arrange
        Path file = tempDir.resolve("corrupt");
        Files.writeString(file, "w:a-b fine\nbroken\n", StandardCharsets.UTF_8);

        // Act & Assert
        assertThatThrownBy(() -> AnnotationStore.read(file))
                .isInstanceOf(CorruptAnnotationException.class)
                .satisfies(e -> assertThat(((CorruptAnnotationException) e).getLineNumber()).isEqualTo(2));
    }

    @Test
    void escapeAndUnescape() {
        assertThat(AnnotationStore.escape("a\\b\nc")).isEqualTo("a\\\\b\\nc");
        assertThat(AnnotationStore.unescape("a\\\\b\\nc")).isEqualTo("a\\b\nc");
        assertThat(AnnotationStore.unescape("a\\\\nb")).isEqualTo("a\\nb");
        assertThat(AnnotationStore.unescape("trailing\\")).isEqualTo("trailing\\");
    }
}
