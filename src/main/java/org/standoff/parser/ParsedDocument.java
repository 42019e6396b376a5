package org.standoff.parser;

import org.standoff.annotation.AnnotationStore;
import org.standoff.corpus.CorpusText;
import org.standoff.corpus.CorpusTextCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of parsing one document: its anchored text and one annotation per
 * configured store, each mapping edges to attribute values in the order the edges closed.
 *
 * @param corpusText The anchored text.
 * @param annotations The annotations by store name.
 */
public record ParsedDocument(CorpusText corpusText, Map<String, Map<String, String>> annotations) {

    public ParsedDocument {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        annotations.forEach((name, store) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(store))));
        annotations = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns one annotation store.
     * @param name The store name.
     * @return The edge to value map, empty if the store is unknown.
     */
    public Map<String, String> annotation(String name) {
        return annotations.getOrDefault(name, Map.of());
    }

    /**
     * Persists the corpus text and every annotation store. Each store is written to
     * {@code annotationDir/<store name>}.
     *
     * @param textFile The corpus text file.
     * @param annotationDir The directory of the annotation files.
     * @throws IOException if a file cannot be written.
     */
    public void writeTo(Path textFile, Path annotationDir) throws IOException {
        CorpusTextCodec.write(textFile, corpusText);
        for (Map.Entry<String, Map<String, String>> entry : annotations.entrySet()) {
            AnnotationStore.write(annotationDir.resolve(entry.getKey()), entry.getValue());
        }
    }
}
