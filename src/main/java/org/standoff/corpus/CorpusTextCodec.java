package org.standoff.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a text together with its anchors into one self-describing corpus text file.
 * <p>
 * Each anchor is written as {@code #anchor#} in front of the character at its position;
 * a literal {@code #} in the text is written as {@code ##}.
 */
public final class CorpusTextCodec {

    private static final Logger LOG = LoggerFactory.getLogger(CorpusTextCodec.class);

    /** Marks the beginning and end of an anchor. */
    public static final char DELIMITER = '#';

    private static final String SINGLE = String.valueOf(DELIMITER);
    private static final String DOUBLE = SINGLE + SINGLE;

    private CorpusTextCodec() {
        // Private constructor to prevent instantiation
    }

    /**
     * Encodes a text and its anchors.
     *
     * @param text The literal text.
     * @param positionToAnchor Anchors by position; every position must lie in {@code [0, text.length()]}.
     * @return The anchored text.
     */
    public static String encode(String text, Map<Integer, String> positionToAnchor) {
        StringBuilder out = new StringBuilder(text.length() + positionToAnchor.size() * 12);
        int pos = 0;
        for (Map.Entry<Integer, String> entry : new TreeMap<>(positionToAnchor).entrySet()) {
            int next = entry.getKey();
            if (next < 0 || next > text.length()) {
                throw new IllegalArgumentException("Anchor position out of range: " + next);
            }
            String anchor = entry.getValue();
            if (anchor.isEmpty() || anchor.indexOf(DELIMITER) >= 0) {
                throw new IllegalArgumentException("Invalid anchor at position " + next + ": '" + anchor + "'");
            }
            out.append(text.substring(pos, next).replace(SINGLE, DOUBLE))
                    .append(DELIMITER).append(anchor).append(DELIMITER);
            pos = next;
        }
        out.append(text.substring(pos).replace(SINGLE, DOUBLE));
        return out.toString();
    }

    /**
     * Decodes an anchored text.
     *
     * @param encoded The anchored text.
     * @param source A description of the input, for error messages.
     * @return The text and both anchor maps.
     * @throws MismatchedAnchorDelimitersException if a delimiter is left unmatched.
     */
    public static CorpusText decode(String encoded, String source) throws MismatchedAnchorDelimitersException {
        StringBuilder text = new StringBuilder(encoded.length());
        Map<Integer, String> positionToAnchor = new HashMap<>();
        Map<String, Integer> anchorToPosition = new HashMap<>();
        int end = -1;
        while (true) {
            int start = encoded.indexOf(DELIMITER, end + 1);
            if (start < 0) {
                text.append(encoded, end + 1, encoded.length());
                break;
            }
            text.append(encoded, end + 1, start);
            end = encoded.indexOf(DELIMITER, start + 1);
            if (end < 0) {
                throw new MismatchedAnchorDelimitersException(source, start);
            } else if (end == start + 1) {
                text.append(DELIMITER);
            } else {
                String anchor = encoded.substring(start + 1, end);
                positionToAnchor.put(text.length(), anchor);
                anchorToPosition.put(anchor, text.length());
            }
        }
        return new CorpusText(text.toString(), new TreeMap<>(positionToAnchor), anchorToPosition);
    }

    /**
     * Writes a corpus text file, overwriting it if it exists.
     *
     * @param file The target file.
     * @param text The literal text.
     * @param positionToAnchor Anchors by position.
     * @throws IOException if the file cannot be written.
     */
    public static void write(Path file, String text, Map<Integer, String> positionToAnchor) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, encode(text, positionToAnchor), StandardCharsets.UTF_8);
        LOG.info("Wrote {} chars, {} anchors: {}", text.length(), positionToAnchor.size(), file);
    }

    public static void write(Path file, CorpusText corpusText) throws IOException {
        write(file, corpusText.text(), corpusText.positionToAnchor());
    }

    /**
     * Reads a corpus text file.
     *
     * @param file The corpus text file.
     * @return The text and both anchor maps.
     * @throws MismatchedAnchorDelimitersException if a delimiter is left unmatched.
     * @throws IOException if the file cannot be read.
     */
    public static CorpusText read(Path file) throws IOException {
        CorpusText corpusText = decode(Files.readString(file, StandardCharsets.UTF_8), file.toString());
        LOG.info("Read {} chars, {} anchors: {}", corpusText.length(), corpusText.anchorToPosition().size(), file);
        return corpusText;
    }
}
