package org.standoff.annotation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads and writes annotation files: UTF-8, one {@code key value} record per line,
 * split on the first space. Backslashes and newlines in values are escaped as
 * {@code \\} and {@code \n}, so every record occupies exactly one line.
 */
public final class AnnotationStore {

    private static final Logger LOG = LoggerFactory.getLogger(AnnotationStore.class);

    /** Separates the key from the value on each line. */
    public static final char DELIMITER = ' ';

    private AnnotationStore() {
        // Private constructor to prevent instantiation
    }

    /**
     * Checks whether an annotation file exists.
     * @param file The annotation file.
     * @return {@code true} if it exists as a regular file.
     */
    public static boolean exists(Path file) {
        return Files.isRegularFile(file);
    }

    /**
     * Writes an annotation, overwriting the file if it exists. Missing parent directories are
     * created. A {@code null} value is written as the empty string.
     *
     * @param file The target file.
     * @param entries The records, written in iteration order.
     * @throws IOException if the file cannot be written.
     */
    public static void write(Path file, Iterable<? extends Map.Entry<String, String>> entries) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        int count = 0;
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, String> entry : entries) {
                out.write(entry.getKey());
                out.write(DELIMITER);
                out.write(escape(entry.getValue()));
                out.write('\n');
                count++;
            }
        }
        LOG.info("Wrote {} items: {}", count, file);
    }

    /**
     * Writes an annotation held in a map, in the map's iteration order.
     */
    public static void write(Path file, Map<String, String> annotation) throws IOException {
        write(file, annotation.entrySet());
    }

    /**
     * Reads an annotation file into a map. A key that occurs more than once keeps its last
     * value; use {@link #readEntries(Path)} to see every record.
     *
     * @param file The annotation file.
     * @return The records in file order.
     * @throws CorruptAnnotationException if a line has no delimiter.
     * @throws IOException if the file cannot be read.
     */
    public static LinkedHashMap<String, String> read(Path file) throws IOException {
        LinkedHashMap<String, String> annotation = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : readEntries(file)) {
            annotation.put(entry.getKey(), entry.getValue());
        }
        return annotation;
    }

    /**
     * Reads every record of an annotation file, one entry per line.
     *
     * @param file The annotation file.
     * @return The records in file order, repeated keys included.
     * @throws CorruptAnnotationException if a line has no delimiter.
     * @throws IOException if the file cannot be read.
     */
    public static List<Map.Entry<String, String>> readEntries(Path file) throws IOException {
        List<Map.Entry<String, String>> entries = new ArrayList<>();
        List<String> lines = lines(file);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int ix = line.indexOf(DELIMITER);
            if (ix < 0) {
                throw new CorruptAnnotationException(file, i + 1);
            }
            entries.add(Map.entry(line.substring(0, ix), unescape(line.substring(ix + 1))));
        }
        LOG.info("Read {} items: {}", entries.size(), file);
        return entries;
    }

    /**
     * Reads only the keys of an annotation file, in file order.
     *
     * @param file The annotation file.
     * @return The keys, one per line.
     * @throws IOException if the file cannot be read or is corrupt.
     */
    public static List<String> readKeys(Path file) throws IOException {
        return readEntries(file).stream().map(Map.Entry::getKey).collect(Collectors.toList());
    }

    /**
     * Escapes backslashes and newlines.
     * @param value A value, possibly {@code null}.
     * @return The escaped value.
     */
    static String escape(String value) {
        if (value == null) return "";
        return value.replace("\\", "\\\\").replace("\n", "\\n");
    }

    /**
     * Reverses {@link #escape(String)}. Unknown escape sequences are kept verbatim.
     * @param value An escaped value.
     * @return The original value.
     */
    static String unescape(String value) {
        if (value.indexOf('\\') < 0) return value;
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(i + 1);
                if (next == '\\') {
                    sb.append('\\');
                    i++;
                    continue;
                }
                if (next == 'n') {
                    sb.append('\n');
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    // Lines are split on '\n' only; a '\r' belongs to the value.
    private static List<String> lines(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < content.length()) {
            int nl = content.indexOf('\n', start);
            if (nl < 0) {
                lines.add(content.substring(start));
                break;
            }
            lines.add(content.substring(start, nl));
            start = nl + 1;
        }
        return lines;
    }
}
