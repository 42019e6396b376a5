package org.standoff.annotation;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when an annotation file contains a line without a key/value delimiter.
 */
public class CorruptAnnotationException extends IOException {

    private final Path file;
    private final int lineNumber;

    /**
     * Constructs a new exception for the offending line.
     * @param file The annotation file being read.
     * @param lineNumber The 1-based number of the offending line.
     */
    public CorruptAnnotationException(Path file, int lineNumber) {
        super(String.format("Corrupt annotation in %s, line %d: no key/value delimiter", file, lineNumber));
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public Path getFile() {
        return file;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
