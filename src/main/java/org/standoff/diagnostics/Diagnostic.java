package org.standoff.diagnostics;

/**
 * A single structural event (error, warning, info) reported while reading
 * pseudo-XML markup.
 *
 * @param type The severity of the diagnostic.
 * @param kind What happened, for callers that want to filter or count events.
 * @param message The human readable message.
 * @param fileName The name of the document the event belongs to.
 * @param line The 1-based line in the source markup.
 * @param column The 0-based column in the source markup.
 */
public record Diagnostic(
        Type type,
        Kind kind,
        String message,
        String fileName,
        int line,
        int column
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** Malformed input that was dropped or repaired. */
        ERROR,
        /** Suspicious but tolerated input. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * The structural condition behind a diagnostic.
     */
    public enum Kind {
        UNMATCHED_END_TAG,
        AUTO_CLOSED,
        OVERLAP,
        SKIPPED_ELEMENT,
        CONTROL_CHARACTER,
        UNKNOWN_ENTITY,
        SPECIAL_CHARACTER,
        COMMENT,
        MALFORMED_COMMENT,
        COMMENT_IN_HEADER,
        PROCESSING_INSTRUCTION,
        DECLARATION
    }

    @Override
    public String toString() {
        return String.format("[%s] %s {%d:%d} %s", type, fileName, line, column, message);
    }
}
