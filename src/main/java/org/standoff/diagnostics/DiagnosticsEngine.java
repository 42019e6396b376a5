package org.standoff.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics produced while parsing one or more documents.
 * <p>
 * Every report is kept as a structured {@link Diagnostic} and forwarded to SLF4J at the
 * matching level, so callers can either assert on the collected events or just read the log.
 * An engine is owned by a single parse; it is not thread-safe.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param kind     The condition that caused the error.
     * @param message  The error message.
     * @param fileName The document in which the error occurred.
     * @param line     The line of the error.
     * @param column   The column of the error.
     */
    public void reportError(Diagnostic.Kind kind, String message, String fileName, int line, int column) {
        report(new Diagnostic(Diagnostic.Type.ERROR, kind, message, fileName, line, column));
    }

    /**
     * Reports a warning.
     *
     * @param kind     The condition that caused the warning.
     * @param message  The warning message.
     * @param fileName The document in which the warning occurred.
     * @param line     The line of the warning.
     * @param column   The column of the warning.
     */
    public void reportWarning(Diagnostic.Kind kind, String message, String fileName, int line, int column) {
        report(new Diagnostic(Diagnostic.Type.WARNING, kind, message, fileName, line, column));
    }

    private void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        String location = String.format("{%d:%d} ", diagnostic.line(), diagnostic.column());
        switch (diagnostic.type()) {
            case ERROR -> LOG.error("{}{}", location, diagnostic.message());
            case WARNING -> LOG.warn("{}{}", location, diagnostic.message());
            default -> LOG.info("{}{}", location, diagnostic.message());
        }
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return count(Diagnostic.Type.ERROR) > 0;
    }

    /**
     * Counts the diagnostics of the given severity.
     *
     * @param type The severity to count.
     * @return The number of matching diagnostics.
     */
    public long count(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).count();
    }

    /**
     * Returns the diagnostics of the given kind, in reporting order.
     *
     * @param kind The kind to select.
     * @return The matching diagnostics.
     */
    public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).collect(Collectors.toList());
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
