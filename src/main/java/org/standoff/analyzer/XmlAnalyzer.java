package org.standoff.analyzer;

import org.standoff.diagnostics.Diagnostic;
import org.standoff.diagnostics.DiagnosticsEngine;
import org.standoff.markup.Attribute;
import org.standoff.markup.EntityResolver;
import org.standoff.markup.MarkupHandler;
import org.standoff.markup.MarkupScanner;
import org.standoff.markup.SourceLocation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Collects statistics about pseudo-XML documents without converting them: which elements,
 * attributes, characters and references occur, how often, and where first. Structural
 * problems are reported like the parser reports them.
 * <p>
 * One analyzer accumulates over any number of documents, analyzed one after the other.
 */
public class XmlAnalyzer implements MarkupHandler {

    /**
     * The kinds of items counted.
     */
    public enum Category {
        TAG, HEADER, CHAR, ENTITY
    }

    private record Open(String name, SourceLocation location) {
    }

    private final String headerElement;
    private final DiagnosticsEngine diagnostics;
    private final Map<Category, Map<String, ItemStatistics>> statistics = new EnumMap<>(Category.class);
    private final Map<String, Integer> errors = new TreeMap<>();
    private final Map<String, Integer> warnings = new TreeMap<>();

    private final LinkedList<Open> openElements = new LinkedList<>();
    private String document;
    private boolean insideHeader;
    private SourceLocation location;

    /**
     * Creates an analyzer.
     * @param headerElement The header element name.
     * @param diagnostics Receives the structural problems found.
     */
    public XmlAnalyzer(String headerElement, DiagnosticsEngine diagnostics) {
        this.headerElement = headerElement.toLowerCase(Locale.ROOT);
        this.diagnostics = diagnostics;
        for (Category category : Category.values()) {
            statistics.put(category, new TreeMap<>());
        }
    }

    /**
     * Analyzes one document and adds its figures to the statistics.
     *
     * @param documentName The document name.
     * @param source The markup source.
     */
    public void analyze(String documentName, String source) {
        this.document = documentName;
        this.insideHeader = false;
        this.openElements.clear();
        errors.putIfAbsent(documentName, 0);
        warnings.putIfAbsent(documentName, 0);
        MarkupScanner scanner = new MarkupScanner(source);
        scanner.scan(this);
        location = scanner.locate(source.length());
        while (!openElements.isEmpty()) {
            Open open = openElements.getFirst();
            error(Diagnostic.Kind.AUTO_CLOSED, String.format("(at EOF) Autoclosing tag </%s>, starting at %s",
                    open.name(), open.location()));
            endTag(open.name(), location);
        }
    }

    @Override
    public void startTag(String name, List<Attribute> attributes, SourceLocation location) {
        this.location = location;
        if (name.equals(headerElement)) {
            insideHeader = true;
        }
        ItemStatistics item = item(insideHeader ? Category.HEADER : Category.TAG, name);
        item.record(document, location);
        attributes.forEach(attribute -> item.addAttribute(attribute.name()));
        openElements.addFirst(new Open(name, location));
    }

    @Override
    public void endTag(String name, SourceLocation location) {
        this.location = location;
        if (insideHeader) {
            insideHeader = !name.equals(headerElement);
        }
        int index = 0;
        Iterator<Open> it = openElements.iterator();
        while (it.hasNext()) {
            Open open = it.next();
            if (open.name().equals(name)) {
                it.remove();
                if (index > 0) {
                    List<Open> overlaps = openElements.subList(0, index);
                    warn(Diagnostic.Kind.OVERLAP, String.format("Tag <%s> at %s - %s, overlapping with %s",
                            name, open.location(), location,
                            overlaps.stream().map(o -> "<" + o.name() + "> at " + o.location())
                                    .collect(Collectors.joining(", "))));
                }
                return;
            }
            index++;
        }
        error(Diagnostic.Kind.UNMATCHED_END_TAG, String.format("Closing element </%s>, but it is not open", name));
    }

    @Override
    public void text(String data, SourceLocation location) {
        this.location = location;
        if (data.indexOf('&') >= 0) error(Diagnostic.Kind.SPECIAL_CHARACTER, "XML special character: &");
        if (data.indexOf('<') >= 0) error(Diagnostic.Kind.SPECIAL_CHARACTER, "XML special character: <");
        if (data.indexOf('>') >= 0) error(Diagnostic.Kind.SPECIAL_CHARACTER, "XML special character: >");
        countCharacters(data);
    }

    @Override
    public void cdata(String data, SourceLocation location) {
        this.location = location;
        countCharacters(data);
    }

    private void countCharacters(String data) {
        data.codePoints().forEach(cp -> item(Category.CHAR, new String(Character.toChars(cp))).record(document, location));
    }

    @Override
    public void characterReference(String reference, SourceLocation location) {
        this.location = location;
        item(Category.ENTITY, "#" + reference).record(document, location);
        Integer code = EntityResolver.characterReference(reference);
        if (code == null || EntityResolver.isControlCode(code)) {
            error(Diagnostic.Kind.CONTROL_CHARACTER, String.format("Control character reference: &#%s;", reference));
        }
    }

    @Override
    public void entityReference(String name, SourceLocation location) {
        this.location = location;
        item(Category.ENTITY, name).record(document, location);
        if (EntityResolver.entity(name) == null) {
            error(Diagnostic.Kind.UNKNOWN_ENTITY, String.format("Unknown HTML entity: &%s;", name));
        }
    }

    @Override
    public void comment(String comment, SourceLocation location) {
        this.location = location;
        if (comment.contains("--") || comment.endsWith("-")) {
            error(Diagnostic.Kind.MALFORMED_COMMENT, "Comment contains '--' or ends with '-'");
        }
        if (insideHeader) {
            warn(Diagnostic.Kind.COMMENT_IN_HEADER, String.format("Comment in header: %d characters wide", comment.length()));
        } else {
            warn(Diagnostic.Kind.COMMENT, String.format("Comment: %d characters wide", comment.length()));
        }
    }

    @Override
    public void processingInstruction(String data, SourceLocation location) {
        this.location = location;
        if (data.startsWith("xml ") && data.endsWith("?")) {
            if (location.line() != 1 || location.column() != 0) {
                error(Diagnostic.Kind.PROCESSING_INSTRUCTION, "XML declaration not first in file");
            }
        } else {
            error(Diagnostic.Kind.PROCESSING_INSTRUCTION, String.format("Unknown processing instruction: <?%s>", data));
        }
    }

    @Override
    public void declaration(String declaration, SourceLocation location) {
        this.location = location;
        error(Diagnostic.Kind.DECLARATION, String.format("SGML declaration: <!%s>", declaration));
    }

    /**
     * Returns the statistics of one category, keyed by item.
     */
    public Map<String, ItemStatistics> statistics(Category category) {
        return Collections.unmodifiableMap(statistics.get(category));
    }

    public Map<String, Integer> errorCounts() {
        return Collections.unmodifiableMap(errors);
    }

    public Map<String, Integer> warningCounts() {
        return Collections.unmodifiableMap(warnings);
    }

    /**
     * Formats the statistics as text, one line per item.
     *
     * @param maxCount Only items occurring fewer than {@code maxCount} times are listed; 0 lists all.
     * @return The report.
     */
    public String report(long maxCount) {
        StringBuilder sb = new StringBuilder();
        for (Category category : Category.values()) {
            sb.append("== ").append(category.name().toLowerCase(Locale.ROOT)).append('\n');
            statistics.get(category).forEach((key, item) -> {
                if (maxCount > 0 && item.frequency() >= maxCount) return;
                sb.append(String.format("%8d  %s", item.frequency(), display(category, key)));
                if (!item.attributes().isEmpty()) {
                    sb.append("  attrs: ").append(String.join(" ", item.attributes()));
                }
                sb.append("  first: ").append(item.firstOccurrence().entrySet().stream()
                        .map(e -> e.getKey() + e.getValue())
                        .collect(Collectors.joining(", ")));
                sb.append('\n');
            });
        }
        sb.append("== problems\n");
        errors.forEach((doc, count) -> sb.append(String.format("%8d errors, %d warnings  %s%n",
                count, warnings.getOrDefault(doc, 0), doc)));
        return sb.toString();
    }

    private static String display(Category category, String key) {
        return switch (category) {
            case TAG, HEADER -> "<" + key + ">";
            case ENTITY -> "&" + key + ";";
            case CHAR -> key.codePoints().mapToObj(cp -> String.format("U+%04X", cp)).collect(Collectors.joining())
                    + (Character.isISOControl(key.codePointAt(0)) ? "" : " '" + key + "'");
        };
    }

    private ItemStatistics item(Category category, String key) {
        return statistics.get(category).computeIfAbsent(key, k -> new ItemStatistics());
    }

    private void warn(Diagnostic.Kind kind, String message) {
        warnings.merge(document, 1, Integer::sum);
        diagnostics.reportWarning(kind, message, document, location.line(), location.column());
    }

    private void error(Diagnostic.Kind kind, String message) {
        errors.merge(document, 1, Integer::sum);
        diagnostics.reportError(kind, message, document, location.line(), location.column());
    }
}
