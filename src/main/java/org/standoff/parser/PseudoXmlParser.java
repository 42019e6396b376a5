package org.standoff.parser;

import org.standoff.anchor.AnchorStore;
import org.standoff.anchor.IdentifierGenerator;
import org.standoff.corpus.CorpusText;
import org.standoff.diagnostics.Diagnostic;
import org.standoff.diagnostics.DiagnosticsEngine;
import org.standoff.edge.EdgeCodec;
import org.standoff.markup.Attribute;
import org.standoff.markup.EntityResolver;
import org.standoff.markup.MarkupHandler;
import org.standoff.markup.MarkupScanner;
import org.standoff.markup.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts one pseudo-XML document into anchored text and standoff annotations.
 * <p>
 * Elements may overlap: an end tag closes the most recently opened element with the same
 * name, wherever it sits among the open elements. Structural problems (stray end tags,
 * overlaps, unknown references, unterminated elements) are reported to the
 * {@link DiagnosticsEngine} and never abort the parse.
 * <p>
 * A parser instance handles exactly one document and is not thread-safe.
 */
public class PseudoXmlParser implements MarkupHandler {

    private static final Logger LOG = LoggerFactory.getLogger(PseudoXmlParser.class);

    /** The name of the synthetic element recorded for each comment. */
    public static final String COMMENT_ELEMENT = "comment";
    /** The attribute of the synthetic comment element that holds the comment text. */
    public static final String COMMENT_ATTRIBUTE = "value";

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ParserConfig config;
    private final DiagnosticsEngine diagnostics;
    private final String prefix;
    private final String fileName;
    private final Set<ElementKey> skipped;
    // Most recently opened first; removal may happen anywhere.
    private final LinkedList<OpenElement> openElements = new LinkedList<>();
    private final StringBuilder text = new StringBuilder();
    private final Map<String, Map<String, String>> annotations = new LinkedHashMap<>();

    private AnchorStore anchors;
    private boolean insideHeader = false;
    private SourceLocation location = new SourceLocation(1, 0, 0);

    /**
     * Creates a parser for one document.
     *
     * @param config The validated parser configuration.
     * @param diagnostics Receives the structural problems found in the document.
     * @param prefix The anchor prefix, also used to seed the anchor generator.
     * @param fileName The document name used in diagnostics.
     */
    public PseudoXmlParser(ParserConfig config, DiagnosticsEngine diagnostics, String prefix, String fileName) {
        this.config = config;
        this.diagnostics = diagnostics;
        this.prefix = prefix;
        this.fileName = fileName;
        this.skipped = new HashSet<>(config.skipped());
        for (String annotation : config.annotationNames()) {
            annotations.put(annotation, new LinkedHashMap<>());
        }
    }

    /**
     * Parses a complete document.
     *
     * @param source The markup source.
     * @return The anchored text and the annotations.
     * @throws IllegalStateException if this parser was already used.
     */
    public ParsedDocument parse(String source) {
        if (anchors != null) {
            throw new IllegalStateException("A parser handles exactly one document: " + fileName);
        }
        anchors = new AnchorStore(new IdentifierGenerator(prefix, Math.max(1, source.length())), prefix);
        MarkupScanner scanner = new MarkupScanner(source);
        scanner.scan(this);
        location = scanner.locate(source.length());
        return close();
    }

    private ParsedDocument close() {
        if (insideHeader) {
            warn(Diagnostic.Kind.AUTO_CLOSED, String.format("(at EOF) Autoclosing header <%s>", config.headerElement()));
            insideHeader = false;
        }
        while (!openElements.isEmpty()) {
            OpenElement open = openElements.getFirst();
            warn(Diagnostic.Kind.AUTO_CLOSED, String.format("(at EOF) Autoclosing tag </%s>, starting at %s %s",
                    open.name(), open.startAnchor(), open.location()));
            endTag(open.name(), location);
        }
        anchor();
        LOG.debug("Parsed {}: {} chars, {} anchors", fileName, text.length(), anchors.size());
        return new ParsedDocument(CorpusText.of(text.toString(), anchors.positionToAnchor()), annotations);
    }

    @Override
    public void startTag(String name, List<Attribute> attributes, SourceLocation location) {
        this.location = location;
        if (name.equals(config.headerElement()) || insideHeader) {
            insideHeader = true;
            return;
        }

        List<Attribute> elementAttributes = new ArrayList<>(attributes);
        elementAttributes.add(new Attribute("", ""));
        boolean elementSkipped = config.isSkipped(ElementKey.element(name));
        for (Attribute attribute : elementAttributes) {
            ElementKey key = new ElementKey(name, attribute.name());
            if (config.isAnnotated(key) || skipped.contains(key)) {
                continue;
            }
            skipped.add(key);
            if (elementSkipped) {
                continue;
            }
            if (!attribute.name().isEmpty()) {
                warn(Diagnostic.Kind.SKIPPED_ELEMENT, String.format("Skipping XML element <%s %s=%s>",
                        name, attribute.name(), attribute.value()));
            } else if (attributes.isEmpty()) {
                warn(Diagnostic.Kind.SKIPPED_ELEMENT, String.format("Skipping XML element <%s>", name));
            }
        }

        openElements.addFirst(new OpenElement(name, elementAttributes, anchor(), location));
    }

    @Override
    public void endTag(String name, SourceLocation location) {
        this.location = location;
        if (insideHeader) {
            insideHeader = !name.equals(config.headerElement());
            return;
        }

        List<OpenElement> above = new ArrayList<>();
        OpenElement closed = null;
        Iterator<OpenElement> it = openElements.iterator();
        while (it.hasNext()) {
            OpenElement open = it.next();
            if (open.name().equals(name)) {
                it.remove();
                closed = open;
                break;
            }
            above.add(open);
        }
        if (closed == null) {
            error(Diagnostic.Kind.UNMATCHED_END_TAG, String.format("Closing element </%s>, but it is not open", name));
            return;
        }

        String start = closed.startAnchor();
        String end = anchor();
        List<OpenElement> overlaps = above.stream()
                .filter(open -> !config.canOverlap(name, open.name()))
                .collect(Collectors.toList());
        if (!overlaps.isEmpty()) {
            warn(Diagnostic.Kind.OVERLAP, String.format("Tag <%s> [%s:%s], overlapping with %s", name, start, end,
                    overlaps.stream().map(OpenElement::describe).collect(Collectors.joining(", "))));
        }

        String edge = EdgeCodec.encode(name, start, end);
        for (Attribute attribute : closed.attributes()) {
            String annotation = config.annotationFor(new ElementKey(name, attribute.name()));
            if (annotation != null) {
                annotations.get(annotation).put(edge, attribute.value());
            }
        }
    }

    @Override
    public void text(String data, SourceLocation location) {
        this.location = location;
        if (data.indexOf('&') >= 0) error(Diagnostic.Kind.SPECIAL_CHARACTER, "XML special character: &");
        if (data.indexOf('<') >= 0) error(Diagnostic.Kind.SPECIAL_CHARACTER, "XML special character: <");
        if (data.indexOf('>') >= 0) error(Diagnostic.Kind.SPECIAL_CHARACTER, "XML special character: >");
        addText(data);
    }

    @Override
    public void cdata(String data, SourceLocation location) {
        this.location = location;
        addText(data);
    }

    private void addText(String data) {
        String content = data;
        if (text.length() == 0 && !content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            content = content.substring(1);
        }
        if (insideHeader) {
            return;
        }
        for (String token : TextTokenizer.tokenize(content)) {
            addToken(token);
        }
    }

    @Override
    public void characterReference(String reference, SourceLocation location) {
        this.location = location;
        Integer code = EntityResolver.characterReference(reference);
        if (code == null || EntityResolver.isControlCode(code)) {
            error(Diagnostic.Kind.CONTROL_CHARACTER, String.format("Control character reference: &#%s;", reference));
            return;
        }
        if (!insideHeader) {
            addToken(new String(Character.toChars(code)));
        }
    }

    @Override
    public void entityReference(String name, SourceLocation location) {
        this.location = location;
        Integer code = EntityResolver.entity(name);
        if (code == null || EntityResolver.isControlCode(code)) {
            error(Diagnostic.Kind.UNKNOWN_ENTITY, String.format("Unknown HTML entity: &%s;", name));
            return;
        }
        if (!insideHeader) {
            addToken(new String(Character.toChars(code)));
        }
    }

    @Override
    public void comment(String comment, SourceLocation location) {
        this.location = location;
        if (comment.contains("--") || comment.endsWith("-")) {
            error(Diagnostic.Kind.MALFORMED_COMMENT, "Comment contains '--' or ends with '-'");
        }
        if (insideHeader) {
            warn(Diagnostic.Kind.COMMENT_IN_HEADER, "[SKIPPING] Comment in header");
            return;
        }
        warn(Diagnostic.Kind.COMMENT, String.format("Comment: %d characters wide", comment.length()));
        startTag(COMMENT_ELEMENT, List.of(new Attribute(COMMENT_ATTRIBUTE, comment)), location);
        endTag(COMMENT_ELEMENT, location);
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

    private void addToken(String token) {
        if (token.isEmpty()) return;
        anchor();
        text.append(token);
        anchor();
    }

    private String anchor() {
        return anchors.anchorAt(text.length());
    }

    private void warn(Diagnostic.Kind kind, String message) {
        diagnostics.reportWarning(kind, message, fileName, location.line(), location.column());
    }

    private void error(Diagnostic.Kind kind, String message) {
        diagnostics.reportError(kind, message, fileName, location.line(), location.column());
    }
}
