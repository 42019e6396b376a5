package org.standoff.parser;

import org.standoff.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Imports pseudo-XML source files: parses each file with a fresh {@link PseudoXmlParser} and
 * persists its corpus text and annotation files.
 * <p>
 * Every document gets its own parser and therefore its own anchor generator, so importers on
 * different threads may process different documents at the same time.
 */
public class CorpusImporter {

    private static final Logger LOG = LoggerFactory.getLogger(CorpusImporter.class);

    private final ParserConfig config;
    private final Charset encoding;

    public CorpusImporter(ParserConfig config) {
        this(config, StandardCharsets.UTF_8);
    }

    /**
     * Creates an importer.
     * @param config The parser configuration shared by all documents.
     * @param encoding The encoding of the source files.
     */
    public CorpusImporter(ParserConfig config, Charset encoding) {
        this.config = config;
        this.encoding = encoding;
    }

    /**
     * Parses one source file and writes its corpus text and annotations.
     *
     * @param source The pseudo-XML source file.
     * @param prefix The anchor prefix of the document, or {@code null} to derive it from the file name.
     * @param textFile The corpus text file to write.
     * @param annotationDir The directory receiving one file per annotation store.
     * @param diagnostics Receives the structural problems found in the document.
     * @return The parsed document.
     * @throws IOException if the source cannot be read or an output cannot be written.
     */
    public ParsedDocument importDocument(Path source, String prefix, Path textFile, Path annotationDir,
                                         DiagnosticsEngine diagnostics) throws IOException {
        String content = Files.readString(source, encoding);
        String documentPrefix = prefix != null ? prefix : defaultPrefix(source);
        LOG.info("Parsing {} ({} chars)", source, content.length());
        PseudoXmlParser parser = new PseudoXmlParser(config, diagnostics, documentPrefix, source.getFileName().toString());
        ParsedDocument document = parser.parse(content);
        document.writeTo(textFile, annotationDir);
        return document;
    }

    /**
     * Derives an anchor prefix from a file name: the name without its extension.
     * @param source A source file.
     * @return The prefix.
     */
    public static String defaultPrefix(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
