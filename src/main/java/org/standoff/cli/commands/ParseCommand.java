package org.standoff.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.standoff.cli.CommandLineInterface;
import org.standoff.config.ParserConfigLoader;
import org.standoff.diagnostics.Diagnostic;
import org.standoff.diagnostics.DiagnosticsEngine;
import org.standoff.parser.CorpusImporter;
import org.standoff.parser.ParsedDocument;
import org.standoff.parser.ParserConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Converts a pseudo-XML file into a corpus text file and annotation files.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The pseudo-XML source file.")
    private Path source;

    @Option(names = {"-t", "--text"}, required = true, description = "The corpus text file to write.")
    private Path textFile;

    @Option(names = {"-a", "--annotations"}, required = true, description = "The directory receiving the annotation files.")
    private Path annotationDir;

    @Option(names = {"-p", "--prefix"}, description = "The anchor prefix (default: source file name without extension).")
    private String prefix;

    @Option(names = {"-e", "--element"}, description = "Element group to record, e.g. 'w:lemma' or 's+p'. Pairs with --annotation.")
    private List<String> elements = new ArrayList<>();

    @Option(names = {"-n", "--annotation"}, description = "Annotation name for the --element at the same position.")
    private List<String> annotations = new ArrayList<>();

    @Option(names = {"-s", "--skip"}, description = "Element (or element:attribute) to drop silently.")
    private List<String> skip = new ArrayList<>();

    @Option(names = {"-o", "--overlap"}, description = "Group of elements allowed to overlap, e.g. 's+p'.")
    private List<String> overlap = new ArrayList<>();

    @Option(names = "--encoding", defaultValue = "UTF-8", description = "The source encoding (default: ${DEFAULT-VALUE}).")
    private Charset encoding;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        try {
            final Config config = parent.getConfig();
            final ParserConfig parserConfig = elements.isEmpty() && annotations.isEmpty() && skip.isEmpty() && overlap.isEmpty()
                    ? ParserConfigLoader.fromConfig(config)
                    : ParserConfig.builder()
                        .headerElement(config.getString(ParserConfigLoader.PARSER_PATH + ".header-element"))
                        .annotate(elements, annotations)
                        .skip(skip)
                        .overlap(overlap)
                        .build();
            final String documentPrefix = prefix != null ? prefix : ParserConfigLoader.prefix(config);

            final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            final ParsedDocument document = new CorpusImporter(parserConfig, encoding)
                    .importDocument(source, documentPrefix, textFile, annotationDir, diagnostics);

            out.printf("%s: %d chars, %d anchors, %d annotations%n", source.getFileName(),
                    document.corpusText().length(), document.corpusText().positionToAnchor().size(),
                    document.annotations().size());
            out.printf("%d errors, %d warnings%n",
                    diagnostics.count(Diagnostic.Type.ERROR), diagnostics.count(Diagnostic.Type.WARNING));
            return 0;
        } catch (IOException | IllegalArgumentException | ConfigException e) {
            LOG.error("Failed to parse {}: {}", source, e.getMessage());
            return 1;
        }
    }
}
