package org.standoff.cli.commands;

import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.standoff.analyzer.XmlAnalyzer;
import org.standoff.cli.CommandLineInterface;
import org.standoff.config.ParserConfigLoader;
import org.standoff.diagnostics.DiagnosticsEngine;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "analyze", description = "Prints statistics about the elements, characters and references of pseudo-XML files.")
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(arity = "1..*", description = "The pseudo-XML files.")
    private List<Path> sources;

    @Option(names = {"-m", "--max-count"}, defaultValue = "0",
            description = "Only list items occurring fewer times than this; 0 lists all (default: ${DEFAULT-VALUE}).")
    private long maxCount;

    @Option(names = "--encoding", defaultValue = "UTF-8", description = "The source encoding (default: ${DEFAULT-VALUE}).")
    private Charset encoding;

    @Override
    public Integer call() {
        try {
            final String header = parent.getConfig().getString(ParserConfigLoader.PARSER_PATH + ".header-element");
            final XmlAnalyzer analyzer = new XmlAnalyzer(header, new DiagnosticsEngine());
            for (Path source : sources) {
                LOG.info("Analyzing {}", source);
                analyzer.analyze(source.getFileName().toString(), Files.readString(source, encoding));
            }
            spec.commandLine().getOut().print(analyzer.report(maxCount));
            return 0;
        } catch (IOException | ConfigException e) {
            LOG.error("Failed to analyze: {}", e.getMessage());
            return 1;
        }
    }
}
