package org.standoff.cli.commands;

import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.standoff.cli.CommandLineInterface;
import org.standoff.segment.SegmentRechunker;
import org.standoff.segment.Segmenters;
import org.standoff.segment.UnknownAnchorException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "segment", description = "Splits the chunks of an annotation into segments, e.g. sentences into words.")
public class SegmentCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentCommand.class);
    private static final String SEGMENTER_PATH = "standoff.segment.segmenter";

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-t", "--text"}, required = true, description = "The corpus text file; rewritten if new anchors are needed.")
    private Path textFile;

    @Option(names = {"-k", "--chunk"}, required = true, description = "The annotation whose edges are the chunks.")
    private Path chunkFile;

    @Option(names = {"-o", "--out"}, required = true, description = "The annotation file to write.")
    private Path outFile;

    @Option(names = {"-e", "--element"}, defaultValue = "w", description = "The name of the new edges (default: ${DEFAULT-VALUE}).")
    private String element;

    @Option(names = {"-x", "--existing"}, description = "An existing segmentation to keep.")
    private Path existingFile;

    @Option(names = {"-s", "--segmenter"}, description = "The segmenter, one of: whitespace, linebreaks, blanklines, punctuation, punkt_word.")
    private String segmenter;

    @Override
    public Integer call() {
        try {
            final String name = segmenter != null ? segmenter : parent.getConfig().getString(SEGMENTER_PATH);
            final SegmentRechunker.Result result = new SegmentRechunker(Segmenters.byName(name))
                    .rechunk(textFile, chunkFile, existingFile, outFile, element);
            spec.commandLine().getOut().printf("%d segments, %d new anchors%n",
                    result.segments().size(), result.newAnchors());
            return 0;
        } catch (IOException | IllegalArgumentException | UnknownAnchorException | ConfigException e) {
            LOG.error("Failed to segment {}: {}", chunkFile, e.getMessage());
            return 1;
        }
    }
}
