package org.standoff.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.standoff.annotation.AnnotationStore;
import org.standoff.junit.extensions.logging.ExpectLog;
import org.standoff.junit.extensions.logging.LogLevel;
import org.standoff.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;
    private Path confFile;
    private Path source;
    private StringWriter out;

    @BeforeEach
    void setUp() throws IOException {
        confFile = tempDir.resolve("test.conf");
        Files.writeString(confFile, String.join("\n",
                "standoff.parser.elements = [ { elements = \"s\", annotation = \"sentences\" } ]",
                "logging.default-level = \"WARN\""), StandardCharsets.UTF_8);
        source = tempDir.resolve("doc.xml");
        Files.writeString(source, "<s>Hi there.</s> <s>Bye.</s>", StandardCharsets.UTF_8);
    }

    private int execute(String... args) {
        out = new StringWriter();
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        return cmd.execute(args);
    }

    @Test
    @Tag("unit")
    void commandNameIsStandoff() {
        assertThat(new CommandLine(new CommandLineInterface()).getCommandName()).isEqualTo("standoff");
    }

    @Test
    void parseThenSegment() throws IOException {
        // Arrange
        Path textFile = tempDir.resolve("out/doc.txt");
        Path annotations = tempDir.resolve("out/ann");

        // Act
        int parsed = execute("-c", confFile.toString(), "parse", source.toString(),
                "--text", textFile.toString(), "--annotations", annotations.toString());
        String parseOutput = out.toString();
        int segmented = execute("-c", confFile.toString(), "segment", "--text", textFile.toString(),
                "--chunk", annotations.resolve("sentences").toString(), "--out", annotations.resolve("words").toString());

        // Assert
        assertThat(parsed).isZero();
        assertThat(parseOutput).contains("doc.xml: 14 chars", "0 errors, 0 warnings");
        assertThat(AnnotationStore.read(annotations.resolve("sentences"))).hasSize(2);
        assertThat(segmented).isZero();
        assertThat(AnnotationStore.read(annotations.resolve("words"))).hasSize(3);
    }

    @Test
    void elementOptionsOverrideTheConfiguration() throws IOException {
        Path annotations = tempDir.resolve("ann");

        int exitCode = execute("-c", confFile.toString(), "parse", source.toString(), "--text", tempDir.resolve("t").toString(),
                "--annotations", annotations.toString(), "-e", "s", "-n", "chunks");

        assertThat(exitCode).isZero();
        assertThat(AnnotationStore.exists(annotations.resolve("chunks"))).isTrue();
        assertThat(AnnotationStore.exists(annotations.resolve("sentences"))).isFalse();
    }

    @Test
    void analyzePrintsStatistics() {
        int exitCode = execute("-c", confFile.toString(), "analyze", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("<s>", "0 errors, 0 warnings  doc.xml");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*ParseCommand", messagePattern = "Failed to parse .*")
    void missingSourceFails() {
        int exitCode = execute("-c", confFile.toString(), "parse", tempDir.resolve("missing.xml").toString(),
                "--text", tempDir.resolve("t").toString(), "--annotations", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*SegmentCommand", messagePattern = ".*Unknown segmenter 'punkt'.*")
    void unknownSegmenterFails() {
        int exitCode = execute("-c", confFile.toString(), "segment", "--segmenter", "punkt", "--text", "t",
                "--chunk", "c", "--out", "o");

        assertThat(exitCode).isEqualTo(1);
    }
}
