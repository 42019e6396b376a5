package org.standoff.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the {@link ConfigLoader} and the {@link LoggingConfigurator}.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String TEST_LOGGER = "org.standoff.config.test";

    @TempDir
    Path tempDir;

    private Level rootLevel;

    @AfterEach
    void restoreLogging() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(TEST_LOGGER).setLevel(null);
        if (rootLevel != null) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        }
    }

    @Test
    void fileOverridesReferenceDefaults() throws IOException {
        // Arrange
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "standoff.parser.header-element = \"hdr\"\n", StandardCharsets.UTF_8);

        // Act
        Config config = ConfigLoader.load(file.toFile());

        // Assert
        assertThat(config.getString("standoff.parser.header-element")).isEqualTo("hdr");
        assertThat(config.getString("standoff.segment.segmenter")).isEqualTo("whitespace");
    }

    @Test
    void missingExplicitFileIsRejected() {
        assertThatThrownBy(() -> ConfigLoader.load(tempDir.resolve("missing.conf").toFile()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing.conf");
    }

    @Test
    void loggingLevelsAreApplied() {
        // Arrange
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels { "%s" = "DEBUG" }
            }
            """.formatted(TEST_LOGGER));

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void missingLoggingBlockChangesNothing() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level before = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(before);
    }
}
