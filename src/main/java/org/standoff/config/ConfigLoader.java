package org.standoff.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "standoff.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration from {@code standoff.conf} in the working directory, if present.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dstandoff.parser.header-element=header)
     * 2. Environment Variables
     * 3. Configuration File ({@code configFile}, or standoff.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed.
     */
    public static Config load(final File configFile) {
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config envConfig = ConfigFactory.systemEnvironment();

        final File file = configFile != null ? configFile : new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (file.exists() && !file.isDirectory()) {
            LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else if (configFile != null) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getPath());
        } else {
            LOG.debug("Configuration file '{}' not found. Skipping file-based configuration.", file.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return cliConfig
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
