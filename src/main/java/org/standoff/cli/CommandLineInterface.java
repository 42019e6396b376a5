package org.standoff.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.standoff.cli.commands.AnalyzeCommand;
import org.standoff.cli.commands.ParseCommand;
import org.standoff.cli.commands.SegmentCommand;
import org.standoff.config.ConfigLoader;
import org.standoff.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "standoff",
    mixinStandardHelpOptions = true,
    version = "standoff 1.0",
    description = "Converts pseudo-XML into anchored text and standoff annotations",
    subcommands = {
        ParseCommand.class,
        SegmentCommand.class,
        AnalyzeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log debug output"
    )
    private boolean verbose;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("standoff");
        System.exit(commandLine.execute(args));
    }

    /**
     * Returns the configuration, loading it and applying its logging settings on first use.
     *
     * @return The resolved configuration.
     * @throws ConfigException if the configuration cannot be parsed.
     * @throws IllegalArgumentException if an explicit configuration file does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            if (verbose) {
                LoggingConfigurator.overrideDefaultLevel("DEBUG");
            }
        }
        return config;
    }
}
