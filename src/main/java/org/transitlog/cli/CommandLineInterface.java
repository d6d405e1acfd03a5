package org.transitlog.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.transitlog.cli.commands.ArchiveCommand;
import org.transitlog.cli.config.ConfigLoader;
import org.transitlog.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "transitlog",
    mixinStandardHelpOptions = true,
    version = "Transitlog 1.0",
    description = "Transitlog - GTFS-realtime vehicle position archive",
    subcommands = {
        ArchiveCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/transitlog.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("transitlog");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        // Initialize logger early for config loading feedback
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("transitlog.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    /**
     * Returns the resolved configuration, loading it on first access.
     *
     * @return the application configuration
     * @throws IllegalArgumentException             if an explicit config file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
