package org.ipod.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.ipod.cli.commands.IndexCommand;
import org.ipod.cli.commands.RefineCommand;
import org.ipod.cli.config.ConfigLoader;
import org.ipod.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "ipod",
    mixinStandardHelpOptions = true,
    version = "ipod 1.0",
    description = "Iterative precovery and differential correction of candidate orbits",
    subcommands = {
        RefineCommand.class,
        IndexCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/ipod.conf)"
    )
    private File configFile;

    private Config config;

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
        commandLine.setCommandName("ipod");
        return commandLine;
    }

    /**
     * Loads the configuration on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        try {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> log.info(message);
                    case WARN -> log.warn(message);
                }
            });
        } catch (ConfigException e) {
            log.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
