package org.machlink.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.machlink.cli.commands.CheckCommand;
import org.machlink.cli.commands.MergeCommand;
import org.machlink.cli.commands.OrderCommand;
import org.machlink.cli.config.ConfigLoader;
import org.machlink.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "machlink",
    mixinStandardHelpOptions = true,
    version = "machlink 1.0",
    description = "Resolves, validates and merges multi-file machine definitions",
    subcommands = {
        MergeCommand.class,
        CheckCommand.class,
        OrderCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/machlink.conf)"
    )
    private File configFile;

    @Option(
        names = {"--verbose"},
        description = "Enable debug logging for module resolution and linking"
    )
    private boolean verbose;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
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
        commandLine.setCommandName("machlink");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, logger::debug);

        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }

        initialized = true;
    }

    /**
     * Returns the resolved configuration, loading it on first access.
     *
     * @throws IllegalArgumentException            if the configured file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or is invalid.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
