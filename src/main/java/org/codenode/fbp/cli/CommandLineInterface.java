package org.codenode.fbp.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.codenode.fbp.cli.commands.DemoCommand;
import org.codenode.fbp.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "fbp",
    mixinStandardHelpOptions = true,
    version = "fbp-core 1.0",
    description = "Runs flow-based programming graphs on the in-process runtime.",
    subcommands = {
        DemoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show the usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use.
     *
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid.
     */
    public Config getConfig(CommandLine commandLine) {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (IllegalArgumentException | ConfigException e) {
                LOG.debug("Configuration loading failed", e);
                throw new CommandLine.ParameterException(commandLine, "Failed to load configuration: " + e.getMessage());
            }
        }
        return config;
    }
}
