package org.opencraft.cli;

import com.typesafe.config.Config;
import org.opencraft.cli.commands.PlanCommand;
import org.opencraft.cli.commands.RunCommand;
import org.opencraft.config.ConfigLoader;
import org.opencraft.config.ConfigResolutionException;
import org.opencraft.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "opencraft",
    mixinStandardHelpOptions = true,
    version = "Opencraft 1.0",
    description = "Opencraft - starts a game server, client, thin client or deployment service",
    subcommands = {
        RunCommand.class,
        PlanCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("opencraft");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the layered configuration on first use and applies its logging settings.
     *
     * @return The resolved application configuration.
     * @throws ConfigResolutionException if the configuration cannot be loaded.
     */
    public Config getConfig() throws ConfigResolutionException {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
