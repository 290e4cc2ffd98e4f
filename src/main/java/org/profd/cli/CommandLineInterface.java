package org.profd.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.profd.cli.commands.node.NodeCommand;
import org.profd.cli.commands.session.SessionCommand;
import org.profd.node.config.ConfigLoader;
import org.profd.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "profd",
    mixinStandardHelpOptions = true,
    version = "profd 1.0",
    description = "profd - on-device sampling profiler daemon",
    subcommands = {
        NodeCommand.class,
        SessionCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("profd");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the file given with {@code --config} does not exist
     *                                        or a configuration source cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            if (config.hasPath("logging.format")) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.appenderFor(config.getString("logging.format")));
                LoggingConfigurator.reloadLogback();
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private Config loadConfig() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        if (configFile != null && !configFile.exists()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            return configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (final ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
        }
    }
}
