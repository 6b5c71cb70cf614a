package org.hexarena.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.hexarena.cli.commands.PathCommand;
import org.hexarena.cli.commands.TargetsCommand;
import org.hexarena.cli.config.ConfigLoader;
import org.hexarena.cli.config.LoggingConfigurator;
import org.hexarena.runtime.Battlefield;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "hexarena",
    mixinStandardHelpOptions = true,
    version = "hexarena 1.0",
    description = "hexarena - deterministic hex-grid positioning and targeting engine",
    subcommands = {
        TargetsCommand.class,
        PathCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/hexarena.conf)"
    )
    private File configFile;

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
        commandLine.setCommandName("hexarena");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        final ConfigLoader.LoadedConfig loaded = ConfigLoader.load(this.configFile);
        if (loaded.isDefaultsOnly()) {
            logger.warn("No configuration file found, using built-in defaults.");
        } else {
            logger.info("Using configuration file {}", loaded.file());
        }
        this.config = loaded.config();

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("hexarena.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (ch.qos.logback.core.joran.spi.JoranException | ClassCastException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Loads the configuration on first use.
     *
     * @throws IllegalArgumentException                if an explicitly named configuration file is missing
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Builds a battlefield from the loaded configuration.
     */
    public Battlefield createBattlefield() {
        return Battlefield.fromConfig(getConfig());
    }
}
