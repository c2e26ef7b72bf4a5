package org.turingsim.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.turingsim.cli.commands.MultiplyCommand;
import org.turingsim.cli.commands.TableCommand;
import org.turingsim.cli.config.ConfigLoader;
import org.turingsim.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "turingsim",
    mixinStandardHelpOptions = true,
    version = "turingsim 1.0",
    description = "Three-tape Turing machine that multiplies unary numbers",
    subcommands = {
        MultiplyCommand.class,
        TableCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"--config"},
        description = "Path to custom configuration file (default: config/turingsim.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given
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
        commandLine.setCommandName("turingsim");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("turingsim.logging.format", "COLOR".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN");
            reconfigureLogback(logger);
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback(final Logger logger) {
        if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext context)) {
            return;
        }
        try {
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            logger.warn("Failed to reconfigure Logback: {}", e.getMessage());
        }
    }

    /**
     * Returns the application configuration, loading it on first use.
     *
     * @return the resolved configuration.
     * @throws IllegalArgumentException if an explicitly named config file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
