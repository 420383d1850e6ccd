package org.regram.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.regram.cli.commands.CompileCommand;
import org.regram.cli.commands.DepsCommand;
import org.regram.cli.commands.DialectsCommand;
import org.regram.cli.config.ConfigLoader;
import org.regram.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "regram",
    mixinStandardHelpOptions = true,
    version = "Regram 1.0",
    description = "Regram - compiles regex macro grammars into dialect-specific regular expressions",
    subcommands = {
        CompileCommand.class,
        DialectsCommand.class,
        DepsCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes: 0 success, 1 grammar or dialect error, 2 usage error."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for grammar, dialect and configuration errors. */
    public static final int EXIT_ERROR = 1;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/regram.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log compiler phases at DEBUG level"
    )
    private boolean verbose;

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
        commandLine.setCommandName("regram");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println("error: " + ex.getMessage());
            return EXIT_ERROR;
        });
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        final String appender = LoggingConfigurator.appenderFor(config);
        if (!appender.equals(System.getProperty(LoggingConfigurator.APPENDER_PROPERTY, "STDERR"))) {
            System.setProperty(LoggingConfigurator.APPENDER_PROPERTY, appender);
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }

        initialized = true;
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Gets the resolved configuration, loading it on first use.
     *
     * @return The configuration.
     * @throws IllegalArgumentException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
