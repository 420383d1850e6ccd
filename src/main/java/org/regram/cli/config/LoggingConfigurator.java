package org.regram.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "COLOR"        # "COLOR" or "PLAIN"
 *   default-level = "WARN"  # level of the root logger
 *   levels {
 *     "org.regram.compiler" = "INFO"
 *   }
 * }
 * </pre>
 * The format is selected through the {@code regram.logging.appender} property read by {@code logback.xml},
 * so it has to be set before Logback is (re)configured; see {@link #appenderFor(Config)}.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String APPENDER_PROPERTY = "regram.logging.appender";
    static final String BASE_LOGGER = "org.regram";

    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Gets the appender name {@code logback.xml} should use for the configured format.
     *
     * @param config The application configuration.
     * @return {@code STDERR_PLAIN} for the PLAIN format, otherwise {@code STDERR}.
     */
    public static String appenderFor(final Config config) {
        final String path = LOGGING_CONFIG_PATH + "." + FORMAT_KEY;
        final String format = config.hasPath(path) ? config.getString(path) : "COLOR";
        return "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR";
    }

    /**
     * Applies the configured logger levels. Calling it more than once has no further effect.
     *
     * @param config The application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            int configuredCount = 0;
            for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
                final String levelName = entry.getValue().unwrapped().toString();
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
                configuredCount++;
            }
            LOGGER.debug("Configured {} specific logger levels.", configuredCount);
        }
    }

    /**
     * Raises the compiler's own loggers to DEBUG, for the {@code --verbose} flag.
     */
    public static void enableVerbose() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(BASE_LOGGER).setLevel(Level.DEBUG);
    }

    /**
     * Resets the configured state. Used by tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
