package org.shadowlang.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"  # Level of the root logger
 *   levels {
 *     # Overrides for single loggers or packages
 *     "org.shadowlang.compiler.backend.link" = "INFO"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    /** Logger raised to DEBUG by {@link #enableVerbose()}. */
    public static final String COMPILER_LOGGER = "org.shadowlang";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures Logback from the given configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The application configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);

            loggingConfigured = true;
            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
            loggingConfigured = true;
        }
    }

    /**
     * Lowers the level of the compiler's loggers to DEBUG, on top of whatever
     * {@link #configure(Config)} applied.
     */
    public static void enableVerbose() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(COMPILER_LOGGER).setLevel(Level.DEBUG);
        LOGGER.debug("Verbose output enabled for '{}'.", COMPILER_LOGGER);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final String levelStr = loggingConfig.getString(DEFAULT_LEVEL_KEY);
            final Level level = Level.toLevel(levelStr, Level.WARN);

            final Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(level);

            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            LOGGER.debug("No specific logger levels configured.");
            return;
        }

        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        int configuredCount = 0;

        // Quoted keys keep their dots, so iterate the root object rather than the flattened paths.
        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'.", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }

        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configuration state so the next {@link #configure(Config)} applies again.
     * Used by tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
