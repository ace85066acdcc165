package org.texpreview.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} section of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"  # "PLAIN" or "JSON"
 *   default-level = "WARN"
 *   levels {
 *     "org.texpreview.preview" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** System and context property selecting the console appender in {@code logback.xml}. */
    public static final String FORMAT_PROPERTY = "texpreview.logging.format";
    /** Appender name for human-readable output. */
    public static final String PLAIN_APPENDER = "CONSOLE_PLAIN";
    /** Appender name for JSON output. */
    public static final String JSON_APPENDER = "CONSOLE_JSON";

    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures logging from the given configuration. Calling it again has no effect until {@link #reset()}.
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
        configureFormat(loggingConfig, context);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        LOGGER.debug("Logging configuration applied successfully.");
    }

    /**
     * Maps a configured format name to the appender it selects.
     * @param format The configured format, {@code PLAIN} or {@code JSON}.
     * @return The appender name.
     */
    public static String appenderFor(final String format) {
        return "JSON".equalsIgnoreCase(format) ? JSON_APPENDER : PLAIN_APPENDER;
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(FORMAT_KEY)) {
            return;
        }
        final String appender = appenderFor(loggingConfig.getString(FORMAT_KEY));
        final String current = System.getProperty(FORMAT_PROPERTY, PLAIN_APPENDER);
        System.setProperty(FORMAT_PROPERTY, appender);
        context.putProperty(FORMAT_PROPERTY, appender);
        if (!appender.equals(current)) {
            reloadLogback(context);
        }
        LOGGER.debug("Configured logging format: {}", appender);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            context.getLogger(loggerName).setLevel(Level.toLevel(levelName, Level.INFO));
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, levelName);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    private static void reloadLogback(final LoggerContext context) {
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            LOGGER.error("Failed to reload Logback configuration from {}", configUrl, e);
        }
    }

    /**
     * Resets the configured state so that the next {@link #configure(Config)} applies again. Intended for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
