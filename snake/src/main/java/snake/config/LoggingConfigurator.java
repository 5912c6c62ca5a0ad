package snake.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the {@code logging} block to Logback at runtime.
 *
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels { "snake.core.GameEngine" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean configured = false;

    private LoggingConfigurator() {}

    /** Idempotent; only the first call has an effect until {@link #reset()}. */
    public static void configure(final Config config) {
        if (configured) {
            LOG.debug("Logging already configured, skipping.");
            return;
        }
        configured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOG.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOG.warn("Logback is not the active SLF4J binding, log levels not applied.");
            return;
        }

        final Config logging = config.getConfig(LOGGING_CONFIG_PATH);
        if (logging.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(logging.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOG.debug("Configured default log level: {}", level);
        }

        if (logging.hasPath(LEVELS_KEY)) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getConfig(LEVELS_KEY).root().entrySet()) {
                final String loggerName = entry.getKey();
                final String levelName = entry.getValue().unwrapped().toString();
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOG.warn("Unknown level '{}' for logger '{}', ignored.", levelName, loggerName);
                    continue;
                }
                context.getLogger(loggerName).setLevel(level);
                LOG.debug("Configured logger '{}' to level: {}", loggerName, level);
            }
        }
    }

    public static void reset() {
        configured = false;
    }
}
