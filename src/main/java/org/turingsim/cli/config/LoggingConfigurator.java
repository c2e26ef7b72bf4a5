package org.turingsim.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from configuration to Logback.
 * <p>
 * Reads {@code logging.default-level} for the root logger and the
 * {@code logging.levels} object for individual loggers:
 * <pre>
 * logging {
 *   default-level = WARN
 *   levels {
 *     "org.turingsim.runtime" = DEBUG
 *   }
 * }
 * </pre>
 * Unknown level names fall back to DEBUG, as {@link Level#toLevel(String)} does.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config the resolved application configuration.
     */
    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.default-level")) {
            final Level level = Level.toLevel(config.getString("logging.default-level"));
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                final String loggerName = stripQuotes(entry.getKey());
                final Logger logger = context.getLogger(loggerName);
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped())));
            }
        }
    }

    private static String stripQuotes(final String key) {
        if (key.length() >= 2 && key.startsWith("\"") && key.endsWith("\"")) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }
}
