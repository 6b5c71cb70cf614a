package org.hexarena.cli.config;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration block to Logback:
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels { "org.hexarena.runtime.transaction" = "DEBUG" }
 * }
 * </pre>
 * Unknown level names fall back to {@code DEBUG}, as in {@link Level#toLevel(String)}.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(final com.typesafe.config.Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.default-level")));
        }
        if (config.hasPath("logging.levels")) {
            final com.typesafe.config.Config levels = config.getConfig("logging.levels");
            for (String name : levels.root().keySet()) {
                final Logger logger = context.getLogger(name);
                logger.setLevel(Level.toLevel(levels.getString("\"" + name + "\"")));
            }
        }
    }
}
