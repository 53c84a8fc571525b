package org.machlink.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies logger levels from the {@code logging.levels} section to Logback.
 * <pre>
 * logging.levels {
 *   "org.machlink.compiler.frontend.module" = DEBUG
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final String LEVELS_PATH = "logging.levels";
    private static final String ROOT_PACKAGE = "org.machlink";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        LoggerContext context = context();
        if (context == null) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject(LEVELS_PATH).entrySet()) {
            String loggerName = entry.getKey().replace("\"", "");
            String level = String.valueOf(entry.getValue().unwrapped());
            context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
        }
    }

    /**
     * Raises the application loggers to DEBUG.
     */
    public static void enableVerbose() {
        LoggerContext context = context();
        if (context != null) {
            Logger logger = context.getLogger(ROOT_PACKAGE);
            logger.setLevel(Level.DEBUG);
        }
    }

    private static LoggerContext context() {
        return LoggerFactory.getILoggerFactory() instanceof LoggerContext loggerContext ? loggerContext : null;
    }
}
