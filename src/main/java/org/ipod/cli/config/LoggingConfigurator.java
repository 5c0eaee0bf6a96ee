package org.ipod.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies logger levels from the {@code ipod.logging} block to Logback.
 * <pre>
 * ipod.logging {
 *   default-level = "INFO"
 *   levels { "org.ipod.datapipeline.services" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config The application configuration.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (!config.hasPath("ipod.logging")) {
            return;
        }
        Config logging = config.getConfig("ipod.logging");

        if (logging.hasPath("default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(logging.getString("default-level"), Level.INFO));
        }
        if (logging.hasPath("levels")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                String loggerName = entry.getKey();
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
            }
        }
    }
}
