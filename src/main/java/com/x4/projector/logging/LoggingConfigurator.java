package com.x4.projector.logging;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Changes Logback levels at runtime, on top of {@code logback.xml}.
 */
public final class LoggingConfigurator {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String APPLICATION_LOGGER = "com.x4.projector";

    private LoggingConfigurator() {
        // Utility class
    }

    /**
     * Sets the root logger and the application's loggers to DEBUG.
     */
    public static void enableVerboseLogging() {
        setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
        setLevel(APPLICATION_LOGGER, Level.DEBUG);
        log.debug("Verbose logging enabled");
    }

    static void setLevel(String loggerName, Level level) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.warn("Logging backend is not Logback, cannot change level of {}", loggerName);
            return;
        }
        Logger logger = context.getLogger(loggerName);
        logger.setLevel(level);
    }
}
