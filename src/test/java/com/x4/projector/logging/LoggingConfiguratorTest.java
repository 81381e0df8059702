package com.x4.projector.logging;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Unit tests for LoggingConfigurator.
 */
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level rootLevel;
    private Level applicationLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        applicationLevel = context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).setLevel(applicationLevel);
    }

    @Test
    void testEnableVerboseLogging() {
        LoggingConfigurator.enableVerboseLogging();

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("com.x4.projector.resolver.MacroResolver").isDebugEnabled()).isTrue();
    }

    @Test
    void testSetLevel() {
        LoggingConfigurator.setLevel(LoggingConfigurator.APPLICATION_LOGGER, Level.WARN);

        assertThat(context.getLogger("com.x4.projector.archive.ArchiveOverlay").getEffectiveLevel())
                .isEqualTo(Level.WARN);
    }
}
