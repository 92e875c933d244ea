package org.flowxmi.activity.conversion.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LogbackConfigTest {

    @Test
    void shouldConfigureConsoleAppenderOnRootLogger() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Appender<?> console = root.getAppender("CONSOLE");
        assertNotNull(console, "Expected CONSOLE appender to be configured on root logger");
        assertInstanceOf(ConsoleAppender.class, console);
    }

    @Test
    void shouldKeepConverterQuietDuringTests() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger converter = ctx.getLogger("org.flowxmi.activity.conversion");
        assertEquals(Level.WARN, converter.getEffectiveLevel());
    }
}
