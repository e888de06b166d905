package org.urbanscope.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class LoggingConfiguratorTest {

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @AfterEach
    void tearDown() throws JoranException {
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggerContext context = context();
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(LoggingConfiguratorTest.class.getClassLoader().getResource("logback-test.xml"));
    }

    @Test
    void configure_setsRootAndPerLoggerLevels() {
        // Given
        System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT_PLAIN");
        Config config = ConfigFactory.parseString("""
            urbanscope.logging {
              format = "PLAIN"
              default-level = "WARN"
              levels {
                "org.urbanscope.datapipeline.resources.source" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.WARN, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context().getLogger("org.urbanscope.datapipeline.resources.source").getLevel());
    }

    @Test
    void configure_jsonFormat_selectsJsonAppender() {
        // Given
        Config config = ConfigFactory.parseString("urbanscope.logging.format = \"json\"");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals("STDOUT", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context().getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT"),
            "root logger should write through the JSON appender");
    }

    @Test
    void configure_plainFormat_selectsPlainAppender() {
        // Given
        Config config = ConfigFactory.parseString("urbanscope.logging.format = \"PLAIN\"");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals("STDOUT_PLAIN", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context().getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT_PLAIN"));
    }

    @Test
    void configure_withoutLoggingBlock_changesNothing() {
        // Given
        Level before = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertEquals(before, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertNull(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }
}
