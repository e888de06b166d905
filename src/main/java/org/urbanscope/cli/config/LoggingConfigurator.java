package org.urbanscope.cli.config;

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
 * Applies the {@code urbanscope.logging} block to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "INFO"    # root logger level
 *   levels {
 *     "org.urbanscope.datapipeline.resources.source" = "DEBUG"
 *   }
 * }
 * </pre>
 * The format selects the appender referenced by {@code logback.xml} through the
 * {@value #FORMAT_PROPERTY} system property, which requires reloading the Logback configuration.
 */
public final class LoggingConfigurator {

    public static final String FORMAT_PROPERTY = "urbanscope.log.appender";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_PATH = "urbanscope.logging";

    private LoggingConfigurator() {
    }

    /**
     * Configures format, root level and per-logger levels from {@code config}.
     *
     * @param config the resolved application configuration
     */
    public static void configure(Config config) {
        if (!config.hasPath(LOGGING_PATH)) {
            LOGGER.debug("No logging configuration found, keeping Logback defaults.");
            return;
        }
        Config logging = config.getConfig(LOGGING_PATH);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath("format")) {
            String appender = "JSON".equalsIgnoreCase(logging.getString("format")) ? "STDOUT" : "STDOUT_PLAIN";
            if (!appender.equals(System.getProperty(FORMAT_PROPERTY))) {
                System.setProperty(FORMAT_PROPERTY, appender);
                reload(context);
            }
        }
        if (logging.hasPath("default-level")) {
            Level level = Level.toLevel(logging.getString("default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (logging.hasPath("levels")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                String levelName = entry.getValue().unwrapped().toString();
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(levelName, null));
                LOGGER.debug("Logger '{}' set to {}", entry.getKey(), levelName);
            }
        }
    }

    private static void reload(LoggerContext context) {
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
