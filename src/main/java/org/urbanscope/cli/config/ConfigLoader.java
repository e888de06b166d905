package org.urbanscope.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the effective configuration of one CLI invocation.
 * <p>
 * Load order, highest precedence first: system properties, environment variables, the chosen
 * configuration file, classpath defaults ({@code application.conf}, {@code reference.conf}).
 * The file is, in this order, the one passed with {@code --config}, the one named by
 * {@code -Dconfig.file}, or {@code urbanscope.conf} in the working directory. Defaults are
 * merged unresolved so that overriding {@code urbanscope.paths.*} also moves every derived path.
 */
public final class ConfigLoader {

    public static final String CONFIG_FILE_NAME = "urbanscope.conf";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Loads and resolves the configuration.
     *
     * @param explicitFile file given on the command line, or {@code null}
     * @param workingDir   directory searched for {@value #CONFIG_FILE_NAME}
     * @return the resolved configuration
     * @throws IllegalArgumentException if an explicitly named file does not exist
     * @throws ConfigException          if a file cannot be parsed or a substitution cannot be resolved
     */
    public static Config load(File explicitFile, File workingDir) {
        Config file = ConfigFactory.empty();
        if (explicitFile != null) {
            file = parseRequired(explicitFile, "--config");
        } else {
            String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                file = parseRequired(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
            } else {
                File cwdConfigFile = new File(workingDir, CONFIG_FILE_NAME);
                if (cwdConfigFile.isFile()) {
                    log.info("Using configuration file found in working directory: {}", cwdConfigFile.getAbsolutePath());
                    file = ConfigFactory.parseFile(cwdConfigFile);
                } else {
                    log.debug("No '{}' in {}, using classpath defaults", CONFIG_FILE_NAME, workingDir.getAbsolutePath());
                }
            }
        }
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(file)
            .withFallback(ConfigFactory.defaultApplication())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static Config parseRequired(File file, String origin) {
        if (!file.isFile()) {
            throw new IllegalArgumentException("Configuration file specified via " + origin + " was not found: " + file.getAbsolutePath());
        }
        log.info("Using configuration file specified via {}: {}", origin, file.getAbsolutePath());
        return ConfigFactory.parseFile(file);
    }
}
