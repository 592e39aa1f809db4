package org.opencraft.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "opencraft.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. CLI arguments passed as Java System Properties, e.g., -Dbootstrap.thin-clients=4
     * 2. Environment variable overrides (CONFIG_FORCE_bootstrap_thin__clients=4)
     * 3. Configuration file ({@code configFile}, or opencraft.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile Explicit configuration file, or null to look for opencraft.conf in the working directory.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigResolutionException if an explicit file is missing, or any layer fails to parse or resolve.
     */
    public static Config load(final File configFile) throws ConfigResolutionException {
        try {
            final Config fileConfig = loadFile(configFile);

            // Chain the configs together. The one provided first wins.
            final Config combined = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironmentOverrides())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference());

            // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
            return combined.resolve();
        } catch (final com.typesafe.config.ConfigException e) {
            throw new ConfigResolutionException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    private static Config loadFile(final File configFile) throws ConfigResolutionException {
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new ConfigResolutionException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            LOG.info("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
            return ConfigFactory.parseFile(cwdConfigFile);
        }
        LOG.info("Configuration file '{}' not found. Using defaults from classpath.", cwdConfigFile.getPath());
        return ConfigFactory.empty();
    }
}
