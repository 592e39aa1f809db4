package org.opencraft.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the {@code bootstrap} block of the layered HOCON configuration onto a {@link ResolvedConfig}.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * bootstrap {
 *   play-type = "ClientAndServer"
 *   streaming-role = "Host"
 *   server { url = "127.0.0.1", port = 7979 }
 *   thin-clients = 0
 *   auto-connect = true
 *   streamed-client { auto-connect = false }
 *   build-target = "ALL"
 *   deployment { remote-config = false, service = false, url = "127.0.0.1", port = 7980 }
 * }
 * </pre>
 */
public final class ConfigResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigResolver.class);
    private static final String BOOTSTRAP_CONFIG_PATH = "bootstrap";

    private ConfigResolver() {
        // Private constructor to prevent instantiation
    }

    /**
     * Resolves the bootstrap configuration.
     *
     * @param config The fully layered application configuration.
     * @return The immutable resolved configuration.
     * @throws ConfigResolutionException if the block is missing, a key is missing or has the wrong type,
     *                                   an enum value is unknown or the thin-client count is negative.
     */
    public static ResolvedConfig resolve(final Config config) throws ConfigResolutionException {
        if (!config.hasPath(BOOTSTRAP_CONFIG_PATH)) {
            throw new ConfigResolutionException("Configuration must contain a '" + BOOTSTRAP_CONFIG_PATH + "' section");
        }

        try {
            final Config bootstrap = config.getConfig(BOOTSTRAP_CONFIG_PATH);
            final ResolvedConfig resolved = new ResolvedConfig(
                PlayType.parse(bootstrap.getString("play-type")),
                StreamingRole.parse(bootstrap.getString("streaming-role")),
                bootstrap.getString("server.url"),
                bootstrap.getInt("server.port"),
                bootstrap.getInt("thin-clients"),
                bootstrap.getBoolean("auto-connect"),
                bootstrap.getBoolean("streamed-client.auto-connect"),
                bootstrap.getBoolean("deployment.remote-config"),
                bootstrap.getBoolean("deployment.service"),
                bootstrap.getString("deployment.url"),
                bootstrap.getInt("deployment.port"),
                BuildTarget.parse(bootstrap.getString("build-target"))
            );
            LOGGER.debug("Resolved bootstrap configuration: {}", resolved);
            return resolved;
        } catch (final ConfigException | IllegalArgumentException e) {
            throw new ConfigResolutionException("Invalid bootstrap configuration: " + e.getMessage(), e);
        }
    }
}
