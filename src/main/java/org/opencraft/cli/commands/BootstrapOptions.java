package org.opencraft.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import picocli.CommandLine.Option;

import java.util.HashMap;
import java.util.Map;

/**
 * Command-line overrides of the {@code bootstrap} configuration block. Options that are not given
 * leave the configured value in place.
 */
public class BootstrapOptions {

    @Option(names = "--play-type", description = "Client, Server, ClientAndServer, ThinClient or StreamedClient.")
    String playType;

    @Option(names = "--streaming-role", description = "Host or Guest.")
    String streamingRole;

    @Option(names = "--server-url", description = "Game server host clients connect to.")
    String serverUrl;

    @Option(names = "--server-port", description = "Game server port.")
    Integer serverPort;

    @Option(names = "--thin-clients", description = "Number of thin-client worlds for play type ThinClient.")
    Integer thinClients;

    @Option(names = "--auto-connect", negatable = true, description = "Attach the auto-connect system to game worlds.")
    Boolean autoConnect;

    @Option(names = "--streamed-client-auto-connect", negatable = true,
        description = "Attach the auto-connect system to streamed guest worlds.")
    Boolean streamedClientAutoConnect;

    @Option(names = "--remote-config", description = "Fetch the configuration from the deployment service.")
    Boolean remoteConfig;

    @Option(names = "--deployment-service", description = "Serve configuration to other processes.")
    Boolean deploymentService;

    @Option(names = "--deployment-url", description = "Deployment service host.")
    String deploymentUrl;

    @Option(names = "--deployment-port", description = "Deployment service port.")
    Integer deploymentPort;

    @Option(names = "--build-target", description = "ALL, CLIENT or SERVER.")
    String buildTarget;

    /**
     * @param config The layered configuration.
     * @return {@code config} with every given option taking precedence.
     */
    public Config applyTo(final Config config) {
        final Map<String, Object> overrides = new HashMap<>();
        putIfSet(overrides, "bootstrap.play-type", playType);
        putIfSet(overrides, "bootstrap.streaming-role", streamingRole);
        putIfSet(overrides, "bootstrap.server.url", serverUrl);
        putIfSet(overrides, "bootstrap.server.port", serverPort);
        putIfSet(overrides, "bootstrap.thin-clients", thinClients);
        putIfSet(overrides, "bootstrap.auto-connect", autoConnect);
        putIfSet(overrides, "bootstrap.streamed-client.auto-connect", streamedClientAutoConnect);
        putIfSet(overrides, "bootstrap.deployment.remote-config", remoteConfig);
        putIfSet(overrides, "bootstrap.deployment.service", deploymentService);
        putIfSet(overrides, "bootstrap.deployment.url", deploymentUrl);
        putIfSet(overrides, "bootstrap.deployment.port", deploymentPort);
        putIfSet(overrides, "bootstrap.build-target", buildTarget);
        if (overrides.isEmpty()) {
            return config;
        }
        return ConfigFactory.parseMap(overrides, "command line").withFallback(config);
    }

    private static void putIfSet(final Map<String, Object> overrides, final String path, final Object value) {
        if (value != null) {
            overrides.put(path, value);
        }
    }
}
