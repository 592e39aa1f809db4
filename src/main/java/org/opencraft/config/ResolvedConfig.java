package org.opencraft.config;

import java.util.Objects;

/**
 * The fully resolved startup configuration of a process. Immutable; created once per process start
 * by {@link ConfigResolver}, and once more for a configuration received from a deployment service.
 * <p>
 * Host strings and ports are not validated here. Turning them into endpoints is the job of the
 * endpoint builder, which reports them as address errors.
 *
 * @param playType                  which game worlds to host.
 * @param streamingRole             host or guest in multiplay streaming.
 * @param serverHost                game server host clients connect to.
 * @param serverPort                game server port, shared by listen and connect endpoints.
 * @param numThinClients            number of thin-client worlds for {@link PlayType#THIN_CLIENT}.
 * @param autoConnect               whether game worlds get the auto-connect system.
 * @param streamedClientAutoConnect whether the streamed guest world gets the auto-connect system.
 * @param useRemoteConfig           fetch the configuration from a deployment service first.
 * @param isDeploymentService       this process serves configuration to others.
 * @param deploymentHost            deployment service host.
 * @param deploymentPort            deployment service port.
 * @param buildTarget               host environment the binary was built for.
 */
public record ResolvedConfig(
    PlayType playType,
    StreamingRole streamingRole,
    String serverHost,
    int serverPort,
    int numThinClients,
    boolean autoConnect,
    boolean streamedClientAutoConnect,
    boolean useRemoteConfig,
    boolean isDeploymentService,
    String deploymentHost,
    int deploymentPort,
    BuildTarget buildTarget
) {
    public ResolvedConfig {
        Objects.requireNonNull(playType, "playType");
        Objects.requireNonNull(streamingRole, "streamingRole");
        Objects.requireNonNull(serverHost, "serverHost");
        Objects.requireNonNull(deploymentHost, "deploymentHost");
        Objects.requireNonNull(buildTarget, "buildTarget");
        if (numThinClients < 0) {
            throw new IllegalArgumentException("numThinClients must not be negative, was " + numThinClients);
        }
    }

    /**
     * @return true if this process must bring up a deployment world before any game world.
     */
    public boolean requiresDeploymentWorld() {
        return useRemoteConfig || isDeploymentService;
    }
}
