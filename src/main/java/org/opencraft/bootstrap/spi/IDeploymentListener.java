package org.opencraft.bootstrap.spi;

import org.opencraft.bootstrap.BootstrapException;
import org.opencraft.config.ResolvedConfig;

/**
 * Callback used by the configuration-request system once the deployment service has answered.
 * Implemented by the orchestrator, which then creates the local game worlds.
 */
@FunctionalInterface
public interface IDeploymentListener {

    /**
     * @param config The configuration fetched from the deployment service.
     * @throws BootstrapException if the game worlds cannot be created from it.
     */
    void onConfigurationReceived(ResolvedConfig config) throws BootstrapException;
}
