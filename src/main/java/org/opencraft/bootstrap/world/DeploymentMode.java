package org.opencraft.bootstrap.world;

import org.opencraft.bootstrap.catalog.BuiltinSystem;
import org.opencraft.bootstrap.catalog.SimulationKind;

import java.util.Set;

/**
 * What the deployment world does: fetch this process's configuration from a deployment service,
 * or be the deployment service for other processes.
 */
public enum DeploymentMode {

    REQUEST_CONFIG(WorldKind.DEPLOYMENT_CLIENT, BuiltinSystem.DEPLOYMENT_RECEIVE),
    SERVE_CONFIG(WorldKind.DEPLOYMENT_SERVER, BuiltinSystem.DEPLOYMENT_SERVICE);

    private final WorldKind worldKind;
    private final BuiltinSystem exchangeSystem;

    DeploymentMode(final WorldKind worldKind, final BuiltinSystem exchangeSystem) {
        this.worldKind = worldKind;
        this.exchangeSystem = exchangeSystem;
    }

    public WorldKind worldKind() {
        return worldKind;
    }

    /**
     * @return The system that requests or serves the configuration.
     */
    public BuiltinSystem exchangeSystem() {
        return exchangeSystem;
    }

    public Set<SimulationKind> simulationKinds() {
        return worldKind.simulationKinds();
    }
}
