package org.opencraft.bootstrap;

import org.opencraft.bootstrap.net.EndpointPair;
import org.opencraft.bootstrap.world.World;
import org.opencraft.bootstrap.world.WorldRegistry;
import org.opencraft.config.ResolvedConfig;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide bootstrap state, created once per process start and passed explicitly to every
 * component that needs it.
 * <p>
 * The default injection world and the deployment world are set at most once; later attempts
 * leave the first value in place. The game worlds are likewise set up at most once per process.
 */
public final class BootstrapContext {

    private final ResolvedConfig config;
    private final WorldRegistry registry = new WorldRegistry();
    private final AtomicReference<World> defaultWorld = new AtomicReference<>();
    private final AtomicReference<World> deploymentWorld = new AtomicReference<>();
    private final AtomicBoolean gameWorldsSetUp = new AtomicBoolean();
    private volatile EndpointPair serverEndpoints;
    private volatile EndpointPair deploymentEndpoints;

    /**
     * @param config The configuration resolved at process start.
     */
    public BootstrapContext(final ResolvedConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ResolvedConfig getConfig() {
        return config;
    }

    public WorldRegistry getRegistry() {
        return registry;
    }

    /**
     * Makes {@code world} the default injection world unless one is already set.
     *
     * @param world A newly created world.
     * @return true if {@code world} became the default.
     */
    public boolean offerDefaultWorld(final World world) {
        return defaultWorld.compareAndSet(null, Objects.requireNonNull(world, "world"));
    }

    /**
     * @return The world external code uses when it needs an ambient world, if any world exists yet.
     */
    public Optional<World> getDefaultWorld() {
        return Optional.ofNullable(defaultWorld.get());
    }

    /**
     * Records the deployment world.
     *
     * @param world The deployment world.
     * @return false if a deployment world was already recorded.
     */
    boolean markDeploymentWorld(final World world) {
        return deploymentWorld.compareAndSet(null, Objects.requireNonNull(world, "world"));
    }

    public Optional<World> getDeploymentWorld() {
        return Optional.ofNullable(deploymentWorld.get());
    }

    /**
     * Records that the game worlds have been set up.
     *
     * @return false if they were already set up.
     */
    boolean markGameWorldsSetUp() {
        return gameWorldsSetUp.compareAndSet(false, true);
    }

    public boolean hasGameWorlds() {
        return gameWorldsSetUp.get();
    }

    public Optional<EndpointPair> getServerEndpoints() {
        return Optional.ofNullable(serverEndpoints);
    }

    public void setServerEndpoints(final EndpointPair endpoints) {
        this.serverEndpoints = Objects.requireNonNull(endpoints, "endpoints");
    }

    // Undoes setServerEndpoints when the worlds dialing them could not be created
    void restoreServerEndpoints(final EndpointPair previous) {
        this.serverEndpoints = previous;
    }

    /**
     * @return The deployment service endpoints: connect for requesting configuration, listen for serving it.
     */
    public Optional<EndpointPair> getDeploymentEndpoints() {
        return Optional.ofNullable(deploymentEndpoints);
    }

    public void setDeploymentEndpoints(final EndpointPair endpoints) {
        this.deploymentEndpoints = Objects.requireNonNull(endpoints, "endpoints");
    }
}
