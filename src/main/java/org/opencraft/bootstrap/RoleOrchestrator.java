package org.opencraft.bootstrap;

import org.opencraft.bootstrap.catalog.CatalogRetrievalException;
import org.opencraft.bootstrap.net.EndpointBuilder;
import org.opencraft.bootstrap.net.EndpointPair;
import org.opencraft.bootstrap.spi.IDeploymentListener;
import org.opencraft.bootstrap.spi.IExecutionLoop;
import org.opencraft.bootstrap.spi.ISystemCatalog;
import org.opencraft.bootstrap.world.DeploymentMode;
import org.opencraft.bootstrap.world.DeploymentWorldBuilder;
import org.opencraft.bootstrap.world.RoleUnavailableException;
import org.opencraft.bootstrap.world.World;
import org.opencraft.bootstrap.world.WorldFactory;
import org.opencraft.bootstrap.world.WorldSpec;
import org.opencraft.config.PlayType;
import org.opencraft.config.ResolvedConfig;
import org.opencraft.config.StreamingRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides which worlds this process hosts and creates them.
 *
 * <p>If the configuration has to be fetched from, or served to, a deployment service, only the
 * deployment world is created. The game worlds follow once the configuration-request system calls
 * {@link #onConfigurationReceived(ResolvedConfig)}. Otherwise the game worlds are created
 * immediately from the local configuration.</p>
 *
 * <p>Every requested world is planned before the first one is created. Address and catalog errors
 * therefore abort the attempt with nothing registered. A role the build target cannot host is
 * logged and skipped, unless it leaves nothing to create.</p>
 */
public final class RoleOrchestrator implements IDeploymentListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(RoleOrchestrator.class);

    private final BootstrapContext context;
    private final WorldFactory worldFactory;
    private final DeploymentWorldBuilder deploymentWorldBuilder;

    public RoleOrchestrator(final BootstrapContext context, final ISystemCatalog catalog, final IExecutionLoop loop) {
        this.context = Objects.requireNonNull(context, "context");
        this.worldFactory = new WorldFactory(context, catalog, loop);
        this.deploymentWorldBuilder = new DeploymentWorldBuilder(context, catalog, worldFactory);
    }

    /**
     * Runs the startup sequence for the configuration in the bootstrap context.
     * Calling it again never creates a second deployment world or a second set of game worlds.
     *
     * @return The worlds created by this call, in creation order.
     * @throws BootstrapException if the worlds cannot be created. Nothing has been registered in that case.
     */
    public synchronized List<World> initialize() throws BootstrapException {
        final ResolvedConfig config = context.getConfig();

        if (!config.requiresDeploymentWorld()) {
            return setupWorldsFromConfig(config);
        }

        if (context.getDeploymentWorld().isPresent()) {
            LOGGER.debug("Deployment world already exists, waiting for the deployment exchange.");
            return List.of();
        }

        final DeploymentMode mode = config.useRemoteConfig() ? DeploymentMode.REQUEST_CONFIG : DeploymentMode.SERVE_CONFIG;
        final World world = deploymentWorldBuilder.createDeploymentWorld(mode);
        context.markDeploymentWorld(world);
        context.getRegistry().add(world);
        return List.of(world);
    }

    /**
     * Creates the game worlds once the deployment service has answered.
     */
    @Override
    public void onConfigurationReceived(final ResolvedConfig config) throws BootstrapException {
        if (context.hasGameWorlds()) {
            LOGGER.warn("Configuration received again from deployment service, game worlds already exist.");
            return;
        }
        LOGGER.info("Configuration received from deployment service, creating game worlds.");
        setupWorldsFromConfig(config);
    }

    /**
     * Computes the game server endpoints and creates the game worlds {@code config} asks for.
     * The server endpoints are only kept if the worlds are created. Once the game worlds exist,
     * later calls create nothing and leave the endpoints unchanged.
     *
     * @param config Local or remotely fetched configuration.
     * @return The worlds created by this call.
     * @throws BootstrapException if the server address is invalid or the worlds cannot be created.
     */
    public synchronized List<World> setupWorldsFromConfig(final ResolvedConfig config) throws BootstrapException {
        if (context.hasGameWorlds()) {
            LOGGER.warn("Game worlds are already set up, ignoring repeated setup for playType {}.", config.playType());
            return List.of();
        }

        final EndpointPair endpoints = EndpointBuilder.build(config.serverHost(), config.serverPort());
        final EndpointPair previous = context.getServerEndpoints().orElse(null);
        context.setServerEndpoints(endpoints);
        LOGGER.debug("Server endpoints: connect={} listen={}", endpoints.connect(), endpoints.listen());

        try {
            return setupWorlds(config.streamingRole(), config.playType(), config.numThinClients(),
                config.autoConnect(), config.streamedClientAutoConnect());
        } catch (final BootstrapException | RuntimeException e) {
            context.restoreServerEndpoints(previous);
            throw e;
        }
    }

    /**
     * Creates client, thin-client and server worlds, in that order, as selected by {@code playType}.
     * A guest streaming role, or {@link PlayType#STREAMED_CLIENT}, turns the client world into a
     * streamed guest world.
     *
     * @return The worlds created by this call, empty if the game worlds were already set up.
     * @throws BootstrapException if a catalog cannot be retrieved, or every requested role is unavailable.
     */
    public synchronized List<World> setupWorlds(final StreamingRole streamingRole, final PlayType playType,
                                                final int numThinClients, final boolean autoConnect,
                                                final boolean streamedClientAutoConnect) throws BootstrapException {
        if (context.hasGameWorlds()) {
            LOGGER.warn("Game worlds are already set up, ignoring repeated setup for playType {}.", playType);
            return List.of();
        }
        LOGGER.info("Setting up worlds with playType {} and streaming role {}", playType, streamingRole);

        final List<WorldSpec> plans = new ArrayList<>();
        final List<RoleUnavailableException> unavailable = new ArrayList<>();

        if (playType.includesClient()) {
            if (streamingRole == StreamingRole.GUEST || playType == PlayType.STREAMED_CLIENT) {
                plan(plans, unavailable, () -> List.of(worldFactory.planStreamedClientWorld(streamedClientAutoConnect)));
            } else {
                plan(plans, unavailable, () -> List.of(worldFactory.planClientWorld(autoConnect)));
            }
        }

        if (playType == PlayType.THIN_CLIENT) {
            plan(plans, unavailable, () -> worldFactory.planThinClientWorlds(numThinClients, autoConnect));
        }

        if (playType.includesServer()) {
            plan(plans, unavailable, () -> List.of(worldFactory.planServerWorld(autoConnect)));
        }

        if (plans.isEmpty() && !unavailable.isEmpty()) {
            throw unavailable.get(0);
        }

        if (!context.markGameWorldsSetUp()) {
            LOGGER.warn("Game worlds were set up concurrently, discarding {} planned world(s).", plans.size());
            return List.of();
        }
        final List<World> created = new ArrayList<>(plans.size());
        for (final WorldSpec spec : plans) {
            final World world = worldFactory.createWorld(spec);
            context.getRegistry().add(world);
            created.add(world);
        }
        LOGGER.info("Created {} world(s); {} world(s) active in this process.", created.size(), context.getRegistry().size());
        return created;
    }

    private static void plan(final List<WorldSpec> plans, final List<RoleUnavailableException> unavailable,
                             final RolePlanner planner) throws CatalogRetrievalException {
        try {
            plans.addAll(planner.plan());
        } catch (final RoleUnavailableException e) {
            LOGGER.error("Skipping role: {}", e.getMessage());
            unavailable.add(e);
        }
    }

    public BootstrapContext getContext() {
        return context;
    }

    @FunctionalInterface
    private interface RolePlanner {
        List<WorldSpec> plan() throws RoleUnavailableException, CatalogRetrievalException;
    }
}
