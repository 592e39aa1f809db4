package org.opencraft.bootstrap.world;

import org.opencraft.bootstrap.BootstrapContext;
import org.opencraft.bootstrap.catalog.BuiltinSystem;
import org.opencraft.bootstrap.catalog.CatalogFilter;
import org.opencraft.bootstrap.catalog.CatalogRetrievalException;
import org.opencraft.bootstrap.catalog.SystemCatalogEntry;
import org.opencraft.bootstrap.net.EndpointPair;
import org.opencraft.bootstrap.net.NetworkEndpoint;
import org.opencraft.bootstrap.spi.IExecutionLoop;
import org.opencraft.bootstrap.spi.ISystemCatalog;
import org.opencraft.config.BuildTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates game worlds. Every world gets an immutable, engine-sorted system list, is registered with
 * the execution loop exactly once, and becomes the default injection world if it is the first.
 * <p>
 * Each {@code createXxx} variant is split into a {@code planXxx} step, which computes the
 * {@link WorldSpec} and may fail, and {@link #createWorld(WorldSpec)}, which only allocates and
 * registers. Callers that need all-or-nothing behavior plan every world before creating any.
 */
public final class WorldFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorldFactory.class);

    static final String CLIENT_WORLD_NAME = "ClientWorld";
    static final String STREAMED_CLIENT_WORLD_NAME = "StreamingGuestWorld";
    static final String THIN_CLIENT_WORLD_NAME = "ThinClientWorld";
    static final String SERVER_WORLD_NAME = "ServerWorld";

    private final BootstrapContext context;
    private final ISystemCatalog catalog;
    private final IExecutionLoop loop;
    private final CatalogFilter filter;
    private final BuildTarget buildTarget;

    public WorldFactory(final BootstrapContext context, final ISystemCatalog catalog, final IExecutionLoop loop) {
        this.context = Objects.requireNonNull(context, "context");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.filter = new CatalogFilter(catalog);
        this.buildTarget = context.getConfig().buildTarget();
    }

    /**
     * Allocates a world, registers it with the execution loop and offers it as default injection world.
     *
     * @param name    World name.
     * @param kind    World role.
     * @param systems Systems in engine creation order; copied.
     * @return The registered world.
     * @throws IllegalStateException if the execution loop rejects the world. This is fatal.
     */
    public World createWorld(final String name, final WorldKind kind, final List<SystemCatalogEntry> systems) {
        return createWorld(new WorldSpec(name, kind, systems, null));
    }

    /**
     * @see #createWorld(String, WorldKind, List)
     */
    public World createWorld(final WorldSpec spec) {
        final World world = new World(spec.name(), spec.kind(), spec.systems(), spec.endpoint());
        loop.register(world);
        final boolean isDefault = context.offerDefaultWorld(world);
        LOGGER.info("Created world '{}' ({}) with {} system(s){}", world.getName(), world.getKind(),
            world.getSystems().size(), isDefault ? ", default injection world" : "");
        LOGGER.debug("Systems of {}: {}", world, world.getSystemIds());
        return world;
    }

    public World createClientWorld(final boolean autoConnect) throws RoleUnavailableException, CatalogRetrievalException {
        return createWorld(planClientWorld(autoConnect));
    }

    public World createStreamedClientWorld(final boolean autoConnect) throws RoleUnavailableException, CatalogRetrievalException {
        return createWorld(planStreamedClientWorld(autoConnect));
    }

    /**
     * Creates {@code numThinClients} independent thin-client worlds sharing one filtered catalog.
     *
     * @param numThinClients Number of worlds; 0 yields an empty list.
     * @param autoConnect    Whether each world gets the auto-connect system.
     * @return The created worlds.
     */
    public List<World> createThinClientWorlds(final int numThinClients, final boolean autoConnect)
        throws RoleUnavailableException, CatalogRetrievalException {
        final List<World> worlds = new ArrayList<>();
        for (final WorldSpec spec : planThinClientWorlds(numThinClients, autoConnect)) {
            worlds.add(createWorld(spec));
        }
        return worlds;
    }

    public World createServerWorld(final boolean autoConnect) throws RoleUnavailableException, CatalogRetrievalException {
        return createWorld(planServerWorld(autoConnect));
    }

    /**
     * Plans the regular client world: client simulation and presentation systems, filtered.
     */
    public WorldSpec planClientWorld(final boolean autoConnect) throws RoleUnavailableException, CatalogRetrievalException {
        requireClientBuild(WorldKind.GAME_CLIENT);
        final List<SystemCatalogEntry> systems = filter.filterForRole(WorldKind.GAME_CLIENT, autoConnect);
        return new WorldSpec(CLIENT_WORLD_NAME, WorldKind.GAME_CLIENT, catalog.sort(systems), connectEndpoint());
    }

    /**
     * Plans the streamed guest world. Its systems are picked by hand, so no generic systems can be
     * present and nothing needs filtering.
     */
    public WorldSpec planStreamedClientWorld(final boolean autoConnect) throws RoleUnavailableException, CatalogRetrievalException {
        requireClientBuild(WorldKind.GAME);
        final List<SystemCatalogEntry> systems = new ArrayList<>();
        systems.add(catalog.require(BuiltinSystem.MULTIPLAY_INIT));
        systems.add(catalog.require(BuiltinSystem.EMULATION_INIT));
        if (autoConnect) {
            systems.add(catalog.require(BuiltinSystem.AUTO_CONNECT));
        }
        return new WorldSpec(STREAMED_CLIENT_WORLD_NAME, WorldKind.GAME, catalog.sort(systems),
            autoConnect ? connectEndpoint() : null);
    }

    /**
     * Plans {@code numThinClients} thin-client worlds. The catalog is filtered once and shared.
     *
     * @throws IllegalArgumentException if {@code numThinClients} is negative.
     */
    public List<WorldSpec> planThinClientWorlds(final int numThinClients, final boolean autoConnect)
        throws RoleUnavailableException, CatalogRetrievalException {
        if (numThinClients < 0) {
            throw new IllegalArgumentException("numThinClients must not be negative, was " + numThinClients);
        }
        if (numThinClients == 0) {
            return List.of();
        }
        requireClientBuild(WorldKind.GAME_THIN_CLIENT);
        final List<SystemCatalogEntry> systems =
            catalog.sort(filter.filterForRole(WorldKind.GAME_THIN_CLIENT, autoConnect));
        final NetworkEndpoint endpoint = connectEndpoint();

        final List<WorldSpec> specs = new ArrayList<>(numThinClients);
        for (int i = 0; i < numThinClients; i++) {
            specs.add(new WorldSpec(THIN_CLIENT_WORLD_NAME + i, WorldKind.GAME_THIN_CLIENT, systems, endpoint));
        }
        return specs;
    }

    /**
     * Plans the server world: server simulation systems, filtered.
     */
    public WorldSpec planServerWorld(final boolean autoConnect) throws RoleUnavailableException, CatalogRetrievalException {
        if (!buildTarget.supportsServerWorlds()) {
            throw new RoleUnavailableException(WorldKind.GAME_SERVER, buildTarget);
        }
        final List<SystemCatalogEntry> systems = filter.filterForRole(WorldKind.GAME_SERVER, autoConnect);
        final NetworkEndpoint listen = context.getServerEndpoints().map(EndpointPair::listen).orElse(null);
        return new WorldSpec(SERVER_WORLD_NAME, WorldKind.GAME_SERVER, catalog.sort(systems), listen);
    }

    private void requireClientBuild(final WorldKind kind) throws RoleUnavailableException {
        if (!buildTarget.supportsClientWorlds()) {
            throw new RoleUnavailableException(kind, buildTarget);
        }
    }

    private NetworkEndpoint connectEndpoint() {
        return context.getServerEndpoints().map(EndpointPair::connect).orElse(null);
    }
}
