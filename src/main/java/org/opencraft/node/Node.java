package org.opencraft.node;

import com.typesafe.config.Config;
import org.opencraft.bootstrap.BootstrapContext;
import org.opencraft.bootstrap.BootstrapException;
import org.opencraft.bootstrap.RoleOrchestrator;
import org.opencraft.bootstrap.engine.ConfiguredSystemCatalog;
import org.opencraft.bootstrap.engine.PlayerLoop;
import org.opencraft.bootstrap.spi.ISystemCatalog;
import org.opencraft.bootstrap.world.World;
import org.opencraft.config.ConfigResolver;
import org.opencraft.config.ResolvedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A running Opencraft process. Resolves the configuration, creates the worlds its role requires and
 * ticks them in a {@link PlayerLoop} until the JVM shuts down.
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);

    private final BootstrapContext context;
    private final PlayerLoop loop;
    private final RoleOrchestrator orchestrator;
    private Thread shutdownHook;

    /**
     * Constructs the Node from the layered application configuration.
     *
     * @param config The fully resolved application configuration.
     * @throws BootstrapException if the bootstrap configuration or the system catalog is invalid.
     */
    public Node(final Config config) throws BootstrapException {
        this(ConfigResolver.resolve(config), ConfiguredSystemCatalog.fromConfig(config), PlayerLoop.fromConfig(config));
    }

    public Node(final ResolvedConfig config, final ISystemCatalog catalog, final PlayerLoop loop) {
        this.context = new BootstrapContext(config);
        this.loop = Objects.requireNonNull(loop, "loop");
        this.orchestrator = new RoleOrchestrator(context, catalog, loop);
    }

    /**
     * Creates the worlds of this process without ticking them.
     *
     * @return The worlds created by this call.
     * @throws BootstrapException if the worlds cannot be created.
     */
    public List<World> initialize() throws BootstrapException {
        final ResolvedConfig config = context.getConfig();
        LOGGER.info("Bootstrapping {} (remote config: {}, deployment service: {})",
            config.playType(), config.useRemoteConfig(), config.isDeploymentService());
        return orchestrator.initialize();
    }

    /**
     * Creates the worlds, starts the player loop and registers a shutdown hook for graceful termination.
     *
     * @throws BootstrapException if the worlds cannot be created. The loop is not started in that case.
     */
    public void start() throws BootstrapException {
        initialize();
        loop.start();

        if (context.getDeploymentWorld().isPresent()) {
            LOGGER.info("Waiting for the deployment exchange before creating game worlds.");
        }

        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started successfully with {} world(s). Running until interrupted.",
            context.getRegistry().size());
    }

    /**
     * Stops the player loop. This method is typically called via the shutdown hook.
     */
    public void stop() {
        LOGGER.info("Shutdown sequence initiated...");

        // Remove shutdown hook to prevent double execution
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                // Shutdown hook is already running or JVM is shutting down
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
            shutdownHook = null;
        }

        loop.stop();
        LOGGER.info("All worlds stopped. Goodbye.");
    }

    public BootstrapContext getContext() {
        return context;
    }

    public PlayerLoop getLoop() {
        return loop;
    }

    public Map<String, Number> getMetrics() {
        return context.getRegistry().getMetrics();
    }
}
