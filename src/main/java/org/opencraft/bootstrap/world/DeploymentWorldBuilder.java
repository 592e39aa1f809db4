package org.opencraft.bootstrap.world;

import org.opencraft.bootstrap.BootstrapContext;
import org.opencraft.bootstrap.catalog.CatalogFilter;
import org.opencraft.bootstrap.catalog.CatalogRetrievalException;
import org.opencraft.bootstrap.catalog.SystemCatalogEntry;
import org.opencraft.bootstrap.net.AddressParseException;
import org.opencraft.bootstrap.net.EndpointBuilder;
import org.opencraft.bootstrap.net.EndpointPair;
import org.opencraft.bootstrap.net.NetworkEndpoint;
import org.opencraft.bootstrap.spi.ISystemCatalog;
import org.opencraft.config.ResolvedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates the deployment world: the minimal set of systems needed to connect, plus the system that
 * requests or serves configuration. It is the only world created when configuration comes from, or
 * is served to, a deployment service.
 */
public final class DeploymentWorldBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeploymentWorldBuilder.class);

    static final String DEPLOYMENT_WORLD_NAME = "DeploymentWorld";

    private final BootstrapContext context;
    private final ISystemCatalog catalog;
    private final CatalogFilter filter;
    private final WorldFactory worldFactory;

    public DeploymentWorldBuilder(final BootstrapContext context, final ISystemCatalog catalog,
                                  final WorldFactory worldFactory) {
        this.context = Objects.requireNonNull(context, "context");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.worldFactory = Objects.requireNonNull(worldFactory, "worldFactory");
        this.filter = new CatalogFilter(catalog);
    }

    /**
     * Stores the deployment endpoints in the bootstrap context and creates the deployment world.
     *
     * @param mode Whether this process requests configuration or serves it.
     * @return The registered deployment world.
     * @throws AddressParseException     if the deployment host or port is invalid.
     * @throws CatalogRetrievalException if the engine cannot supply the deployment systems.
     */
    public World createDeploymentWorld(final DeploymentMode mode) throws AddressParseException, CatalogRetrievalException {
        LOGGER.info("Creating deployment world ({})", mode);
        final ResolvedConfig config = context.getConfig();

        final EndpointPair endpoints = EndpointBuilder.build(config.deploymentHost(), config.deploymentPort());
        final List<SystemCatalogEntry> systems = catalog.sort(filter.filterForDeployment(mode));

        context.setDeploymentEndpoints(endpoints);
        final NetworkEndpoint endpoint = mode == DeploymentMode.REQUEST_CONFIG ? endpoints.connect() : endpoints.listen();
        LOGGER.debug("Deployment endpoints: connect={} listen={}", endpoints.connect(), endpoints.listen());

        return worldFactory.createWorld(new WorldSpec(DEPLOYMENT_WORLD_NAME, mode.worldKind(), systems, endpoint));
    }
}
