package org.opencraft.bootstrap.catalog;

import org.opencraft.bootstrap.spi.ISystemCatalog;
import org.opencraft.bootstrap.world.DeploymentMode;
import org.opencraft.bootstrap.world.WorldKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reduces the engine catalog to the systems a world of a given role runs.
 * <p>
 * The generic role-configuration systems are always removed first; role systems are appended
 * afterwards. The result is not sorted: the engine sorts it before the world is created.
 */
public final class CatalogFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogFilter.class);

    private final ISystemCatalog catalog;

    public CatalogFilter(final ISystemCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Builds the system list of a game world.
     *
     * @param kind        The role of the world.
     * @param autoConnect Whether to append the auto-connect system.
     * @return The filtered, unsorted systems.
     * @throws CatalogRetrievalException if the engine cannot supply the catalog or the auto-connect system.
     */
    public List<SystemCatalogEntry> filterForRole(final WorldKind kind, final boolean autoConnect)
        throws CatalogRetrievalException {
        final List<SystemCatalogEntry> systems =
            withoutGenericRoleConfiguration(catalog.getCatalog(kind.simulationKinds(), true));
        if (autoConnect) {
            appendOnce(systems, catalog.require(BuiltinSystem.AUTO_CONNECT));
        }
        LOGGER.debug("Filtered catalog for {} world: {} system(s), autoConnect={}", kind, systems.size(), autoConnect);
        return systems;
    }

    /**
     * Builds the system list of the deployment world: the engine and package systems of the mode's
     * simulation kind, without generic role configuration, plus the configuration exchange system,
     * scene management, connection monitoring and the authoring scene loader.
     *
     * @param mode Whether the world requests or serves configuration.
     * @return The filtered, unsorted systems.
     * @throws CatalogRetrievalException if the engine cannot supply the catalog or one of the appended systems.
     */
    public List<SystemCatalogEntry> filterForDeployment(final DeploymentMode mode) throws CatalogRetrievalException {
        final List<SystemCatalogEntry> systems =
            withoutGenericRoleConfiguration(catalog.getCatalog(mode.simulationKinds(), false));
        appendOnce(systems, catalog.require(mode.exchangeSystem()));
        appendOnce(systems, catalog.require(BuiltinSystem.SCENE_SYSTEM));
        appendOnce(systems, catalog.require(BuiltinSystem.CONNECTION_MONITOR));
        appendOnce(systems, catalog.require(BuiltinSystem.AUTHORING_SCENE_LOADER));
        LOGGER.debug("Filtered deployment catalog for {}: {} system(s)", mode, systems.size());
        return systems;
    }

    /**
     * Removes the generic role-configuration systems. A catalog without them is copied unchanged.
     *
     * @param catalog The catalog to filter.
     * @return A new, mutable list.
     */
    public static List<SystemCatalogEntry> withoutGenericRoleConfiguration(final List<SystemCatalogEntry> catalog) {
        final List<SystemCatalogEntry> filtered = new ArrayList<>(catalog.size());
        for (final SystemCatalogEntry entry : catalog) {
            if (entry.isGenericRoleConfiguration()) {
                LOGGER.debug("Removing generic role configuration system '{}'", entry.name());
                continue;
            }
            filtered.add(entry);
        }
        return filtered;
    }

    private static void appendOnce(final List<SystemCatalogEntry> systems, final SystemCatalogEntry entry) {
        for (final SystemCatalogEntry existing : systems) {
            if (existing.id().equals(entry.id())) {
                return;
            }
        }
        systems.add(entry);
    }
}
