package org.opencraft.bootstrap.spi;

import org.opencraft.bootstrap.catalog.BuiltinSystem;
import org.opencraft.bootstrap.catalog.CatalogRetrievalException;
import org.opencraft.bootstrap.catalog.SimulationKind;
import org.opencraft.bootstrap.catalog.SystemCatalogEntry;

import java.util.List;
import java.util.Set;

/**
 * The execution engine's registry of systems. The bootstrap only consumes it: it asks for catalogs,
 * filters them and hands them back for sorting.
 */
public interface ISystemCatalog {

    /**
     * Returns every auto-created system belonging to at least one of {@code kinds}, in registration order.
     *
     * @param kinds              The simulation kinds of the world being built.
     * @param includeApplication Whether systems registered by the application are included.
     * @return The catalog; never empty.
     * @throws CatalogRetrievalException if the engine has no systems for the requested kinds.
     */
    List<SystemCatalogEntry> getCatalog(Set<SimulationKind> kinds, boolean includeApplication)
        throws CatalogRetrievalException;

    /**
     * Looks up a builtin system, whether or not it is auto-created.
     *
     * @param system The builtin system.
     * @return Its catalog entry.
     * @throws CatalogRetrievalException if the engine does not know the system.
     */
    SystemCatalogEntry require(BuiltinSystem system) throws CatalogRetrievalException;

    /**
     * Sorts systems into the order the engine creates and updates them.
     *
     * @param systems The systems of one world, in any order.
     * @return A new list in dependency order.
     * @throws CatalogRetrievalException if the dependencies cannot be ordered.
     */
    List<SystemCatalogEntry> sort(List<SystemCatalogEntry> systems) throws CatalogRetrievalException;
}
