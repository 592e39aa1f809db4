package org.opencraft.bootstrap.catalog;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One system registered with the execution engine.
 *
 * @param id          Stable identifier, unique within a catalog.
 * @param name        Human-readable name, for logs only.
 * @param kinds       Simulation kinds the system belongs to.
 * @param origin      Where the system was registered from.
 * @param autoCreate  Whether the engine includes the system in catalogs it hands out; false for
 *                    systems that only run when a world adds them explicitly.
 * @param updateAfter Identifiers of systems this one must be created after.
 * @param builtin     The builtin system this entry was resolved to at registration, or null.
 */
public record SystemCatalogEntry(
    String id,
    String name,
    Set<SimulationKind> kinds,
    SystemOrigin origin,
    boolean autoCreate,
    List<String> updateAfter,
    BuiltinSystem builtin
) {
    public SystemCatalogEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(origin, "origin");
        kinds = kinds.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(SimulationKind.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(kinds));
        updateAfter = List.copyOf(updateAfter);
    }

    /**
     * Creates an entry and resolves its builtin identity from {@code id}.
     */
    public static SystemCatalogEntry of(final String id, final String name, final Set<SimulationKind> kinds,
                                        final SystemOrigin origin, final boolean autoCreate,
                                        final List<String> updateAfter) {
        return new SystemCatalogEntry(id, name, kinds, origin, autoCreate, updateAfter,
            BuiltinSystem.fromId(id).orElse(null));
    }

    public boolean is(final BuiltinSystem system) {
        return builtin == system;
    }

    public boolean isGenericRoleConfiguration() {
        return builtin != null && BuiltinSystem.GENERIC_ROLE_CONFIGURATION.contains(builtin);
    }

    public boolean belongsToAny(final Set<SimulationKind> requested) {
        return !Collections.disjoint(kinds, requested);
    }
}
