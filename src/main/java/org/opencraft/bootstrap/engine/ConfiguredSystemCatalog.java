package org.opencraft.bootstrap.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.opencraft.bootstrap.catalog.BuiltinSystem;
import org.opencraft.bootstrap.catalog.CatalogRetrievalException;
import org.opencraft.bootstrap.catalog.SimulationKind;
import org.opencraft.bootstrap.catalog.SystemCatalogEntry;
import org.opencraft.bootstrap.catalog.SystemOrigin;
import org.opencraft.bootstrap.spi.ISystemCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A system catalog declared in configuration. Stands in for the engine's type registry when the
 * bootstrap runs on its own, and is what {@code opencraft plan} reports against.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * engine.catalog.systems = [
 *   { id = "netcode.ghost-receive", name = "GhostReceiveSystem", origin = PACKAGE,
 *     kinds = [CLIENT_SIMULATION], after = ["netcode.network-stream-receive"], auto-create = true }
 * ]
 * </pre>
 */
public final class ConfiguredSystemCatalog implements ISystemCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfiguredSystemCatalog.class);
    private static final String SYSTEMS_CONFIG_PATH = "engine.catalog.systems";

    private final Map<String, SystemCatalogEntry> entries;

    /**
     * @param entries Systems in registration order.
     * @throws IllegalStateException if two entries share an identifier.
     */
    public ConfiguredSystemCatalog(final List<SystemCatalogEntry> entries) {
        final Map<String, SystemCatalogEntry> map = new LinkedHashMap<>();
        for (final SystemCatalogEntry entry : entries) {
            if (map.containsKey(entry.id())) {
                throw new IllegalStateException("Duplicate system id: " + entry.id());
            }
            map.put(entry.id(), entry);
            LOGGER.debug("System registered: {} ({}){}", entry.id(), entry.name(),
                entry.builtin() != null ? " as " + entry.builtin() : "");
        }
        this.entries = Collections.unmodifiableMap(map);
    }

    /**
     * Reads the catalog from {@code engine.catalog.systems}.
     *
     * @param config The application configuration.
     * @return The catalog.
     * @throws CatalogRetrievalException if the list is missing or an entry is malformed or duplicated.
     */
    public static ConfiguredSystemCatalog fromConfig(final Config config) throws CatalogRetrievalException {
        if (!config.hasPath(SYSTEMS_CONFIG_PATH)) {
            throw new CatalogRetrievalException("Configuration path '" + SYSTEMS_CONFIG_PATH + "' not found");
        }

        final List<SystemCatalogEntry> entries = new ArrayList<>();
        try {
            for (final Config system : config.getConfigList(SYSTEMS_CONFIG_PATH)) {
                final Set<SimulationKind> kinds = EnumSet.noneOf(SimulationKind.class);
                for (final String kind : system.getStringList("kinds")) {
                    kinds.add(SimulationKind.valueOf(kind));
                }
                entries.add(SystemCatalogEntry.of(
                    system.getString("id"),
                    system.getString("name"),
                    kinds,
                    SystemOrigin.valueOf(system.getString("origin")),
                    !system.hasPath("auto-create") || system.getBoolean("auto-create"),
                    system.hasPath("after") ? system.getStringList("after") : List.of()));
            }
            final ConfiguredSystemCatalog catalog = new ConfiguredSystemCatalog(entries);
            LOGGER.info("Loaded system catalog with {} system(s).", catalog.size());
            return catalog;
        } catch (final ConfigException | IllegalArgumentException | IllegalStateException e) {
            throw new CatalogRetrievalException("Invalid system catalog: " + e.getMessage(), e);
        }
    }

    @Override
    public List<SystemCatalogEntry> getCatalog(final Set<SimulationKind> kinds, final boolean includeApplication)
        throws CatalogRetrievalException {
        final List<SystemCatalogEntry> catalog = entries.values().stream()
            .filter(SystemCatalogEntry::autoCreate)
            .filter(e -> e.belongsToAny(kinds))
            .filter(e -> includeApplication || e.origin() != SystemOrigin.APPLICATION)
            .collect(Collectors.toList());
        if (catalog.isEmpty()) {
            throw new CatalogRetrievalException("No systems registered for simulation kinds " + kinds);
        }
        return catalog;
    }

    @Override
    public SystemCatalogEntry require(final BuiltinSystem system) throws CatalogRetrievalException {
        final SystemCatalogEntry entry = entries.get(system.id());
        if (entry == null) {
            throw new CatalogRetrievalException("System '" + system.id() + "' is not registered");
        }
        return entry;
    }

    /**
     * Orders systems so that every system follows the systems it declares in {@code after}.
     * Dependencies on systems outside {@code systems} are ignored. Systems without an ordering
     * constraint keep their relative input order.
     * Uses Kahn's algorithm to detect cycles and resolve dependencies.
     *
     * @throws CatalogRetrievalException if a circular dependency is detected.
     */
    @Override
    public List<SystemCatalogEntry> sort(final List<SystemCatalogEntry> systems) throws CatalogRetrievalException {
        final Map<String, SystemCatalogEntry> byId = new LinkedHashMap<>();
        for (final SystemCatalogEntry entry : systems) {
            byId.putIfAbsent(entry.id(), entry);
        }

        // Build adjacency list and in-degree map
        final Map<String, List<String>> dependents = new HashMap<>();
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (final String id : byId.keySet()) {
            dependents.put(id, new ArrayList<>());
            inDegree.put(id, 0);
        }
        for (final SystemCatalogEntry entry : byId.values()) {
            for (final String before : entry.updateAfter()) {
                if (byId.containsKey(before)) {
                    dependents.get(before).add(entry.id());
                    inDegree.merge(entry.id(), 1, Integer::sum);
                }
            }
        }

        // Kahn's algorithm; the queue is seeded in input order to keep the sort stable
        final Queue<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        final List<SystemCatalogEntry> result = new ArrayList<>(byId.size());
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            result.add(byId.get(current));
            for (final String dependent : dependents.get(current)) {
                final int newDegree = inDegree.merge(dependent, -1, Integer::sum);
                if (newDegree == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (result.size() != byId.size()) {
            final List<String> remaining = new ArrayList<>(byId.keySet());
            remaining.removeAll(result.stream().map(SystemCatalogEntry::id).collect(Collectors.toList()));
            throw new CatalogRetrievalException("Circular dependency detected among systems: " + remaining);
        }
        return result;
    }

    public int size() {
        return entries.size();
    }
}
