package org.opencraft.bootstrap.world;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered, append-only record of every world created during this process start.
 * Monitoring collaborators enumerate it; only the orchestrator appends to it.
 */
public final class WorldRegistry {

    private final List<World> worlds = new ArrayList<>();

    /**
     * Appends a world.
     *
     * @param world The newly created world.
     * @throws IllegalStateException if the world is already registered.
     */
    public synchronized void add(final World world) {
        if (worlds.contains(world)) {
            throw new IllegalStateException("World " + world + " is already registered");
        }
        worlds.add(world);
    }

    /**
     * @return A snapshot of all worlds, in creation order.
     */
    public synchronized List<World> getWorlds() {
        return Collections.unmodifiableList(new ArrayList<>(worlds));
    }

    public synchronized List<World> getWorlds(final WorldKind kind) {
        return Collections.unmodifiableList(worlds.stream().filter(w -> w.getKind() == kind).collect(Collectors.toList()));
    }

    public synchronized int size() {
        return worlds.size();
    }

    /**
     * Returns world counts for monitoring, e.g. {@code worlds_total} and {@code worlds_game_client}.
     *
     * @return A map of metric names to their current values.
     */
    public synchronized Map<String, Number> getMetrics() {
        final Map<WorldKind, Integer> perKind = new EnumMap<>(WorldKind.class);
        for (final World world : worlds) {
            perKind.merge(world.getKind(), 1, Integer::sum);
        }
        final Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("worlds_total", worlds.size());
        perKind.forEach((kind, count) -> metrics.put("worlds_" + kind.name().toLowerCase(java.util.Locale.ROOT), count));
        return metrics;
    }
}
