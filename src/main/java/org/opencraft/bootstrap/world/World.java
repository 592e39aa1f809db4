package org.opencraft.bootstrap.world;

import org.opencraft.bootstrap.catalog.BuiltinSystem;
import org.opencraft.bootstrap.catalog.SystemCatalogEntry;
import org.opencraft.bootstrap.net.NetworkEndpoint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * An isolated execution context. Its system list is fixed at construction, so the engine may tick
 * it from any thread once it is registered.
 */
public final class World {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final String name;
    private final WorldKind kind;
    private final List<SystemCatalogEntry> systems;
    private final NetworkEndpoint endpoint;
    private final AtomicLong ticks = new AtomicLong();

    /**
     * @param name     Display name; not required to be unique.
     * @param kind     Role of the world.
     * @param systems  Systems in engine creation order.
     * @param endpoint Endpoint the world's transport binds or dials, or null if it has none.
     */
    public World(final String name, final WorldKind kind, final List<SystemCatalogEntry> systems,
                 final NetworkEndpoint endpoint) {
        this.id = NEXT_ID.getAndIncrement();
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.systems = List.copyOf(systems);
        this.endpoint = endpoint;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public WorldKind getKind() {
        return kind;
    }

    public List<SystemCatalogEntry> getSystems() {
        return systems;
    }

    public List<String> getSystemIds() {
        return systems.stream().map(SystemCatalogEntry::id).collect(Collectors.toList());
    }

    public boolean hasSystem(final BuiltinSystem system) {
        return systems.stream().anyMatch(s -> s.is(system));
    }

    public Optional<NetworkEndpoint> getEndpoint() {
        return Optional.ofNullable(endpoint);
    }

    /**
     * Advances the world by one frame. Called by the execution loop only.
     *
     * @return The number of frames this world has run.
     */
    public long tick() {
        return ticks.incrementAndGet();
    }

    public long getTickCount() {
        return ticks.get();
    }

    @Override
    public String toString() {
        return name + "#" + id + "[" + kind + "]";
    }
}
