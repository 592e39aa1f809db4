package org.opencraft.bootstrap.world;

import org.opencraft.bootstrap.catalog.SystemCatalogEntry;
import org.opencraft.bootstrap.net.NetworkEndpoint;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to create a world, computed before any world is created so that a failing role
 * leaves nothing half-registered.
 *
 * @param name     World name.
 * @param kind     World role.
 * @param systems  Systems in engine creation order.
 * @param endpoint Endpoint the world binds or dials, or null.
 */
public record WorldSpec(String name, WorldKind kind, List<SystemCatalogEntry> systems, NetworkEndpoint endpoint) {

    public WorldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        systems = List.copyOf(systems);
    }
}
