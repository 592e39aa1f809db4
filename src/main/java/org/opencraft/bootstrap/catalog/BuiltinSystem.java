package org.opencraft.bootstrap.catalog;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Systems the bootstrap refers to by stable identifier. Catalog entries are matched against these
 * identifiers when they are registered, never by their display name.
 */
public enum BuiltinSystem {

    CONFIGURE_CLIENT_WORLD("netcode.configure-client-world"),
    CONFIGURE_THIN_CLIENT_WORLD("netcode.configure-thin-client-world"),
    CONFIGURE_SERVER_WORLD("netcode.configure-server-world"),
    SCENE_SYSTEM("entities.scene-system"),
    AUTO_CONNECT("opencraft.auto-connect"),
    DEPLOYMENT_RECEIVE("opencraft.deployment-receive"),
    DEPLOYMENT_SERVICE("opencraft.deployment-service"),
    CONNECTION_MONITOR("opencraft.connection-monitor"),
    AUTHORING_SCENE_LOADER("opencraft.authoring-scene-loader"),
    MULTIPLAY_INIT("opencraft.multiplay-init"),
    EMULATION_INIT("opencraft.emulation-init");

    /**
     * Generic network role configuration shipped with the engine. The bootstrap wires every role
     * explicitly, so these must never run in a world it creates.
     */
    public static final Set<BuiltinSystem> GENERIC_ROLE_CONFIGURATION = Collections.unmodifiableSet(EnumSet.of(
        CONFIGURE_CLIENT_WORLD, CONFIGURE_THIN_CLIENT_WORLD, CONFIGURE_SERVER_WORLD));

    private final String id;

    BuiltinSystem(final String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @param id A catalog identifier.
     * @return The builtin system with this identifier, if any.
     */
    public static Optional<BuiltinSystem> fromId(final String id) {
        for (final BuiltinSystem system : values()) {
            if (system.id.equals(id)) {
                return Optional.of(system);
            }
        }
        return Optional.empty();
    }
}
