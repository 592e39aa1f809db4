package org.opencraft.bootstrap.world;

import org.opencraft.bootstrap.BootstrapException;
import org.opencraft.config.BuildTarget;

/**
 * Thrown when a world is requested that the current build target cannot host,
 * for example a client world inside a dedicated server build.
 */
public class RoleUnavailableException extends BootstrapException {

    private final WorldKind kind;
    private final BuildTarget buildTarget;

    /**
     * Creates a new RoleUnavailableException.
     *
     * @param kind        the kind of world that was requested.
     * @param buildTarget the build target that rejected it.
     */
    public RoleUnavailableException(final WorldKind kind, final BuildTarget buildTarget) {
        super(String.format("A %s world cannot be created in a %s build", kind, buildTarget));
        this.kind = kind;
        this.buildTarget = buildTarget;
    }

    public WorldKind getKind() {
        return kind;
    }

    public BuildTarget getBuildTarget() {
        return buildTarget;
    }
}
