package org.opencraft.config;

/**
 * The host environment the binary was built for. A dedicated server build cannot host client
 * worlds and a client-only build cannot host server worlds.
 */
public enum BuildTarget {
    ALL,
    CLIENT,
    SERVER;

    public boolean supportsClientWorlds() {
        return this != SERVER;
    }

    public boolean supportsServerWorlds() {
        return this != CLIENT;
    }

    /**
     * Parses a build target, ignoring case.
     *
     * @param value the textual build target.
     * @return the matching build target.
     * @throws IllegalArgumentException if the value names no build target.
     */
    public static BuildTarget parse(final String value) {
        if (value != null) {
            for (final BuildTarget target : values()) {
                if (target.name().equalsIgnoreCase(value.trim())) {
                    return target;
                }
            }
        }
        throw new IllegalArgumentException("Unknown build target: '" + value + "'");
    }
}
