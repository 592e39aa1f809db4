package org.opencraft.config;

import java.util.Locale;

/**
 * Role of a client in multiplay streaming. A host simulates and renders locally,
 * a guest only displays what a host streams to it.
 */
public enum StreamingRole {
    HOST,
    GUEST;

    /**
     * Parses a streaming role, ignoring case.
     *
     * @param value the textual role.
     * @return the matching role.
     * @throws IllegalArgumentException if the value names no role.
     */
    public static StreamingRole parse(final String value) {
        if (value != null) {
            final String normalized = PlayType.normalize(value);
            for (final StreamingRole role : values()) {
                if (role.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown streaming role: '" + value + "'");
    }
}
