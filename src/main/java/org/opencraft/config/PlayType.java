package org.opencraft.config;

import java.util.Locale;
import java.util.Map;

/**
 * Selects which game worlds a process hosts when it is configured locally.
 */
public enum PlayType {

    /**
     * Client and server worlds in the same process, so the application can host and play at the same time.
     */
    CLIENT_AND_SERVER,

    /**
     * Only a client world, which connects to a remote server.
     */
    CLIENT,

    /**
     * Only a server world, which listens for incoming connections.
     */
    SERVER,

    /**
     * A client that receives its frames from a streaming host instead of simulating locally.
     */
    STREAMED_CLIENT,

    /**
     * Headless clients for player emulation. No presentation systems run.
     */
    THIN_CLIENT;

    private static final Map<String, PlayType> ALIASES = Map.ofEntries(
        Map.entry("clientandserver", CLIENT_AND_SERVER),
        Map.entry("serverandclient", CLIENT_AND_SERVER),
        Map.entry("clientserver", CLIENT_AND_SERVER),
        Map.entry("serverclient", CLIENT_AND_SERVER),
        Map.entry("client", CLIENT),
        Map.entry("server", SERVER),
        Map.entry("streamedclient", STREAMED_CLIENT),
        Map.entry("streamclient", STREAMED_CLIENT),
        Map.entry("guestclient", STREAMED_CLIENT),
        Map.entry("thinclient", THIN_CLIENT)
    );

    /**
     * Parses a play type, accepting the enum name as well as the historical aliases
     * ({@code ServerAndClient}, {@code GuestClient}, ...). Case, dashes and underscores are ignored.
     *
     * @param value the textual play type.
     * @return the matching play type.
     * @throws IllegalArgumentException if the value names no play type.
     */
    public static PlayType parse(final String value) {
        final PlayType type = value == null ? null : ALIASES.get(normalize(value));
        if (type == null) {
            throw new IllegalArgumentException("Unknown play type: '" + value + "'");
        }
        return type;
    }

    /**
     * @return true if this play type creates a (regular or streamed) client world.
     */
    public boolean includesClient() {
        return this == CLIENT || this == CLIENT_AND_SERVER || this == STREAMED_CLIENT;
    }

    /**
     * @return true if this play type creates a server world.
     */
    public boolean includesServer() {
        return this == SERVER || this == CLIENT_AND_SERVER;
    }

    static String normalize(final String value) {
        return value.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }
}
