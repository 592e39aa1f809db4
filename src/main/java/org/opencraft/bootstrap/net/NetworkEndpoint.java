package org.opencraft.bootstrap.net;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * An address the transport either binds (listen) or dials (connect).
 *
 * @param family The address family.
 * @param host   The IPv4 literal or host name.
 * @param port   The port, in [0, 65535].
 */
public record NetworkEndpoint(NetworkFamily family, String host, int port) {

    /** Wildcard host a listen endpoint binds to. */
    public static final String ANY_IPV4 = "0.0.0.0";

    public NetworkEndpoint {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * @param port The port to bind.
     * @return An endpoint binding every IPv4 interface on {@code port}.
     */
    public static NetworkEndpoint anyIpv4(final int port) {
        return new NetworkEndpoint(NetworkFamily.IPV4, ANY_IPV4, port);
    }

    public boolean isWildcard() {
        return ANY_IPV4.equals(host);
    }

    /**
     * Converts this endpoint for a socket API without resolving the host name.
     *
     * @return An unresolved socket address, or a wildcard address for listen endpoints.
     */
    public InetSocketAddress toSocketAddress() {
        return isWildcard() ? new InetSocketAddress(port) : InetSocketAddress.createUnresolved(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
