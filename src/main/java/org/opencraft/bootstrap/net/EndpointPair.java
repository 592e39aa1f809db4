package org.opencraft.bootstrap.net;

/**
 * The two endpoints of one logical service: the wildcard address a server binds and the address
 * clients dial. Both always carry the same port.
 *
 * @param listen  The endpoint a server-side world binds.
 * @param connect The endpoint a client-side world dials.
 */
public record EndpointPair(NetworkEndpoint listen, NetworkEndpoint connect) {

    public EndpointPair {
        if (listen.port() != connect.port()) {
            throw new IllegalArgumentException(
                "listen and connect endpoints must share a port, got " + listen + " and " + connect);
        }
    }

    public int port() {
        return connect.port();
    }
}
