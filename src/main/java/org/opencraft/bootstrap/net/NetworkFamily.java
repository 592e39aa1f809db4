package org.opencraft.bootstrap.net;

/**
 * Address family of a {@link NetworkEndpoint}. Only IPv4 is used by the game and deployment transports.
 */
public enum NetworkFamily {
    IPV4
}
