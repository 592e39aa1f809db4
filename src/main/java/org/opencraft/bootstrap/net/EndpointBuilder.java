package org.opencraft.bootstrap.net;

import java.util.regex.Pattern;

/**
 * Derives the listen/connect endpoint pair of a service from its configured host and port.
 * <p>
 * Validation is purely syntactic. Host names are never resolved here; the transport resolves them
 * when it dials, so building endpoints performs no network I/O.
 */
public final class EndpointBuilder {

    private static final int MAX_PORT = 0xFFFF;
    private static final int MAX_HOST_NAME_LENGTH = 253;
    private static final Pattern HOST_LABEL = Pattern.compile("[A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?");
    private static final Pattern NUMERIC_LABEL = Pattern.compile("[0-9]+");

    private EndpointBuilder() {
    }

    /**
     * Builds the endpoint pair of a service.
     *
     * @param host IPv4 literal or host name clients dial.
     * @param port Port shared by both endpoints.
     * @return {@code 0.0.0.0:port} to listen on and {@code host:port} to connect to.
     * @throws AddressParseException if the host is not a valid IPv4 literal or host name, or the port is out of range.
     */
    public static EndpointPair build(final String host, final int port) throws AddressParseException {
        if (port < 0 || port > MAX_PORT) {
            throw new AddressParseException("Port " + port + " is outside [0, " + MAX_PORT + "]");
        }
        final String normalized = parseHost(host);
        return new EndpointPair(
            NetworkEndpoint.anyIpv4(port),
            new NetworkEndpoint(NetworkFamily.IPV4, normalized, port));
    }

    /**
     * Validates a host string.
     *
     * @param host The host to check.
     * @return The trimmed host, without the trailing dot of a fully qualified name.
     * @throws AddressParseException if the host cannot be parsed.
     */
    static String parseHost(final String host) throws AddressParseException {
        if (host == null || host.isBlank()) {
            throw new AddressParseException("Host must not be empty");
        }
        String trimmed = host.trim();
        // Fully qualified names may end with the root label
        if (trimmed.length() > 1 && trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.length() > MAX_HOST_NAME_LENGTH) {
            throw new AddressParseException("Host name too long: '" + trimmed + "'");
        }

        final String[] labels = trimmed.split("\\.", -1);
        boolean allNumeric = true;
        for (final String label : labels) {
            if (!HOST_LABEL.matcher(label).matches()) {
                throw new AddressParseException("Cannot parse host '" + trimmed + "'");
            }
            allNumeric &= NUMERIC_LABEL.matcher(label).matches();
        }

        // A purely numeric host must be a dotted-quad IPv4 address
        if (allNumeric && !isIpv4Literal(labels)) {
            throw new AddressParseException("Invalid IPv4 address '" + trimmed + "'");
        }
        return trimmed;
    }

    private static boolean isIpv4Literal(final String[] octets) {
        if (octets.length != 4) {
            return false;
        }
        for (final String octet : octets) {
            if (octet.length() > 3 || (octet.length() > 1 && octet.charAt(0) == '0')) {
                return false;
            }
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }
}
