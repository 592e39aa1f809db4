package org.opencraft.bootstrap.net;

import org.opencraft.bootstrap.BootstrapException;

/**
 * Thrown when a host/port pair cannot be turned into network endpoints.
 * There is no fallback address, so every role depending on the endpoint is lost.
 */
public class AddressParseException extends BootstrapException {

    /**
     * Creates a new AddressParseException with the given message.
     *
     * @param message description of the rejected address.
     */
    public AddressParseException(final String message) {
        super(message);
    }
}
