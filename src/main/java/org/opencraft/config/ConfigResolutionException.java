package org.opencraft.config;

import org.opencraft.bootstrap.BootstrapException;

/**
 * Thrown when the layered configuration cannot be turned into a {@link ResolvedConfig}.
 * Always fatal: no world is created and the process exits with a non-zero status.
 */
public class ConfigResolutionException extends BootstrapException {

    public ConfigResolutionException(final String message) {
        super(message);
    }

    public ConfigResolutionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
