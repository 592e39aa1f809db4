package org.opencraft.bootstrap.catalog;

import org.opencraft.bootstrap.BootstrapException;

/**
 * Thrown when the engine cannot produce a system catalog for a world.
 * A world cannot run without systems, so this is fatal to the whole bootstrap attempt.
 */
public class CatalogRetrievalException extends BootstrapException {

    public CatalogRetrievalException(final String message) {
        super(message);
    }

    public CatalogRetrievalException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
