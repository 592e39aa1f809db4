package org.opencraft.bootstrap;

/**
 * Base type of every failure that can abort a bootstrap attempt.
 * <p>
 * Subclasses name the stage that failed so the command line can report the cause before exiting.
 */
public class BootstrapException extends Exception {

    /**
     * Constructs a new bootstrap exception with the specified detail message.
     * @param message The detail message.
     */
    public BootstrapException(final String message) {
        super(message);
    }

    /**
     * Constructs a new bootstrap exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public BootstrapException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
