package org.harvest.exception;

/**
 * Raised when a backend runtime or model artifact is not available.
 */
public class ModelLoadException extends RuntimeException {

    public ModelLoadException(final String message) {
        super(message);
    }

    public ModelLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
