package org.harvest.exception;

/**
 * Raised when a model profile or backend tag cannot be resolved.
 * Mapped to HTTP 400 Bad Request.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
