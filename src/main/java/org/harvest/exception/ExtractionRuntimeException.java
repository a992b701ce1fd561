package org.harvest.exception;

public class ExtractionRuntimeException extends RuntimeException {

    public ExtractionRuntimeException(final String message) {
        super(message);
    }

    public ExtractionRuntimeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
