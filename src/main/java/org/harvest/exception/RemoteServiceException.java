package org.harvest.exception;

/**
 * Raised by the remote extraction client when the peer answers with a non-2xx status.
 */
public class RemoteServiceException extends RuntimeException {

    private final int status;

    public RemoteServiceException(final int status, final String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
