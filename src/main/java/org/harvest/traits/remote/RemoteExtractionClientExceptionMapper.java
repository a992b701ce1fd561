package org.harvest.traits.remote;

import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.harvest.exception.RemoteServiceException;
import org.jboss.logging.Logger;

import jakarta.ws.rs.core.Response;

/**
 * Turns non-2xx answers of the peer into RemoteServiceException, keeping the response body.
 */
public class RemoteExtractionClientExceptionMapper implements ResponseExceptionMapper<RemoteServiceException> {

    private static final Logger LOG = Logger.getLogger(RemoteExtractionClientExceptionMapper.class);

    @Override
    public RemoteServiceException toThrowable(Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to read peer error response body", e);
        }

        final int status = response.getStatus();
        final String reason = response.getStatusInfo().getReasonPhrase();
        LOG.errorf("Peer extraction server returned %d %s: %s", status, reason,
            responseBody != null && !responseBody.isEmpty() ? responseBody : "(empty)");

        return new RemoteServiceException(status, String.format("HTTP %d %s%s",
            status, reason, responseBody != null && !responseBody.isEmpty() ? " - " + responseBody : ""));
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
