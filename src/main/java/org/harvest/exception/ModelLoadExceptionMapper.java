package org.harvest.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps ModelLoadException to HTTP 503 Service Unavailable responses.
 */
@Provider
public class ModelLoadExceptionMapper implements ExceptionMapper<ModelLoadException> {

    @Override
    public Response toResponse(ModelLoadException exception) {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(new ErrorResponse(
                        "about:blank",
                        "Model Unavailable",
                        Response.Status.SERVICE_UNAVAILABLE.getStatusCode(),
                        exception.getMessage(),
                        null
                ))
                .type("application/problem+json")
                .build();
    }
}
