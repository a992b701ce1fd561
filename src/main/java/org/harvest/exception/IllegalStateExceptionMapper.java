package org.harvest.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class IllegalStateExceptionMapper implements ExceptionMapper<IllegalStateException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final IllegalStateException exception) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Conflict",
            Response.Status.CONFLICT.getStatusCode(),
            exception.getMessage(),
            uriInfo.getPath()
        );

        return Response.status(Response.Status.CONFLICT)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
