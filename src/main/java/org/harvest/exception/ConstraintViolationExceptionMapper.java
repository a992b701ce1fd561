package org.harvest.exception;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class ConstraintViolationExceptionMapper implements ExceptionMapper<ConstraintViolationException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final ConstraintViolationException exception) {
        final String detail = exception.getConstraintViolations().stream()
                .map(ConstraintViolationExceptionMapper::describe)
                .sorted()
                .findFirst()
                .orElse("Validation failed");

        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Bad Request",
            Response.Status.BAD_REQUEST.getStatusCode(),
            detail,
            uriInfo.getPath()
        );

        return Response.status(Response.Status.BAD_REQUEST)
                .entity(error)
                .type("application/problem+json")
                .build();
    }

    private static String describe(final ConstraintViolation<?> violation) {
        final String path = violation.getPropertyPath().toString();
        final int dot = path.lastIndexOf('.');
        final String field = dot >= 0 ? path.substring(dot + 1) : path;
        return field.isEmpty() ? violation.getMessage() : field + " " + violation.getMessage();
    }
}
