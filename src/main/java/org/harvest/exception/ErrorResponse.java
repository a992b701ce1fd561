package org.harvest.exception;

/**
 * Problem details body returned by the exception mappers.
 */
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance
) {}
