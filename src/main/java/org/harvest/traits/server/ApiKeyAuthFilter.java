package org.harvest.traits.server;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

import org.harvest.exception.ErrorResponse;
import org.harvest.traits.profile.TraitExtractionConfig;
import org.jboss.logging.Logger;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

/**
 * Bearer API key check for {@link ApiKeyProtected} endpoints.
 *
 * <p>Disabled when {@code trait-extraction.api-key} is unset or blank. Otherwise a
 * request without a bearer token gets 401 and a request with a different token
 * gets 403.
 */
@Provider
@ApiKeyProtected
@Priority(Priorities.AUTHENTICATION)
public class ApiKeyAuthFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(ApiKeyAuthFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    enum Outcome { ALLOWED, MISSING, INVALID }

    @Inject
    TraitExtractionConfig config;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        final Outcome outcome = check(config.apiKey(), requestContext.getHeaderString(HttpHeaders.AUTHORIZATION));
        final String path = requestContext.getUriInfo().getPath();
        switch (outcome) {
            case ALLOWED -> {
                return;
            }
            case MISSING -> {
                LOG.warnf("Rejected unauthenticated request to %s", path);
                requestContext.abortWith(reject(Response.Status.UNAUTHORIZED, "Missing authentication", path)
                    .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                    .build());
            }
            case INVALID -> {
                LOG.warnf("Rejected request to %s with an invalid API key", path);
                requestContext.abortWith(reject(Response.Status.FORBIDDEN, "Invalid API key", path).build());
            }
        }
    }

    static Outcome check(Optional<String> configuredKey, String authorizationHeader) {
        final Optional<String> expected = configuredKey.filter(key -> !key.isBlank());
        if (expected.isEmpty()) {
            return Outcome.ALLOWED;
        }
        if (authorizationHeader == null
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Outcome.MISSING;
        }
        final String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            return Outcome.MISSING;
        }
        final boolean matches = MessageDigest.isEqual(
            token.getBytes(StandardCharsets.UTF_8),
            expected.get().getBytes(StandardCharsets.UTF_8));
        return matches ? Outcome.ALLOWED : Outcome.INVALID;
    }

    private static Response.ResponseBuilder reject(Response.Status status, String detail, String path) {
        return Response.status(status)
            .entity(new ErrorResponse("about:blank", status.getReasonPhrase(), status.getStatusCode(), detail, path))
            .type("application/problem+json");
    }
}
