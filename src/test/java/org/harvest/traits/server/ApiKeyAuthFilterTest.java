package org.harvest.traits.server;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Optional;

import org.harvest.traits.server.ApiKeyAuthFilter.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class ApiKeyAuthFilterTest {

    private static final Optional<String> KEY = Optional.of("s3cret");

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "Bearer s3cret", "Basic abc"})
    void testNoConfiguredKeyAllowsEverything(String header) {
        assertEquals(Outcome.ALLOWED, ApiKeyAuthFilter.check(Optional.empty(), header));
        assertEquals(Outcome.ALLOWED, ApiKeyAuthFilter.check(Optional.of("  "), header));
    }

    @Test
    void testMatchingBearerTokenIsAllowed() {
        assertEquals(Outcome.ALLOWED, ApiKeyAuthFilter.check(KEY, "Bearer s3cret"));
        assertEquals(Outcome.ALLOWED, ApiKeyAuthFilter.check(KEY, "bearer s3cret"));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "s3cret", "Basic czNjcmV0", "Bearer ", "Bearer    "})
    void testMissingCredentials(String header) {
        assertEquals(Outcome.MISSING, ApiKeyAuthFilter.check(KEY, header));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Bearer wrong", "Bearer s3cret2", "Bearer S3CRET"})
    void testWrongTokenIsInvalid(String header) {
        assertEquals(Outcome.INVALID, ApiKeyAuthFilter.check(KEY, header));
    }
}
