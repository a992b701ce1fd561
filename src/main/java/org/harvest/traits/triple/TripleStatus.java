package org.harvest.traits.triple;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of an extracted triple.
 */
public enum TripleStatus {
    RAW,
    ACCEPTED,
    REJECTED,
    EDITED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TripleStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown triple status: " + value));
    }
}
