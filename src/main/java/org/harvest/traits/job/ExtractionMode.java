package org.harvest.traits.job;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExtractionMode {
    NO_TRAINING,
    TRAINING_ASSISTED,
    WARM_START;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExtractionMode fromValue(String value) {
        return Arrays.stream(values())
            .filter(mode -> mode.value().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown extraction mode: " + value));
    }
}
