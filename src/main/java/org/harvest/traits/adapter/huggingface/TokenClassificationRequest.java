package org.harvest.traits.adapter.huggingface;

import java.util.Map;

public record TokenClassificationRequest(String inputs, Map<String, Object> parameters) {

    public static TokenClassificationRequest aggregated(String text) {
        return new TokenClassificationRequest(text, Map.of("aggregation_strategy", "simple"));
    }
}
