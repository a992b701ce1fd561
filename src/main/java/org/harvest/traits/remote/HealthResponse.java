package org.harvest.traits.remote;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("loaded_adapters") List<String> loadedAdapters
) {}
