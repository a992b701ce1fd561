package org.harvest.traits.remote;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ExtractTriplesRequest(
    @JsonProperty("documents") @NotNull @Valid List<RemoteDocument> documents,
    @JsonProperty("model_profile") @NotBlank String modelProfile,
    @JsonProperty("job_id") Long jobId
) {}
