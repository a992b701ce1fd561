package org.harvest.traits.api;

import java.util.List;

import org.harvest.traits.job.ExtractionMode;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ExtractionJobRequest(
    @JsonProperty("document_ids") @NotNull List<@NotNull Long> documentIds,
    @JsonProperty("model_profile") @NotBlank String modelProfile,
    @JsonProperty("project_id") Long projectId,
    @JsonProperty("mode") ExtractionMode mode,
    @JsonProperty("created_by") String createdBy
) {}
