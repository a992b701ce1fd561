package org.harvest.traits.api;

import org.harvest.traits.triple.TripleEdits;
import org.harvest.traits.triple.TripleStatus;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;

/**
 * Review decision for a triple. {@code edits} is only meaningful with status {@code edited}.
 */
public record TripleReviewRequest(
    @JsonProperty("status") @NotNull TripleStatus status,
    @JsonProperty("edits") TripleEdits edits
) {}
