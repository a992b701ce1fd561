package org.harvest.traits.remote;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

public record UnloadModelRequest(@JsonProperty("model_profile") @NotBlank String modelProfile) {}
