package org.harvest.traits.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

public record TraitDocumentRequest(
    @JsonProperty("project_id") Long projectId,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("text_content") @NotBlank String textContent,
    @JsonProperty("doi") String doi
) {}
