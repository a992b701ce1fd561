package org.harvest.traits.triple;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Sentence(
    long id,
    String text,
    @JsonProperty("literature_link") String literatureLink,
    @JsonProperty("doi_hash") String doiHash,
    @JsonProperty("created_at") Instant createdAt
) {}
