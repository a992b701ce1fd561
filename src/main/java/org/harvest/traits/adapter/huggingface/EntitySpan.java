package org.harvest.traits.adapter.huggingface;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EntitySpan(
    @JsonProperty("entity_group") String entityGroup,
    @JsonProperty("word") String word,
    @JsonProperty("score") double score,
    @JsonProperty("start") int start,
    @JsonProperty("end") int end
) {}
