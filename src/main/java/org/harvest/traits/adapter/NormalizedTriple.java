package org.harvest.traits.adapter;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Triple expressed in the canonical vocabulary. Serializes to exactly the
 * canonical triple keys.
 */
public record NormalizedTriple(
    @JsonProperty("source_entity_name") String sourceEntityName,
    @JsonProperty("source_entity_attr") String sourceEntityAttr,
    @JsonProperty("relation_type") String relationType,
    @JsonProperty("sink_entity_name") String sinkEntityName,
    @JsonProperty("sink_entity_attr") String sinkEntityAttr,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("trait_name") String traitName,
    @JsonProperty("trait_value") String traitValue,
    @JsonProperty("unit") String unit
) {}
