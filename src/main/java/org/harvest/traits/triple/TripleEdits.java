package org.harvest.traits.triple;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reviewer corrections applied together with a status change. Null fields are left unchanged.
 */
public record TripleEdits(
    @JsonProperty("source_entity_name") @Nullable String sourceEntityName,
    @JsonProperty("source_entity_attr") @Nullable String sourceEntityAttr,
    @JsonProperty("relation_type") @Nullable String relationType,
    @JsonProperty("sink_entity_name") @Nullable String sinkEntityName,
    @JsonProperty("sink_entity_attr") @Nullable String sinkEntityAttr,
    @JsonProperty("trait_name") @Nullable String traitName,
    @JsonProperty("trait_value") @Nullable String traitValue,
    @JsonProperty("unit") @Nullable String unit
) {

    public static TripleEdits none() {
        return new TripleEdits(null, null, null, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return sourceEntityName == null && sourceEntityAttr == null && relationType == null
            && sinkEntityName == null && sinkEntityAttr == null
            && traitName == null && traitValue == null && unit == null;
    }

    public void applyTo(ExtractedTriple triple) {
        if (sourceEntityName != null) {
            triple.setSourceEntityName(sourceEntityName);
        }
        if (sourceEntityAttr != null) {
            triple.setSourceEntityAttr(sourceEntityAttr);
        }
        if (relationType != null) {
            triple.setRelationType(relationType);
        }
        if (sinkEntityName != null) {
            triple.setSinkEntityName(sinkEntityName);
        }
        if (sinkEntityAttr != null) {
            triple.setSinkEntityAttr(sinkEntityAttr);
        }
        if (traitName != null) {
            triple.setTraitName(traitName);
        }
        if (traitValue != null) {
            triple.setTraitValue(traitValue);
        }
        if (unit != null) {
            triple.setUnit(unit);
        }
    }
}
