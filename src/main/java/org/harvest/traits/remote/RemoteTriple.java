package org.harvest.traits.remote;

import org.harvest.traits.adapter.NormalizedTriple;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized triple as returned by the peer, with its provenance.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteTriple(
    @JsonProperty("source_entity_name") String sourceEntityName,
    @JsonProperty("source_entity_attr") String sourceEntityAttr,
    @JsonProperty("relation_type") String relationType,
    @JsonProperty("sink_entity_name") String sinkEntityName,
    @JsonProperty("sink_entity_attr") String sinkEntityAttr,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("trait_name") String traitName,
    @JsonProperty("trait_value") String traitValue,
    @JsonProperty("unit") String unit,
    @JsonProperty("document_id") Long documentId,
    @JsonProperty("model_profile") String modelProfile,
    @JsonProperty("job_id") Long jobId,
    @JsonProperty("project_id") Long projectId,
    @JsonProperty("doi") String doi,
    @JsonProperty("sentence") String sentence
) {

    public static RemoteTriple of(NormalizedTriple triple, RemoteDocument document, String modelProfile,
            Long jobId, String sentence) {
        return new RemoteTriple(
            triple.sourceEntityName(),
            triple.sourceEntityAttr(),
            triple.relationType(),
            triple.sinkEntityName(),
            triple.sinkEntityAttr(),
            triple.confidence(),
            triple.traitName(),
            triple.traitValue(),
            triple.unit(),
            document.id(),
            modelProfile,
            jobId,
            asLong(document.metadata().get("project_id")),
            asString(document.metadata().get("doi")),
            sentence);
    }

    public NormalizedTriple normalized() {
        return new NormalizedTriple(sourceEntityName, sourceEntityAttr, relationType, sinkEntityName,
            sinkEntityAttr, confidence, traitName, traitValue, unit);
    }

    private static Long asLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Long.valueOf(text.trim());
        }
        return null;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
