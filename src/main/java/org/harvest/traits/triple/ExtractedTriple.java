package org.harvest.traits.triple;

import java.time.Instant;

import org.harvest.traits.adapter.NormalizedTriple;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ExtractedTriple {

    private Long id;

    @JsonProperty("sentence_id")
    private Long sentenceId;

    @JsonProperty("source_entity_name")
    private String sourceEntityName;

    @JsonProperty("source_entity_attr")
    private String sourceEntityAttr;

    @JsonProperty("relation_type")
    private String relationType;

    @JsonProperty("sink_entity_name")
    private String sinkEntityName;

    @JsonProperty("sink_entity_attr")
    private String sinkEntityAttr;

    private double confidence;

    @JsonProperty("model_profile")
    private String modelProfile;

    private TripleStatus status = TripleStatus.RAW;

    @JsonProperty("trait_name")
    private String traitName;

    @JsonProperty("trait_value")
    private String traitValue;

    private String unit;

    @JsonProperty("project_id")
    private Long projectId;

    @JsonProperty("document_id")
    private Long documentId;

    @JsonProperty("job_id")
    private Long jobId;

    private String sentence;

    @JsonProperty("doi_hash")
    private String doiHash;

    @JsonProperty("contributor_email")
    private String contributorEmail;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    /**
     * Copies the canonical fields of a normalized triple.
     */
    public static ExtractedTriple from(NormalizedTriple normalized) {
        final ExtractedTriple triple = new ExtractedTriple();
        triple.setSourceEntityName(normalized.sourceEntityName());
        triple.setSourceEntityAttr(normalized.sourceEntityAttr());
        triple.setRelationType(normalized.relationType());
        triple.setSinkEntityName(normalized.sinkEntityName());
        triple.setSinkEntityAttr(normalized.sinkEntityAttr());
        triple.setConfidence(normalized.confidence());
        triple.setTraitName(normalized.traitName());
        triple.setTraitValue(normalized.traitValue());
        triple.setUnit(normalized.unit());
        return triple;
    }

    /**
     * Returns an independent copy of every field.
     */
    public ExtractedTriple copy() {
        final ExtractedTriple copy = new ExtractedTriple();
        copy.setId(id);
        copy.setSentenceId(sentenceId);
        copy.setSourceEntityName(sourceEntityName);
        copy.setSourceEntityAttr(sourceEntityAttr);
        copy.setRelationType(relationType);
        copy.setSinkEntityName(sinkEntityName);
        copy.setSinkEntityAttr(sinkEntityAttr);
        copy.setConfidence(confidence);
        copy.setModelProfile(modelProfile);
        copy.setStatus(status);
        copy.setTraitName(traitName);
        copy.setTraitValue(traitValue);
        copy.setUnit(unit);
        copy.setProjectId(projectId);
        copy.setDocumentId(documentId);
        copy.setJobId(jobId);
        copy.setSentence(sentence);
        copy.setDoiHash(doiHash);
        copy.setContributorEmail(contributorEmail);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
