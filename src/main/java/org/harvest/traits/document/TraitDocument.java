package org.harvest.traits.document;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Source document for extraction. The extraction core only reads it.
 */
@Getter
@Setter
@NoArgsConstructor
public class TraitDocument {

    public static final String STATUS_PENDING = "pending";

    private Long id;

    @JsonProperty("project_id")
    private Long projectId;

    @JsonProperty("file_path")
    private String filePath;

    @JsonProperty("text_content")
    private String textContent;

    private String doi;

    @JsonProperty("doi_hash")
    private String doiHash;

    private String status = STATUS_PENDING;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public TraitDocument(Long projectId, String filePath, String textContent, String doi) {
        this.projectId = projectId;
        this.filePath = filePath;
        this.textContent = textContent;
        this.doi = doi;
        this.doiHash = DoiHasher.hash(doi);
    }

    public boolean hasText() {
        return textContent != null && !textContent.isBlank();
    }
}
