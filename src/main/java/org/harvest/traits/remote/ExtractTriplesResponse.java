package org.harvest.traits.remote;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractTriplesResponse(
    @JsonProperty("job_id") Long jobId,
    @JsonProperty("status") String status,
    @JsonProperty("total_documents") int totalDocuments,
    @JsonProperty("total_triples") int totalTriples,
    @JsonProperty("triples") List<RemoteTriple> triples
) {

    public ExtractTriplesResponse {
        triples = triples == null ? List.of() : triples;
    }
}
