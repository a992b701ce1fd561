package org.harvest.traits.remote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Map;

import org.harvest.traits.adapter.NormalizedTriple;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class RemoteTripleTest {

    private static final NormalizedTriple TRIPLE = new NormalizedTriple(
        "FLC", "Gene", "regulates", "flowering time", "Trait", 0.8, null, null, null);

    @Test
    void testMetadataIsCopiedFromDocument() {
        final RemoteDocument document = new RemoteDocument(5L, "text", Map.of("project_id", "12", "doi", "10.1/x"));

        final RemoteTriple triple = RemoteTriple.of(TRIPLE, document, "spacy_bio", 9L, "text");

        assertEquals(12L, triple.projectId());
        assertEquals("10.1/x", triple.doi());
        assertEquals(5L, triple.documentId());
        assertEquals(TRIPLE, triple.normalized());
    }

    @Test
    void testMissingMetadata() {
        final RemoteTriple triple = RemoteTriple.of(TRIPLE, new RemoteDocument(5L, "text", null), "spacy_bio", null, "");

        assertNull(triple.projectId());
        assertNull(triple.doi());
        assertNull(triple.jobId());
    }

    @Test
    void testResponseIgnoresUnknownFields() throws Exception {
        final ExtractTriplesResponse response = new ObjectMapper().readValue("""
            {"job_id": 3, "status": "completed", "total_documents": 1, "total_triples": 1, "extra": true,
             "triples": [{"source_entity_name": "FLC", "relation_type": "regulates", "sink_entity_name": "yield",
                          "confidence": 0.6, "document_id": 8, "sentence": "s", "score_detail": {}}]}
            """, ExtractTriplesResponse.class);

        assertEquals(3L, response.jobId());
        assertEquals(8L, response.triples().get(0).documentId());
        assertEquals(0.6, response.triples().get(0).confidence());
    }
}
