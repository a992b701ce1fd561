package org.harvest.traits.triple;

import org.jetbrains.annotations.Nullable;

/**
 * Filters for listing triples. Results are ordered by confidence, highest first.
 */
public record TripleQuery(
    @Nullable Long jobId,
    @Nullable Long documentId,
    @Nullable Long projectId,
    @Nullable TripleStatus status,
    double minConfidence,
    int page,
    int perPage
) {

    public TripleQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (perPage < 1) {
            throw new IllegalArgumentException("perPage must be >= 1");
        }
    }

    public int offset() {
        return (page - 1) * perPage;
    }
}
