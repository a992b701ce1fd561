package org.harvest.traits.api;

import org.harvest.traits.job.JobStatus;
import org.harvest.traits.triple.TripleStatus;

/**
 * Parsing of optional lowercase enum query parameters.
 */
final class QueryParams {

    static final String DEFAULT_PAGE = "1";
    static final String DEFAULT_PER_PAGE = "20";

    private QueryParams() {
    }

    static JobStatus jobStatus(String value) {
        return value == null || value.isBlank() ? null : JobStatus.fromValue(value);
    }

    static TripleStatus tripleStatus(String value) {
        return value == null || value.isBlank() ? null : TripleStatus.fromValue(value);
    }
}
