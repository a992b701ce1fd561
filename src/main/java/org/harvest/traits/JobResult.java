package org.harvest.traits;

import org.harvest.traits.job.ExtractionJob;
import org.harvest.traits.job.JobStatus;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome returned to callers of an extraction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResult(
    @JsonProperty("job_id") long jobId,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("total_triples") Integer totalTriples,
    @JsonProperty("error") String error
) {

    public static JobResult of(ExtractionJob job) {
        return new JobResult(
            job.id(),
            job.status(),
            job.results() != null ? job.results().totalTriples() : null,
            job.errorMessage());
    }
}
