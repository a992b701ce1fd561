package org.harvest.traits.job;

import java.time.Instant;

import org.jetbrains.annotations.Nullable;

/**
 * Partial update of a job. Null fields are left unchanged.
 */
public record JobUpdate(
    @Nullable JobStatus status,
    @Nullable Integer progress,
    @Nullable String errorMessage,
    @Nullable JobResults results,
    @Nullable Instant startedAt,
    @Nullable Instant completedAt
) {

    public static JobUpdate started(Instant now) {
        return new JobUpdate(JobStatus.RUNNING, null, null, null, now, null);
    }

    public static JobUpdate progress(int progress) {
        return new JobUpdate(null, progress, null, null, null, null);
    }

    public static JobUpdate completed(int progress, JobResults results, Instant now) {
        return new JobUpdate(JobStatus.COMPLETED, progress, null, results, null, now);
    }

    public static JobUpdate failed(String errorMessage, Instant now) {
        return new JobUpdate(JobStatus.FAILED, null, errorMessage, null, null, now);
    }

    public static JobUpdate cancelled(Instant now) {
        return new JobUpdate(JobStatus.CANCELLED, null, null, null, null, now);
    }
}
