package org.harvest.traits.job;

import java.time.Instant;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable snapshot of an extraction job.
 *
 * <p>{@link #apply(JobUpdate)} is the only way to derive a new state and
 * enforces the lifecycle rules: forward-only status, terminal states frozen,
 * progress monotonic and bounded by {@code total}.
 */
public record ExtractionJob(
    @JsonProperty("id") long id,
    @JsonProperty("project_id") @Nullable Long projectId,
    @JsonProperty("document_ids") @NotNull List<Long> documentIds,
    @JsonProperty("model_profile") @NotNull String modelProfile,
    @JsonProperty("mode") @NotNull ExtractionMode mode,
    @JsonProperty("status") @NotNull JobStatus status,
    @JsonProperty("progress") int progress,
    @JsonProperty("total") int total,
    @JsonProperty("error_message") @Nullable String errorMessage,
    @JsonProperty("results") @Nullable JobResults results,
    @JsonProperty("created_by") @Nullable String createdBy,
    @JsonProperty("created_at") @NotNull Instant createdAt,
    @JsonProperty("started_at") @Nullable Instant startedAt,
    @JsonProperty("completed_at") @Nullable Instant completedAt
) {

    public ExtractionJob {
        documentIds = List.copyOf(documentIds);
        if (progress < 0 || progress > total) {
            throw new IllegalStateException("Job progress " + progress + " outside [0, " + total + "]");
        }
    }

    /**
     * Builds a new pending job.
     */
    public static ExtractionJob pending(long id, @Nullable Long projectId, List<Long> documentIds,
            String modelProfile, ExtractionMode mode, @Nullable String createdBy, Instant createdAt) {
        return new ExtractionJob(id, projectId, documentIds, modelProfile, mode, JobStatus.PENDING,
            0, documentIds.size(), null, null, createdBy, createdAt, null, null);
    }

    /**
     * Applies a partial update.
     *
     * @param update fields to change
     * @return the updated job
     * @throws IllegalStateException if the update breaks a lifecycle rule
     */
    public ExtractionJob apply(JobUpdate update) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is " + status.value() + " and cannot be updated");
        }

        JobStatus nextStatus = status;
        if (update.status() != null) {
            if (!status.canTransitionTo(update.status())) {
                throw new IllegalStateException(String.format("Job %d cannot move from %s to %s",
                    id, status.value(), update.status().value()));
            }
            nextStatus = update.status();
        }

        int nextProgress = progress;
        if (update.progress() != null) {
            if (update.progress() < progress) {
                throw new IllegalStateException(String.format("Job %d progress cannot decrease from %d to %d",
                    id, progress, update.progress()));
            }
            if (update.progress() > total) {
                throw new IllegalStateException(String.format("Job %d progress %d exceeds total %d",
                    id, update.progress(), total));
            }
            nextProgress = update.progress();
        }

        return new ExtractionJob(
            id,
            projectId,
            documentIds,
            modelProfile,
            mode,
            nextStatus,
            nextProgress,
            total,
            update.errorMessage() != null ? update.errorMessage() : errorMessage,
            update.results() != null ? update.results() : results,
            createdBy,
            createdAt,
            update.startedAt() != null ? update.startedAt() : startedAt,
            update.completedAt() != null ? update.completedAt() : completedAt);
    }

    @JsonIgnore
    public boolean isFinished() {
        return status.isTerminal();
    }
}
