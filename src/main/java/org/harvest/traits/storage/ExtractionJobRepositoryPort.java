package org.harvest.traits.storage;

import java.util.List;
import java.util.Optional;

import org.harvest.traits.job.ExtractionJob;
import org.harvest.traits.job.ExtractionMode;
import org.harvest.traits.job.JobStatus;
import org.harvest.traits.job.JobUpdate;

/**
 * Port interface for extraction job persistence.
 *
 * <p>Implementations apply updates through {@link ExtractionJob#apply(JobUpdate)},
 * so lifecycle violations surface as {@link IllegalStateException}.
 */
public interface ExtractionJobRepositoryPort {

    /**
     * Creates a pending job with {@code total = documentIds.size()}.
     */
    ExtractionJob create(Long projectId, List<Long> documentIds, String modelProfile,
                         ExtractionMode mode, String createdBy);

    Optional<ExtractionJob> findById(long id);

    /**
     * Applies a partial update.
     *
     * @param id job id
     * @param update fields to change
     * @return the updated job
     * @throws org.harvest.exception.ResourceNotFoundException if the job does not exist
     * @throws IllegalStateException if the update breaks the job lifecycle
     */
    ExtractionJob update(long id, JobUpdate update);

    Page<ExtractionJob> findAll(Long projectId, JobStatus status, int page, int perPage);
}
