package org.harvest.traits.storage.impl;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.job.ExtractionJob;
import org.harvest.traits.job.ExtractionMode;
import org.harvest.traits.job.JobStatus;
import org.harvest.traits.job.JobUpdate;
import org.harvest.traits.storage.ExtractionJobRepositoryPort;
import org.harvest.traits.storage.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of extraction job storage.
 * Updates are atomic per job.
 */
public class InMemoryExtractionJobRepository implements ExtractionJobRepositoryPort {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryExtractionJobRepository.class);

    private final ConcurrentHashMap<Long, ExtractionJob> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public ExtractionJob create(Long projectId, List<Long> documentIds, String modelProfile,
            ExtractionMode mode, String createdBy) {
        final ExtractionJob job = ExtractionJob.pending(sequence.incrementAndGet(), projectId,
            documentIds, modelProfile, mode, createdBy, Instant.now());
        storage.put(job.id(), job);
        logger.debug("Created job {} for {} documents", job.id(), documentIds.size());
        return job;
    }

    @Override
    public Optional<ExtractionJob> findById(long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public ExtractionJob update(long id, JobUpdate update) {
        final ExtractionJob updated = storage.computeIfPresent(id, (key, job) -> job.apply(update));
        if (updated == null) {
            throw new ResourceNotFoundException("Extraction job not found: " + id);
        }
        return updated;
    }

    @Override
    public Page<ExtractionJob> findAll(Long projectId, JobStatus status, int page, int perPage) {
        final List<ExtractionJob> matching = storage.values().stream()
            .filter(job -> projectId == null || projectId.equals(job.projectId()))
            .filter(job -> status == null || status == job.status())
            .sorted(Comparator.comparing(ExtractionJob::createdAt)
                .thenComparing(ExtractionJob::id)
                .reversed())
            .toList();
        return Page.slice(matching, page, perPage);
    }
}
