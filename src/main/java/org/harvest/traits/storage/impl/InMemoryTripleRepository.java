package org.harvest.traits.storage.impl;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.job.ExtractionJob;
import org.harvest.traits.storage.ExtractionJobRepositoryPort;
import org.harvest.traits.storage.Page;
import org.harvest.traits.storage.TripleRepositoryPort;
import org.harvest.traits.triple.ExtractedTriple;
import org.harvest.traits.triple.Sentence;
import org.harvest.traits.triple.TripleEdits;
import org.harvest.traits.triple.TripleQuery;
import org.harvest.traits.triple.TripleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of triple storage.
 *
 * <p>Job references are checked against the job repository the instance was built with.
 * Stored rows are copies; callers never hold a reference to them.
 */
public class InMemoryTripleRepository implements TripleRepositoryPort {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTripleRepository.class);

    private final ExtractionJobRepositoryPort jobRepository;
    private final ConcurrentHashMap<Long, ExtractedTriple> triples = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Sentence> sentences = new ConcurrentHashMap<>();
    private final AtomicLong tripleSequence = new AtomicLong();
    private final AtomicLong sentenceSequence = new AtomicLong();

    public InMemoryTripleRepository(ExtractionJobRepositoryPort jobRepository) {
        this.jobRepository = jobRepository;
    }

    @Override
    public synchronized int insertBatch(List<ExtractedTriple> batch) {
        for (ExtractedTriple triple : batch) {
            validateReferences(triple);
        }

        final Instant now = Instant.now();
        for (ExtractedTriple triple : batch) {
            if (triple.getSentenceId() == null && triple.getSentence() != null) {
                final Sentence sentence = new Sentence(sentenceSequence.incrementAndGet(),
                    triple.getSentence(), null, triple.getDoiHash(), now);
                sentences.put(sentence.id(), sentence);
                triple.setSentenceId(sentence.id());
            }
            triple.setId(tripleSequence.incrementAndGet());
            if (triple.getStatus() == null) {
                triple.setStatus(TripleStatus.RAW);
            }
            triple.setCreatedAt(now);
            triple.setUpdatedAt(now);
            triples.put(triple.getId(), triple.copy());
        }
        logger.debug("Inserted {} triples", batch.size());
        return batch.size();
    }

    private void validateReferences(ExtractedTriple triple) {
        if (triple.getConfidence() < 0.0 || triple.getConfidence() > 1.0) {
            throw new IllegalArgumentException("Triple confidence outside [0, 1]: " + triple.getConfidence());
        }
        if (triple.getJobId() == null) {
            return;
        }
        final ExtractionJob job = jobRepository.findById(triple.getJobId())
            .orElseThrow(() -> new IllegalArgumentException("Triple references unknown job " + triple.getJobId()));
        if (triple.getDocumentId() != null && !job.documentIds().contains(triple.getDocumentId())) {
            throw new IllegalArgumentException(String.format(
                "Document %d is not part of job %d", triple.getDocumentId(), job.id()));
        }
    }

    @Override
    public Optional<ExtractedTriple> findById(long id) {
        return Optional.ofNullable(triples.get(id)).map(ExtractedTriple::copy);
    }

    @Override
    public Page<ExtractedTriple> findAll(TripleQuery query) {
        final List<ExtractedTriple> matching = triples.values().stream()
            .filter(t -> query.jobId() == null || query.jobId().equals(t.getJobId()))
            .filter(t -> query.documentId() == null || query.documentId().equals(t.getDocumentId()))
            .filter(t -> query.projectId() == null || query.projectId().equals(t.getProjectId()))
            .filter(t -> query.status() == null || query.status() == t.getStatus())
            .filter(t -> t.getConfidence() >= query.minConfidence())
            .sorted(Comparator.comparingDouble(ExtractedTriple::getConfidence).reversed()
                .thenComparing(ExtractedTriple::getId))
            .map(ExtractedTriple::copy)
            .toList();
        return Page.slice(matching, query.page(), query.perPage());
    }

    @Override
    public Optional<Sentence> findSentence(long sentenceId) {
        return Optional.ofNullable(sentences.get(sentenceId));
    }

    @Override
    public synchronized ExtractedTriple updateStatus(long id, TripleStatus status, TripleEdits edits) {
        final ExtractedTriple stored = triples.get(id);
        if (stored == null) {
            throw new ResourceNotFoundException("Triple not found: " + id);
        }
        final ExtractedTriple updated = stored.copy();
        edits.applyTo(updated);
        updated.setStatus(status);
        updated.setUpdatedAt(Instant.now());
        triples.put(id, updated);
        return updated.copy();
    }
}
