package org.harvest.traits.storage.impl;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.document.TraitDocument;
import org.harvest.traits.storage.DocumentRepositoryPort;
import org.harvest.traits.storage.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of document storage.
 * Data is not persisted - only exists in memory during runtime.
 */
public class InMemoryDocumentRepository implements DocumentRepositoryPort {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDocumentRepository.class);

    private final ConcurrentHashMap<Long, TraitDocument> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public TraitDocument save(TraitDocument document) {
        final Instant now = Instant.now();
        document.setId(sequence.incrementAndGet());
        document.setCreatedAt(now);
        document.setUpdatedAt(now);
        storage.put(document.getId(), document);
        logger.debug("Stored document {} ({})", document.getId(), document.getFilePath());
        return document;
    }

    @Override
    public Optional<TraitDocument> findById(long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public Page<TraitDocument> findAll(Long projectId, String status, int page, int perPage) {
        final List<TraitDocument> matching = storage.values().stream()
            .filter(doc -> projectId == null || projectId.equals(doc.getProjectId()))
            .filter(doc -> status == null || status.equals(doc.getStatus()))
            .sorted(Comparator.comparing(TraitDocument::getId).reversed())
            .toList();
        return Page.slice(matching, page, perPage);
    }

    @Override
    public void updateStatus(long id, String status) {
        final TraitDocument updated = storage.computeIfPresent(id, (key, doc) -> {
            doc.setStatus(status);
            doc.setUpdatedAt(Instant.now());
            return doc;
        });
        if (updated == null) {
            throw new ResourceNotFoundException("Document not found: " + id);
        }
    }
}
