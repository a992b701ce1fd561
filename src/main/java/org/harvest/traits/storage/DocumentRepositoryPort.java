package org.harvest.traits.storage;

import java.util.Optional;

import org.harvest.traits.document.TraitDocument;

/**
 * Port interface for trait document persistence.
 */
public interface DocumentRepositoryPort {

    /**
     * Inserts a document and assigns its id and timestamps.
     *
     * @param document document to store
     * @return the stored document
     */
    TraitDocument save(TraitDocument document);

    Optional<TraitDocument> findById(long id);

    Page<TraitDocument> findAll(Long projectId, String status, int page, int perPage);

    void updateStatus(long id, String status);
}
