package org.harvest.traits.storage;

import java.util.List;
import java.util.Optional;

import org.harvest.traits.triple.ExtractedTriple;
import org.harvest.traits.triple.Sentence;
import org.harvest.traits.triple.TripleEdits;
import org.harvest.traits.triple.TripleQuery;
import org.harvest.traits.triple.TripleStatus;

/**
 * Port interface for extracted triple persistence.
 */
public interface TripleRepositoryPort {

    /**
     * Inserts all triples atomically. A sentence row is created for every triple
     * that carries sentence text but no sentence id.
     *
     * <p>Every triple must reference an existing job, and its document, when set,
     * must belong to that job. Otherwise nothing is inserted.
     *
     * @param triples triples to insert; ids, sentence ids and timestamps are assigned in place
     * @return number of inserted triples
     * @throws IllegalArgumentException if a triple violates a reference rule
     */
    int insertBatch(List<ExtractedTriple> triples);

    Optional<ExtractedTriple> findById(long id);

    Page<ExtractedTriple> findAll(TripleQuery query);

    Optional<Sentence> findSentence(long sentenceId);

    /**
     * Records a review decision, optionally correcting the triple.
     *
     * @throws org.harvest.exception.ResourceNotFoundException if the triple does not exist
     */
    ExtractedTriple updateStatus(long id, TripleStatus status, TripleEdits edits);
}
