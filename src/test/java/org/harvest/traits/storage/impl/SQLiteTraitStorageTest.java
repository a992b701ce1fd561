package org.harvest.traits.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.document.DoiHasher;
import org.harvest.traits.document.TraitDocument;
import org.harvest.traits.job.ExtractionJob;
import org.harvest.traits.job.ExtractionMode;
import org.harvest.traits.job.JobResults;
import org.harvest.traits.job.JobStatus;
import org.harvest.traits.job.JobUpdate;
import org.harvest.traits.storage.Page;
import org.harvest.traits.triple.ExtractedTriple;
import org.harvest.traits.triple.Sentence;
import org.harvest.traits.triple.TripleEdits;
import org.harvest.traits.triple.TripleQuery;
import org.harvest.traits.triple.TripleStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests the SQLite repositories against a migrated database file.
 */
class SQLiteTraitStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteDocumentRepository documents;
    private SQLiteExtractionJobRepository jobs;
    private SQLiteTripleRepository triples;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("traits.db").toString());
        try (Connection conn = connectionManager.open()) {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        }
        documents = new SQLiteDocumentRepository(connectionManager);
        jobs = new SQLiteExtractionJobRepository(connectionManager);
        triples = new SQLiteTripleRepository(connectionManager);
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    private static ExtractedTriple triple(long jobId, long documentId, double confidence, String sentence) {
        final ExtractedTriple triple = new ExtractedTriple();
        triple.setSourceEntityName("FLC");
        triple.setSourceEntityAttr("Gene");
        triple.setRelationType("regulates");
        triple.setSinkEntityName("flowering time");
        triple.setSinkEntityAttr("Trait");
        triple.setConfidence(confidence);
        triple.setModelProfile("spacy_bio");
        triple.setJobId(jobId);
        triple.setDocumentId(documentId);
        triple.setProjectId(7L);
        triple.setSentence(sentence);
        triple.setDoiHash(DoiHasher.hash("10.1000/abc"));
        triple.setContributorEmail("curator@example.org");
        return triple;
    }

    @Nested
    @DisplayName("Documents")
    class Documents {

        @Test
        void testSaveAndFindById() {
            final TraitDocument saved = documents.save(new TraitDocument(7L, "paper.txt", "FLC delays flowering.", "10.1000/abc"));

            assertNotNull(saved.getId());
            final TraitDocument loaded = documents.findById(saved.getId()).orElseThrow();
            assertEquals("FLC delays flowering.", loaded.getTextContent());
            assertEquals(DoiHasher.hash("10.1000/abc"), loaded.getDoiHash());
            assertEquals(TraitDocument.STATUS_PENDING, loaded.getStatus());
        }

        @Test
        void testFindAllFiltersByProject() {
            documents.save(new TraitDocument(1L, "a.txt", "a", null));
            documents.save(new TraitDocument(2L, "b.txt", "b", null));
            documents.save(new TraitDocument(1L, "c.txt", "c", null));

            final Page<TraitDocument> page = documents.findAll(1L, null, 1, 10);

            assertEquals(2, page.total());
            assertEquals("c.txt", page.items().get(0).getFilePath());
        }

        @Test
        void testUpdateStatusOfUnknownDocument() {
            assertThrows(ResourceNotFoundException.class, () -> documents.updateStatus(404L, "processed"));
        }
    }

    @Nested
    @DisplayName("Extraction jobs")
    class Jobs {

        @Test
        void testCreateKeepsDocumentOrder() {
            final ExtractionJob created = jobs.create(7L, List.of(30L, 10L, 20L), "spacy_bio",
                ExtractionMode.NO_TRAINING, "curator@example.org");

            final ExtractionJob loaded = jobs.findById(created.id()).orElseThrow();
            assertEquals(List.of(30L, 10L, 20L), loaded.documentIds());
            assertEquals(JobStatus.PENDING, loaded.status());
            assertEquals(0, loaded.progress());
            assertEquals(3, loaded.total());
            assertNull(loaded.startedAt());
        }

        @Test
        void testLifecycleToCompleted() {
            final long id = jobs.create(null, List.of(1L, 2L), "spacy_bio", ExtractionMode.NO_TRAINING, null).id();

            jobs.update(id, JobUpdate.started(Instant.now()));
            jobs.update(id, JobUpdate.progress(1));
            jobs.update(id, JobUpdate.completed(2, new JobResults(5), Instant.now()));

            final ExtractionJob loaded = jobs.findById(id).orElseThrow();
            assertEquals(JobStatus.COMPLETED, loaded.status());
            assertEquals(2, loaded.progress());
            assertEquals(5, loaded.results().totalTriples());
            assertNotNull(loaded.startedAt());
            assertNotNull(loaded.completedAt());
        }

        @Test
        void testTerminalJobRejectsUpdates() {
            final long id = jobs.create(null, List.of(1L), "spacy_bio", ExtractionMode.NO_TRAINING, null).id();
            jobs.update(id, JobUpdate.cancelled(Instant.now()));

            assertThrows(IllegalStateException.class, () -> jobs.update(id, JobUpdate.started(Instant.now())));
            assertEquals(JobStatus.CANCELLED, jobs.findById(id).orElseThrow().status());
        }

        @Test
        void testProgressCannotExceedTotal() {
            final long id = jobs.create(null, List.of(1L), "spacy_bio", ExtractionMode.NO_TRAINING, null).id();
            jobs.update(id, JobUpdate.started(Instant.now()));

            assertThrows(IllegalStateException.class, () -> jobs.update(id, JobUpdate.progress(2)));
        }

        @Test
        void testUpdateUnknownJob() {
            assertThrows(ResourceNotFoundException.class, () -> jobs.update(99L, JobUpdate.progress(0)));
        }

        @Test
        void testFindAllFiltersByStatus() {
            final long first = jobs.create(1L, List.of(1L), "spacy_bio", ExtractionMode.NO_TRAINING, null).id();
            jobs.create(1L, List.of(2L), "spacy_bio", ExtractionMode.NO_TRAINING, null);
            jobs.update(first, JobUpdate.started(Instant.now()));
            jobs.update(first, JobUpdate.failed("boom", Instant.now()));

            final Page<ExtractionJob> failed = jobs.findAll(1L, JobStatus.FAILED, 1, 10);

            assertEquals(1, failed.total());
            assertEquals("boom", failed.items().get(0).errorMessage());
            assertEquals(2, jobs.findAll(null, null, 1, 10).total());
        }
    }

    @Nested
    @DisplayName("Triples")
    class Triples {

        private long jobId;

        @BeforeEach
        void createJob() {
            jobId = jobs.create(7L, List.of(11L, 12L), "spacy_bio", ExtractionMode.NO_TRAINING, null).id();
        }

        @Test
        void testInsertBatchStoresSentences() {
            final ExtractedTriple inserted = triple(jobId, 11L, 0.9, "FLC regulates flowering time.");

            assertEquals(1, triples.insertBatch(List.of(inserted)));

            assertNotNull(inserted.getId());
            final ExtractedTriple loaded = triples.findById(inserted.getId()).orElseThrow();
            assertEquals(TripleStatus.RAW, loaded.getStatus());
            assertEquals("FLC regulates flowering time.", loaded.getSentence());
            final Sentence sentence = triples.findSentence(loaded.getSentenceId()).orElseThrow();
            assertEquals(DoiHasher.hash("10.1000/abc"), sentence.doiHash());
        }

        @Test
        void testInsertBatchRejectsDocumentOutsideJob() {
            final List<ExtractedTriple> batch = List.of(
                triple(jobId, 11L, 0.9, "ok"),
                triple(jobId, 99L, 0.8, "not in job"));

            assertThrows(IllegalArgumentException.class, () -> triples.insertBatch(batch));
            assertEquals(0, triples.findAll(new TripleQuery(jobId, null, null, null, 0.0, 1, 10)).total());
        }

        @Test
        void testInsertBatchRejectsUnknownJob() {
            assertThrows(IllegalArgumentException.class,
                () -> triples.insertBatch(List.of(triple(jobId + 100, 11L, 0.5, "x"))));
        }

        @Test
        void testFindAllOrdersByConfidenceAndFilters() {
            triples.insertBatch(List.of(
                triple(jobId, 11L, 0.4, "low"),
                triple(jobId, 11L, 0.95, "high"),
                triple(jobId, 12L, 0.7, "mid")));

            final Page<ExtractedTriple> all = triples.findAll(new TripleQuery(jobId, null, null, null, 0.0, 1, 10));
            assertEquals(List.of(0.95, 0.7, 0.4), all.items().stream().map(ExtractedTriple::getConfidence).toList());

            final Page<ExtractedTriple> confident = triples.findAll(new TripleQuery(jobId, 11L, null, null, 0.5, 1, 10));
            assertEquals(1, confident.total());
            assertEquals("high", confident.items().get(0).getSentence());

            final Page<ExtractedTriple> second = triples.findAll(new TripleQuery(jobId, null, null, null, 0.0, 2, 2));
            assertEquals(3, second.total());
            assertEquals(1, second.items().size());
        }

        @Test
        void testUpdateStatusAppliesEdits() {
            final ExtractedTriple inserted = triple(jobId, 11L, 0.9, "s");
            triples.insertBatch(List.of(inserted));

            triples.updateStatus(inserted.getId(), TripleStatus.EDITED,
                new TripleEdits(null, null, "represses", null, null, "flowering time", "late", null));

            final ExtractedTriple loaded = triples.findById(inserted.getId()).orElseThrow();
            assertEquals(TripleStatus.EDITED, loaded.getStatus());
            assertEquals("represses", loaded.getRelationType());
            assertEquals("late", loaded.getTraitValue());
            assertEquals("FLC", loaded.getSourceEntityName());
            assertEquals(1, triples.findAll(new TripleQuery(null, null, null, TripleStatus.EDITED, 0.0, 1, 10)).total());
        }

        @Test
        void testUpdateStatusOfUnknownTriple() {
            assertThrows(ResourceNotFoundException.class,
                () -> triples.updateStatus(404L, TripleStatus.ACCEPTED, TripleEdits.none()));
        }
    }
}
