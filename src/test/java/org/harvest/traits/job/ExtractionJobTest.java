package org.harvest.traits.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.stream.LongStream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

class ExtractionJobTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private ExtractionJob pending(int documents) {
        final List<Long> ids = LongStream.rangeClosed(1, documents).boxed().toList();
        return ExtractionJob.pending(1L, 5L, ids, "spacy_bio", ExtractionMode.NO_TRAINING, "curator", NOW);
    }

    @Test
    @DisplayName("new job is pending with total equal to the document count")
    void testPendingJob() {
        final ExtractionJob job = pending(3);

        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(3, job.total());
        assertEquals(0, job.progress());
        assertFalse(job.isFinished());
    }

    @Test
    @DisplayName("job moves through running to completed")
    void testHappyPath() {
        final ExtractionJob done = pending(2)
            .apply(JobUpdate.started(NOW))
            .apply(JobUpdate.progress(1))
            .apply(JobUpdate.progress(2))
            .apply(JobUpdate.completed(2, new JobResults(4), NOW.plusSeconds(5)));

        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(2, done.progress());
        assertEquals(4, done.results().totalTriples());
        assertEquals(NOW, done.startedAt());
        assertEquals(NOW.plusSeconds(5), done.completedAt());
        assertTrue(done.isFinished());
    }

    @Test
    @DisplayName("terminal jobs reject further updates")
    void testTerminalIsFrozen() {
        final ExtractionJob failed = pending(1).apply(JobUpdate.started(NOW)).apply(JobUpdate.failed("boom", NOW));

        assertEquals("boom", failed.errorMessage());
        assertThrows(IllegalStateException.class, () -> failed.apply(JobUpdate.progress(1)));
        assertThrows(IllegalStateException.class, () -> failed.apply(JobUpdate.started(NOW)));
    }

    @Test
    @DisplayName("status cannot skip or move backwards")
    void testInvalidTransitions() {
        final ExtractionJob job = pending(1);

        assertThrows(IllegalStateException.class, () -> job.apply(JobUpdate.completed(0, new JobResults(0), NOW)));
        assertThrows(IllegalStateException.class, () -> job.apply(JobUpdate.failed("x", NOW)));

        final ExtractionJob running = job.apply(JobUpdate.started(NOW));
        assertThrows(IllegalStateException.class, () -> running.apply(JobUpdate.cancelled(NOW)));
    }

    @Test
    @DisplayName("progress is monotonic and bounded by total")
    void testProgressBounds() {
        final ExtractionJob running = pending(2).apply(JobUpdate.started(NOW)).apply(JobUpdate.progress(2));

        assertThrows(IllegalStateException.class, () -> running.apply(JobUpdate.progress(1)));
        assertThrows(IllegalStateException.class, () -> running.apply(JobUpdate.progress(3)));
    }

    @Test
    @DisplayName("pending job can be cancelled")
    void testCancel() {
        final ExtractionJob cancelled = pending(1).apply(JobUpdate.cancelled(NOW));

        assertEquals(JobStatus.CANCELLED, cancelled.status());
        assertEquals(NOW, cancelled.completedAt());
    }

    @Test
    @DisplayName("JSON uses snake_case keys and lowercase enums")
    void testJson() {
        final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

        final JsonNode json = mapper.valueToTree(pending(2));

        assertEquals("pending", json.get("status").asText());
        assertEquals("no_training", json.get("mode").asText());
        assertEquals(2, json.get("document_ids").size());
        assertTrue(json.has("model_profile"));
        assertFalse(json.has("finished"));
    }
}
