package org.harvest.traits.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class JobStatusTest {

    @Test
    void testForwardTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.RUNNING));
    }

    @Test
    void testRejectedTransitions() {
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED));
        for (JobStatus terminal : new JobStatus[] { JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED }) {
            assertTrue(terminal.isTerminal());
            for (JobStatus next : JobStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
    }

    @Test
    void testWireValues() {
        assertEquals("cancelled", JobStatus.CANCELLED.value());
        assertEquals(JobStatus.RUNNING, JobStatus.fromValue("Running"));
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromValue("paused"));
    }
}
