package com.example.cratebridge.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.domain.enumtype.MigrationPhase;
import org.junit.jupiter.api.Test;

class MigrationJobTest {

    @Test
    void phasesShouldAdvanceInOrder() {
        MigrationJob job = new MigrationJob("job-1");

        job.transitionTo(MigrationPhase.READING);
        job.transitionTo(MigrationPhase.PROCESSING);
        job.transitionTo(MigrationPhase.WRITING);
        job.transitionTo(MigrationPhase.DONE);

        assertEquals(MigrationPhase.DONE, job.getPhase());
    }

    @Test
    void skippingAPhaseShouldFail() {
        MigrationJob job = new MigrationJob("job-2");
        job.transitionTo(MigrationPhase.READING);

        LibraryException error = assertThrows(LibraryException.class,
                () -> job.transitionTo(MigrationPhase.WRITING));

        assertEquals(LibraryException.INVALID_STATE, error.getCode());
        assertEquals(MigrationPhase.READING, job.getPhase());
    }

    @Test
    void terminalPhasesShouldAcceptNothing() {
        assertTrue(MigrationJob.canTransition(MigrationPhase.PROCESSING, MigrationPhase.CANCELED));
        assertFalse(MigrationJob.canTransition(MigrationPhase.CANCELED, MigrationPhase.READING));
        assertFalse(MigrationJob.canTransition(MigrationPhase.DONE, MigrationPhase.CANCELED));
    }
}
