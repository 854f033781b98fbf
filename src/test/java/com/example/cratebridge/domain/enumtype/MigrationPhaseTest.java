package com.example.cratebridge.domain.enumtype;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MigrationPhaseTest {

    @Test
    void percentAtShouldStayInsidePhaseBand() {
        assertEquals(30, MigrationPhase.PROCESSING.percentAt(0, 10));
        assertEquals(50, MigrationPhase.PROCESSING.percentAt(5, 10));
        assertEquals(70, MigrationPhase.PROCESSING.percentAt(10, 10));
        assertEquals(70, MigrationPhase.PROCESSING.percentAt(15, 10));
        assertEquals(30, MigrationPhase.PROCESSING.percentAt(3, 0));
        assertEquals(0, MigrationPhase.CANCELED.percentAt(1, 2));
    }

    @Test
    void onlyDoneAndCanceledAreTerminal() {
        assertTrue(MigrationPhase.DONE.isTerminal());
        assertTrue(MigrationPhase.CANCELED.isTerminal());
        assertFalse(MigrationPhase.WRITING.isTerminal());
    }
}
