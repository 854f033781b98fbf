package com.example.cratebridge.application.service;

import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.domain.enumtype.MigrationPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase state machine of one migration: PENDING, READING, PROCESSING, WRITING, DONE, with CANCELED reachable from
 * every non-terminal phase.
 */
public class MigrationJob {

    private static final Logger log = LoggerFactory.getLogger(MigrationJob.class);

    private final String jobId;
    private MigrationPhase phase = MigrationPhase.PENDING;

    public MigrationJob(String jobId) {
        this.jobId = jobId;
    }

    public synchronized void transitionTo(MigrationPhase next) {
        if (!canTransition(phase, next)) {
            throw new LibraryException(LibraryException.INVALID_STATE,
                    "Illegal migration phase change " + phase + " -> " + next);
        }
        log.info("MIGRATION_PHASE jobId={} from={} to={}", jobId, phase, next);
        phase = next;
    }

    public synchronized MigrationPhase getPhase() {
        return phase;
    }

    public String getJobId() {
        return jobId;
    }

    static boolean canTransition(MigrationPhase from, MigrationPhase to) {
        if (from.isTerminal()) {
            return false;
        }
        if (to == MigrationPhase.CANCELED) {
            return true;
        }
        switch (from) {
            case PENDING:
                return to == MigrationPhase.READING;
            case READING:
                return to == MigrationPhase.PROCESSING;
            case PROCESSING:
                return to == MigrationPhase.WRITING;
            case WRITING:
                return to == MigrationPhase.DONE;
            default:
                return false;
        }
    }
}
