package com.example.cratebridge.application.service;

import com.example.cratebridge.domain.enumtype.MigrationPhase;
import com.example.cratebridge.domain.model.EntrySkip;
import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.Track;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Data;

@Data
public class MigrationResult {

    private MigrationPhase phase;

    private int tracksRead;

    /**
     * Tracks that went through the per-track policy before the job finished or was canceled.
     */
    private int tracksProcessed;

    private int tracksWritten;

    private int tracksRelocated;

    private int droppedPlaylistReferences;

    private List<EntrySkip> skipped = new ArrayList<>();

    /**
     * Paths of tracks kept although their file is missing.
     */
    private List<String> warnings = new ArrayList<>();

    private IdentityAssignment identities = IdentityAssignment.empty();

    /**
     * Tracks written to the target, in document order. Empty when nothing was written.
     */
    public List<Track> getTracks() {
        return Collections.unmodifiableList(new ArrayList<>(identities.tracks()));
    }

    public boolean isCanceled() {
        return phase == MigrationPhase.CANCELED;
    }

    public static MigrationResult canceled(int processedSoFar) {
        MigrationResult result = new MigrationResult();
        result.setPhase(MigrationPhase.CANCELED);
        result.setTracksProcessed(processedSoFar);
        return result;
    }
}
