package com.example.cratebridge.application.service;

import com.example.cratebridge.domain.model.Track;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Outcome of one scan. A canceled result holds the tracks processed before cancellation was observed and must
 * not be adopted as library state.
 */
@Data
public class ScanResult {

    private List<Track> tracks = new ArrayList<>();

    private boolean canceled;

    private int discoveredFiles;

    private int corruptTracks;

    private long durationMs;

    public boolean isCompleted() {
        return !canceled;
    }
}
