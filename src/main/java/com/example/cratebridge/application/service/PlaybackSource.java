package com.example.cratebridge.application.service;

import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.domain.model.Track;

/**
 * What a playback engine is handed for one track: a file to decode and its duration.
 */
public final class PlaybackSource {

    private final String filePath;
    private final double durationSeconds;

    private PlaybackSource(String filePath, double durationSeconds) {
        this.filePath = filePath;
        this.durationSeconds = durationSeconds;
    }

    public static PlaybackSource of(Track track) {
        if (track == null || !track.isPlayable()) {
            throw new LibraryException(LibraryException.NOT_PLAYABLE,
                    "Track cannot be played: " + (track == null ? "null" : track.getFilePath())
                            + (track != null && track.isCorrupt() ? " (" + track.getErrorMessage() + ")" : ""),
                    "Rescan the folder or remove corrupt tracks");
        }
        return new PlaybackSource(track.getFilePath(), track.getDuration());
    }

    public String getFilePath() {
        return filePath;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }
}
