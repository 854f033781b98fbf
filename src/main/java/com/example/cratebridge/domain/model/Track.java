package com.example.cratebridge.domain.model;

import com.example.cratebridge.common.util.KeyNames;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * One audio asset and its derived metadata.
 *
 * <p>Every descriptive and analytic field holds a safe default after {@link #applyDefaults()}, so consumers
 * never need null checks. {@code sourceId} is the identity the track had in the document it was read from;
 * writers assign their own identities and report them separately.
 */
@Data
public class Track {

    public static final String UNKNOWN_ARTIST = "Unknown Artist";
    public static final String UNKNOWN_ALBUM = "Unknown Album";
    public static final String UNKNOWN_GENRE = "Unknown Genre";

    private String filePath;

    private String sourceId;

    private String title;

    private String artist;

    private String album;

    private String genre;

    private String year;

    private String comment;

    private double bpm;

    private String key;

    private int energy;

    private double duration;

    private boolean corrupt;

    private String errorMessage = "";

    private List<CueMarker> cuePoints = new ArrayList<>();

    public static Track withDefaults(String filePath) {
        Track track = new Track();
        track.setFilePath(filePath);
        track.applyDefaults();
        return track;
    }

    public static Track corrupt(String filePath, String errorMessage) {
        Track track = new Track();
        track.setFilePath(filePath);
        track.markCorrupt(errorMessage);
        return track;
    }

    /**
     * Flags the track as unreadable and resets every derived field to its default.
     */
    public void markCorrupt(String message) {
        this.corrupt = true;
        this.errorMessage = message == null ? "" : message;
        this.title = fileStem();
        this.artist = UNKNOWN_ARTIST;
        this.album = UNKNOWN_ALBUM;
        this.genre = UNKNOWN_GENRE;
        this.year = "";
        this.comment = "";
        this.bpm = 0D;
        this.key = KeyNames.UNKNOWN;
        this.energy = 0;
        this.duration = 0D;
    }

    public void applyDefaults() {
        if (isBlank(title)) {
            title = fileStem();
        }
        if (isBlank(artist)) {
            artist = UNKNOWN_ARTIST;
        }
        if (isBlank(album)) {
            album = UNKNOWN_ALBUM;
        }
        if (isBlank(genre)) {
            genre = UNKNOWN_GENRE;
        }
        if (year == null) {
            year = "";
        }
        if (comment == null) {
            comment = "";
        }
        if (isBlank(key)) {
            key = KeyNames.UNKNOWN;
        }
        if (bpm < 0 || Double.isNaN(bpm)) {
            bpm = 0D;
        }
        energy = Math.max(0, Math.min(100, energy));
        if (duration < 0 || Double.isNaN(duration)) {
            duration = 0D;
        }
        if (errorMessage == null) {
            errorMessage = "";
        }
        if (cuePoints == null) {
            cuePoints = new ArrayList<>();
        }
    }

    /**
     * Corrupt tracks must never reach the playback engine.
     */
    public boolean isPlayable() {
        return !corrupt && !isBlank(filePath);
    }

    public String fileStem() {
        if (isBlank(filePath)) {
            return "unknown-track";
        }
        Path fileName = Paths.get(filePath).getFileName();
        String name = fileName == null ? filePath : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public String fileName() {
        if (isBlank(filePath)) {
            return "";
        }
        Path fileName = Paths.get(filePath).getFileName();
        return fileName == null ? filePath : fileName.toString();
    }

    /**
     * Flat view of every field, keyed the same way for every format writer.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", sourceId);
        record.put("title", title);
        record.put("artist", artist);
        record.put("album", album);
        record.put("genre", genre);
        record.put("bpm", bpm);
        record.put("key", key);
        record.put("energy", energy);
        record.put("duration", duration);
        record.put("year", year);
        record.put("comment", comment);
        record.put("file_path", filePath);
        record.put("is_corrupt", corrupt);
        record.put("error_message", errorMessage);
        record.put("cue_count", cuePoints == null ? 0 : cuePoints.size());
        return record;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
