package com.example.cratebridge.domain.model;

import com.example.cratebridge.domain.enumtype.SkipReason;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of reading one foreign library document: what was understood, and what was skipped and why.
 */
@Data
@NoArgsConstructor
public class LibraryDocument {

    private List<Track> tracks = new ArrayList<>();

    private List<Playlist> playlists = new ArrayList<>();

    private List<EntrySkip> skipped = new ArrayList<>();

    public LibraryDocument(List<Track> tracks, List<Playlist> playlists) {
        this.tracks = tracks;
        this.playlists = playlists;
    }

    public void skip(String entryRef, SkipReason reason, String detail) {
        skipped.add(new EntrySkip(entryRef, reason, detail));
    }

    public long countSkipped(SkipReason reason) {
        return skipped.stream().filter(item -> item.getReason() == reason).count();
    }
}
