package com.example.cratebridge.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Named, ordered list of track references. Entries point at {@link Track} instances, not copies.
 */
@Data
@NoArgsConstructor
public class Playlist {

    private String name;

    /**
     * Names of the enclosing folders from the top of the playlist tree; empty for top-level playlists.
     */
    private List<String> folderPath = new ArrayList<>();

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<Track> tracks = new ArrayList<>();

    public Playlist(String name) {
        this.name = name;
    }

    public Playlist(String name, List<String> folderPath) {
        this.name = name;
        this.folderPath = new ArrayList<>(folderPath);
    }

    public int size() {
        return tracks.size();
    }
}
