package com.example.cratebridge.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identities a writer minted for the tracks it serialized, keyed by track instance.
 *
 * <p>Returned by every codec write instead of stamping ids onto the shared {@link Track} objects.
 */
public class IdentityAssignment {

    private final Map<Track, String> assigned = new IdentityHashMap<>();
    private final List<Track> order = new ArrayList<>();
    private int droppedPlaylistReferences;

    public void assign(Track track, String targetId) {
        if (assigned.put(track, targetId) == null) {
            order.add(track);
        }
    }

    public String idOf(Track track) {
        return assigned.get(track);
    }

    public boolean contains(Track track) {
        return assigned.containsKey(track);
    }

    public int size() {
        return assigned.size();
    }

    /**
     * Tracks in the order they were written.
     */
    public List<Track> tracks() {
        return Collections.unmodifiableList(order);
    }

    public void recordDroppedPlaylistReference() {
        droppedPlaylistReferences++;
    }

    public int getDroppedPlaylistReferences() {
        return droppedPlaylistReferences;
    }

    public static IdentityAssignment empty() {
        return new IdentityAssignment();
    }
}
