package com.example.cratebridge.application.convert;

import com.example.cratebridge.domain.model.IdentityAssignment;
import com.example.cratebridge.domain.model.Track;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One-to-one mapping from source document identities to the identities minted by the target writer.
 */
public final class IdentityRemapTable {

    private final Map<String, String> sourceToTarget;

    private IdentityRemapTable(Map<String, String> sourceToTarget) {
        this.sourceToTarget = sourceToTarget;
    }

    /**
     * Tracks without a source identity, or whose source identity was already taken, are left out.
     */
    public static IdentityRemapTable from(IdentityAssignment assignment) {
        Map<String, String> table = new LinkedHashMap<>();
        for (Track track : assignment.tracks()) {
            String sourceId = track.getSourceId();
            if (sourceId != null && !table.containsKey(sourceId)) {
                table.put(sourceId, assignment.idOf(track));
            }
        }
        return new IdentityRemapTable(table);
    }

    public Optional<String> lookup(String sourceId) {
        return Optional.ofNullable(sourceToTarget.get(sourceId));
    }

    public int size() {
        return sourceToTarget.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(sourceToTarget);
    }
}
