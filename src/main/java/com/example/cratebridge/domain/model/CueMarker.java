package com.example.cratebridge.domain.model;

import com.example.cratebridge.domain.enumtype.CueType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CueMarker {

    public static final int NO_SLOT = -1;

    private CueType type;

    private double startSeconds;

    private String label;

    /**
     * Hot cue pad index, {@link #NO_SLOT} for markers that are not bound to a pad.
     */
    private int hotCueSlot = NO_SLOT;

    private double lengthSeconds;

    public CueMarker(CueType type, double startSeconds, String label) {
        this(type, startSeconds, label, NO_SLOT, 0D);
    }

    public CueMarker copy() {
        return new CueMarker(type, startSeconds, label, hotCueSlot, lengthSeconds);
    }
}
