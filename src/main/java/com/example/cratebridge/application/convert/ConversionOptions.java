package com.example.cratebridge.application.convert;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversionOptions {

    /**
     * NML to rekordbox: also emit a memory cue at the first hot cue of each track.
     */
    private boolean mapFirstHotCueToMemory;

    /**
     * rekordbox to NML: keep memory cues as hot cues instead of dropping them.
     */
    private boolean mapMemoryToHotCue;

    public static ConversionOptions defaults() {
        return new ConversionOptions(false, false);
    }
}
