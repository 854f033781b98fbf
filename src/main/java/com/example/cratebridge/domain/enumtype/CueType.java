package com.example.cratebridge.domain.enumtype;

/**
 * Canonical cue marker kinds. Each library format maps its own numeric codes onto this set.
 */
public enum CueType {

    /** Numbered cue meant for live triggering. */
    HOT_CUE,

    /** Persistent bookmark; only the rekordbox catalog can store it. */
    MEMORY_CUE,

    LOOP,

    /** Tempo grid anchor. */
    GRID,

    /** Beat marker; formats without a separate beat concept store it as a grid marker. */
    BEAT
}
