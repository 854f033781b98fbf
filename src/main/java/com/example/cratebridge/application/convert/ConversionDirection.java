package com.example.cratebridge.application.convert;

import com.example.cratebridge.domain.enumtype.LibraryFormat;

public enum ConversionDirection {

    NML_TO_REKORDBOX(LibraryFormat.NML, LibraryFormat.REKORDBOX_XML),

    REKORDBOX_TO_NML(LibraryFormat.REKORDBOX_XML, LibraryFormat.NML);

    private final LibraryFormat sourceFormat;
    private final LibraryFormat targetFormat;

    ConversionDirection(LibraryFormat sourceFormat, LibraryFormat targetFormat) {
        this.sourceFormat = sourceFormat;
        this.targetFormat = targetFormat;
    }

    public LibraryFormat getSourceFormat() {
        return sourceFormat;
    }

    public LibraryFormat getTargetFormat() {
        return targetFormat;
    }

    /**
     * @return the direction between the two formats, or {@code null} when the pair has no cue remapping
     */
    public static ConversionDirection between(LibraryFormat source, LibraryFormat target) {
        for (ConversionDirection direction : values()) {
            if (direction.sourceFormat == source && direction.targetFormat == target) {
                return direction;
            }
        }
        return null;
    }
}
