package com.example.cratebridge.application.service;

import com.example.cratebridge.common.config.AppMigrationProperties;
import com.example.cratebridge.domain.enumtype.CueRetention;
import com.example.cratebridge.domain.enumtype.MissingFileHandling;
import lombok.Data;

@Data
public class MigrationOptions {

    private CueRetention cueRetention = CueRetention.KEEP_ALL;

    private MissingFileHandling missingFileHandling = MissingFileHandling.SKIP;

    /**
     * Applied under {@link MissingFileHandling#ATTEMPT_TO_LOCATE} when no file with the same name is found.
     * Only {@code SKIP} and {@code INCLUDE_WITH_WARNING} are meaningful here.
     */
    private MissingFileHandling notLocatedFallback = MissingFileHandling.SKIP;

    private boolean mapFirstHotCueToMemory;

    private boolean mapMemoryToHotCue;

    public static MigrationOptions defaults() {
        return new MigrationOptions();
    }

    public static MigrationOptions from(AppMigrationProperties properties) {
        MigrationOptions options = new MigrationOptions();
        options.setCueRetention(properties.getCueRetention());
        options.setMissingFileHandling(properties.getMissingFileHandling());
        options.setNotLocatedFallback(properties.getNotLocatedFallback());
        options.setMapFirstHotCueToMemory(properties.isMapFirstHotCueToMemory());
        options.setMapMemoryToHotCue(properties.isMapMemoryToHotCue());
        return options;
    }
}
