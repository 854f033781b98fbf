package com.example.cratebridge.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.scan")
public class AppScanProperties {

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList("mp3", "wav", "flac", "m4a", "aac"));

    /**
     * Files below this size are not considered audio at all.
     */
    private long minFileSizeBytes = 1024L;

    /**
     * Log a progress line every N processed files.
     */
    private int progressLogIntervalFiles = 200;

    /**
     * Folders registered at startup, in search order for missing-file relocation.
     */
    private List<String> folders = new ArrayList<>();

    public Set<String> normalizedAudioExtensions() {
        return audioExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
