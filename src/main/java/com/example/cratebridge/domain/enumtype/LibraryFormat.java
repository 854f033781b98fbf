package com.example.cratebridge.domain.enumtype;

import java.nio.file.Path;
import java.util.Locale;

public enum LibraryFormat {

    NML("Traktor NML"),

    REKORDBOX_XML("rekordbox XML"),

    CSV("CSV"),

    M3U("M3U playlist");

    private final String displayName;

    LibraryFormat(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Infers the format from a document file name, or returns {@code null} when the extension is not known.
     */
    public static LibraryFormat fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return null;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".nml")) {
            return NML;
        }
        if (name.endsWith(".xml")) {
            return REKORDBOX_XML;
        }
        if (name.endsWith(".csv")) {
            return CSV;
        }
        if (name.endsWith(".m3u") || name.endsWith(".m3u8")) {
            return M3U;
        }
        return null;
    }

    public static LibraryFormat fromName(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("REKORDBOX".equals(normalized) || "XML".equals(normalized)) {
            return REKORDBOX_XML;
        }
        if ("M3U8".equals(normalized)) {
            return M3U;
        }
        for (LibraryFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        return null;
    }
}
