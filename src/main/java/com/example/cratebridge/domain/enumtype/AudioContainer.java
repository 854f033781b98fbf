package com.example.cratebridge.domain.enumtype;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Audio containers the tag reader understands. {@code .m4a} and {@code .aac} share the MP4 reader.
 */
public enum AudioContainer {

    MP3("mp3", "mp3"),

    FLAC("flac", "flac"),

    MP4("m4a", "m4a", "aac"),

    WAV("wav", "wav");

    private final String readerExtension;
    private final String[] extensions;

    AudioContainer(String readerExtension, String... extensions) {
        this.readerExtension = readerExtension;
        this.extensions = extensions;
    }

    /**
     * Extension handed to the tag library so both MP4 variants go through the same reader.
     */
    public String getReaderExtension() {
        return readerExtension;
    }

    public static AudioContainer fromPath(Path path) {
        String extension = extensionOf(path);
        if (extension.isEmpty()) {
            return null;
        }
        for (AudioContainer container : values()) {
            for (String candidate : container.extensions) {
                if (candidate.equals(extension)) {
                    return container;
                }
            }
        }
        return null;
    }

    public static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
