package com.example.cratebridge.infrastructure.format.nml;

import com.example.cratebridge.infrastructure.format.FieldValues;

/**
 * LOCATION attributes. FILE carries the full path; DIR uses Traktor's {@code /:}-separated notation and VOLUME
 * the drive or root, and both are only consulted when FILE is a bare file name.
 */
final class NmlPaths {

    private static final String DIR_SEPARATOR = "/:";

    private NmlPaths() {
    }

    static NmlEntry.Location toLocation(String filePath) {
        NmlEntry.Location location = new NmlEntry.Location();
        String path = filePath == null ? "" : filePath;
        location.setFile(path);
        String normalized = path.replace('\\', '/');
        String volume = "";
        if (normalized.length() >= 2 && Character.isLetter(normalized.charAt(0)) && normalized.charAt(1) == ':') {
            volume = normalized.substring(0, 2);
            normalized = normalized.substring(2);
        }
        int lastSlash = normalized.lastIndexOf('/');
        String directory = lastSlash >= 0 ? normalized.substring(0, lastSlash) : "";
        StringBuilder dir = new StringBuilder();
        for (String segment : directory.split("/")) {
            if (!segment.isEmpty()) {
                dir.append(DIR_SEPARATOR).append(segment);
            }
        }
        dir.append(DIR_SEPARATOR);
        location.setDir(dir.toString());
        location.setVolume(volume);
        return location;
    }

    static String toFilePath(NmlEntry.Location location) {
        String file = location.getFile().trim();
        if (file.contains("/") || file.contains("\\") || FieldValues.isBlank(location.getDir())) {
            return file;
        }
        String dir = location.getDir().trim().replace(DIR_SEPARATOR, "/");
        if (!dir.endsWith("/")) {
            dir = dir + "/";
        }
        if (!dir.startsWith("/")) {
            dir = "/" + dir;
        }
        String volume = FieldValues.trimToEmpty(location.getVolume());
        if (volume.length() == 2 && volume.charAt(1) == ':') {
            return volume + dir.replace('/', '\\') + file;
        }
        return dir + file;
    }
}
