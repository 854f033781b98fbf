package com.example.cratebridge.infrastructure.format;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Conversions between local paths and {@code file://localhost/} locations.
 */
public final class LocationUris {

    public static final String LOCALHOST_PREFIX = "file://localhost/";

    private static final String SEGMENT_SAFE =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~!$&'()*+,;=:@";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private LocationUris() {
    }

    /**
     * {@code /Music/a b.mp3} becomes {@code file://localhost/Music/a%20b.mp3}; {@code C:\Music\a.mp3} becomes
     * {@code file://localhost/C:/Music/a.mp3}. Each segment is percent-encoded as UTF-8.
     */
    public static String toLocation(String filePath) {
        String forward = filePath.replace('\\', '/');
        while (forward.startsWith("/")) {
            forward = forward.substring(1);
        }
        StringBuilder location = new StringBuilder(LOCALHOST_PREFIX);
        String[] segments = forward.split("/", -1);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                location.append('/');
            }
            location.append(percentEncode(segments[i]));
        }
        return location.toString();
    }

    public static String toFilePath(String location) {
        if (location == null) {
            return null;
        }
        String value = location.trim();
        String rest;
        if (value.startsWith(LOCALHOST_PREFIX)) {
            rest = value.substring(LOCALHOST_PREFIX.length());
        } else if (value.startsWith("file:///")) {
            rest = value.substring("file:///".length());
        } else if (value.startsWith("file://")) {
            rest = value.substring("file://".length());
        } else {
            return value;
        }
        rest = percentDecode(rest);
        if (rest.length() >= 2 && Character.isLetter(rest.charAt(0)) && rest.charAt(1) == ':') {
            return rest;
        }
        return "/" + rest;
    }

    static String percentEncode(String segment) {
        StringBuilder encoded = new StringBuilder(segment.length());
        for (byte b : segment.getBytes(StandardCharsets.UTF_8)) {
            int value = b & 0xFF;
            if (value < 0x80 && SEGMENT_SAFE.indexOf(value) >= 0) {
                encoded.append((char) value);
            } else {
                encoded.append('%').append(HEX[value >> 4]).append(HEX[value & 0x0F]);
            }
        }
        return encoded.toString();
    }

    /**
     * Decodes {@code %XX} escapes as UTF-8 and leaves {@code +} alone, unlike form decoding. A {@code %} that
     * does not start a valid escape is kept as is.
     */
    static String percentDecode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        StringBuilder decoded = new StringBuilder(value.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int runStart = 0;
        int i = 0;
        while (i < value.length()) {
            if (isEscape(value, i)) {
                decoded.append(value, runStart, i);
                pending.write(Character.digit(value.charAt(i + 1), 16) * 16 + Character.digit(value.charAt(i + 2), 16));
                i += 3;
                while (isEscape(value, i)) {
                    pending.write(Character.digit(value.charAt(i + 1), 16) * 16
                            + Character.digit(value.charAt(i + 2), 16));
                    i += 3;
                }
                decoded.append(new String(pending.toByteArray(), StandardCharsets.UTF_8));
                pending.reset();
                runStart = i;
            } else {
                i++;
            }
        }
        decoded.append(value, runStart, value.length());
        return decoded.toString();
    }

    private static boolean isEscape(String value, int index) {
        return index + 2 < value.length() && value.charAt(index) == '%'
                && Character.digit(value.charAt(index + 1), 16) >= 0
                && Character.digit(value.charAt(index + 2), 16) >= 0;
    }
}
