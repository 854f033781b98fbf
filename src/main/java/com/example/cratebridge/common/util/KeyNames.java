package com.example.cratebridge.common.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Pitch-class names used for the {@code key} field, plus normalization of free-form tag values.
 */
public final class KeyNames {

    public static final String UNKNOWN = "Unknown";

    public static final List<String> PITCH_CLASSES = Collections.unmodifiableList(Arrays.asList(
            "C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"));

    private static final String NATURALS = "C D EF G A B";

    private KeyNames() {
    }

    public static String nameOf(int pitchClass) {
        return PITCH_CLASSES.get(Math.floorMod(pitchClass, 12));
    }

    public static boolean isKnown(String key) {
        return key != null && PITCH_CLASSES.contains(key);
    }

    /**
     * Reduces a tag value such as {@code "Am"}, {@code "Db"} or {@code "f# minor"} to its tonic pitch class.
     *
     * @return the pitch-class name, or {@code null} when the value carries no usable key
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        char letter = Character.toUpperCase(value.charAt(0));
        int natural = NATURALS.indexOf(letter);
        if (letter == ' ' || natural < 0) {
            return null;
        }
        int pitchClass = natural;
        if (value.length() > 1) {
            char accidental = value.charAt(1);
            if (accidental == '#' || accidental == '♯') {
                pitchClass++;
            } else if (accidental == 'b' || accidental == '♭') {
                pitchClass--;
            }
        }
        String rest = value.substring(1).toLowerCase(Locale.ROOT);
        if (!rest.isEmpty() && !rest.matches("^[#b♯♭]?\\s*(m|min|minor|maj|major|dur|moll)?$")) {
            return null;
        }
        return nameOf(pitchClass);
    }
}
