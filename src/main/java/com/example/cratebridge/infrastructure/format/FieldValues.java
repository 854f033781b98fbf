package com.example.cratebridge.infrastructure.format;

import java.util.Locale;

/**
 * Lenient parsing and stable formatting of the textual attribute values found in library documents.
 */
public final class FieldValues {

    private FieldValues() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    /**
     * @return the parsed value, or {@code null} when the text is blank or not a finite number
     */
    public static Double parseDouble(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim().replace(',', '.'));
            return Double.isNaN(parsed) || Double.isInfinite(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer parseInt(String value) {
        Double parsed = parseDouble(value);
        return parsed == null ? null : (int) Math.round(parsed);
    }

    public static String formatDecimal(double value, int scale) {
        return String.format(Locale.ROOT, "%." + scale + "f", value);
    }
}
