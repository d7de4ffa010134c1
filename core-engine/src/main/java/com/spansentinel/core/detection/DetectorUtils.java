package com.spansentinel.core.detection;

import java.util.Locale;

/**
 * Small helpers shared by the detectors.
 */
final class DetectorUtils {

    private DetectorUtils() {
        // utility class, not instantiable
    }

    static String direction(double value, double basis) {
        return value < basis ? "below" : "above";
    }

    /** Locale-independent {@link String#format}, so descriptions are stable. */
    static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }
}
