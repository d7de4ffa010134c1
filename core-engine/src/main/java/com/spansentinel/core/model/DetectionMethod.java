package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Statistical model used to judge a new value against its history.
 *
 * <p>
 * Exactly one method is active per {@link DetectionRule}. The wire value
 * (e.g. {@code z_score}) is what appears in rule files and JSON output.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectionMethod {

    /** Distance from the mean in standard deviations. */
    Z_SCORE("z_score"),

    /** Tukey fences around the interquartile range. */
    IQR("iqr"),

    /** Modified Z-score based on the median absolute deviation. */
    MAD("mad"),

    /** Relative deviation from the mean of the most recent samples. */
    MOVING_AVERAGE("moving_average"),

    /** Relative deviation from an exponentially weighted average. */
    EXPONENTIAL_EMA("exponential_ema"),

    /** Static minimum / maximum bounds. */
    THRESHOLD("threshold");

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a method from its wire value (case-insensitive).
     *
     * @param value wire value such as {@code "z_score"}
     * @return the matching method
     * @throws IllegalArgumentException if {@code value} is null or not a
     *                                  supported method
     */
    @JsonCreator
    public static DetectionMethod fromValue(String value) {
        if (value != null) {
            String normalised = value.trim().toLowerCase(Locale.ROOT);
            for (DetectionMethod method : values()) {
                if (method.value.equals(normalised)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported detection method: '" + value
                + "'. Supported: " + supportedValues());
    }

    static String supportedValues() {
        return Arrays.stream(values())
                .map(DetectionMethod::getValue)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return value;
    }
}
