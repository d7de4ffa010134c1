package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Kind of metric a rule monitors. Used for display and for grouping in
 * {@link AnomalyStats}.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    LATENCY("latency", "Latency"),
    COST("cost", "Cost"),
    ERROR_RATE("error_rate", "Error Rate"),
    TOKENS("tokens", "Tokens"),
    CUSTOM("custom", "Custom");

    private final String value;
    private final String displayName;

    AnomalyType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return human-readable name used in alert titles
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a type from its wire value (case-insensitive).
     *
     * @param value wire value such as {@code "latency"}
     * @return the matching type
     * @throws IllegalArgumentException if {@code value} is null or unknown
     */
    @JsonCreator
    public static AnomalyType fromValue(String value) {
        if (value != null) {
            String normalised = value.trim().toLowerCase(Locale.ROOT);
            for (AnomalyType type : values()) {
                if (type.value.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: '" + value + "'. Supported: "
                + Arrays.stream(values()).map(AnomalyType::getValue).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return value;
    }
}
