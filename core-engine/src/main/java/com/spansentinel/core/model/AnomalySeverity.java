package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered severity tiers, lowest first.
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    AnomalySeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
