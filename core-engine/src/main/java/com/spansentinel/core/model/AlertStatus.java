package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an {@link Alert}. New alerts start {@link #ACTIVE};
 * the remaining transitions are made by whoever stores the alert.
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    ACTIVE("active"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved"),
    SUPPRESSED("suppressed");

    private final String value;

    AlertStatus(String value) {
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
