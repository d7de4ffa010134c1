package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Number of anomalies observed on one named trace.
 *
 * @since 1.0.0
 */
public final class TraceAnomalyCount implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String traceName;
    private final int count;

    @JsonCreator
    public TraceAnomalyCount(@JsonProperty("traceName") String traceName,
            @JsonProperty("count") int count) {
        this.traceName = Objects.requireNonNull(traceName, "traceName must not be null");
        this.count = count;
    }

    public String getTraceName() {
        return traceName;
    }

    public int getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TraceAnomalyCount that))
            return false;
        return count == that.count && traceName.equals(that.traceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traceName, count);
    }

    @Override
    public String toString() {
        return traceName + "=" + count;
    }
}
