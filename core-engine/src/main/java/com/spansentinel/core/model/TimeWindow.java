package com.spansentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval {@code [start, end]}.
 *
 * @since 1.0.0
 */
public final class TimeWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant start;
    private final Instant end;

    /**
     * @param start interval start; must not be {@code null}
     * @param end   interval end; must not be {@code null} or before
     *              {@code start}
     * @throws IllegalArgumentException if {@code end} is before {@code start}
     */
    @JsonCreator
    public TimeWindow(@JsonProperty("start") Instant start, @JsonProperty("end") Instant end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException(
                    "TimeWindow end " + end + " is before start " + start);
        }
    }

    /**
     * @param end      interval end
     * @param lookback length of the interval
     * @return the window {@code [end - lookback, end]}
     */
    public static TimeWindow endingAt(Instant end, Duration lookback) {
        Objects.requireNonNull(end, "end must not be null");
        Objects.requireNonNull(lookback, "lookback must not be null");
        return new TimeWindow(end.minus(lookback), end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    /**
     * @param instant the instant to test
     * @return {@code true} if {@code instant} lies within the window, bounds
     *         included
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeWindow that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
