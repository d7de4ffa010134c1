package com.spansentinel.flink;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded history of one rule's past values, kept in Flink keyed state.
 *
 * <p>
 * Samples are stored in arrival order. {@link #prune(Instant, Duration, int)}
 * drops samples older than the lookback and then the oldest samples beyond
 * the size limit.
 * </p>
 *
 * <p>
 * Not thread-safe; Flink processes one key at a time.
 * </p>
 *
 * @since 1.0.0
 */
public class SampleWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Sample> samples = new ArrayList<>();

    /**
     * Append a value observed at {@code at}.
     */
    public void add(Instant at, double value) {
        Objects.requireNonNull(at, "timestamp must not be null");
        samples.add(new Sample(at.toEpochMilli(), value));
    }

    /**
     * Drop samples observed before {@code now - lookback}, then the oldest
     * samples until at most {@code maxSamples} remain.
     *
     * @return number of samples removed
     */
    public int prune(Instant now, Duration lookback, int maxSamples) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lookback, "lookback must not be null");
        int before = samples.size();

        long cutoff = now.minus(lookback).toEpochMilli();
        samples.removeIf(sample -> sample.timestampMillis < cutoff);

        int excess = samples.size() - Math.max(0, maxSamples);
        if (excess > 0) {
            samples.subList(0, excess).clear();
        }
        return before - samples.size();
    }

    /**
     * @return the retained values, oldest first
     */
    public double[] values() {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).value;
        }
        return values;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    @Override
    public String toString() {
        return "SampleWindow{size=" + samples.size() + '}';
    }

    /** One timestamped value. */
    static final class Sample implements Serializable {

        private static final long serialVersionUID = 1L;

        private long timestampMillis;
        private double value;

        @SuppressWarnings("unused") // Kryo
        private Sample() {
        }

        Sample(long timestampMillis, double value) {
            this.timestampMillis = timestampMillis;
            this.value = value;
        }
    }
}
