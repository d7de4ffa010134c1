package com.spansentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SampleWindow}.
 */
class SampleWindowTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Values are returned oldest first")
    void shouldKeepArrivalOrder() {
        SampleWindow window = new SampleWindow();
        window.add(NOW.minusSeconds(3), 1.0);
        window.add(NOW.minusSeconds(2), 2.0);
        window.add(NOW.minusSeconds(1), 3.0);

        assertThat(window.values()).containsExactly(1.0, 2.0, 3.0);
        assertThat(window.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Prune drops samples older than the lookback")
    void shouldPruneByAge() {
        SampleWindow window = new SampleWindow();
        window.add(NOW.minus(Duration.ofHours(3)), 1.0);
        window.add(NOW.minus(Duration.ofMinutes(30)), 2.0);

        int removed = window.prune(NOW, Duration.ofHours(1), 100);

        assertThat(removed).isEqualTo(1);
        assertThat(window.values()).containsExactly(2.0);
    }

    @Test
    @DisplayName("Sample exactly at the cutoff is kept")
    void shouldKeepSampleAtCutoff() {
        SampleWindow window = new SampleWindow();
        window.add(NOW.minus(Duration.ofHours(1)), 1.0);

        assertThat(window.prune(NOW, Duration.ofHours(1), 100)).isZero();
        assertThat(window.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Prune trims the oldest samples beyond the size limit")
    void shouldPruneBySize() {
        SampleWindow window = new SampleWindow();
        for (int i = 1; i <= 5; i++) {
            window.add(NOW.minusSeconds(10 - i), i);
        }

        int removed = window.prune(NOW, Duration.ofHours(1), 3);

        assertThat(removed).isEqualTo(2);
        assertThat(window.values()).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    @DisplayName("Empty window prunes to nothing")
    void shouldHandleEmptyWindow() {
        SampleWindow window = new SampleWindow();

        assertThat(window.prune(NOW, Duration.ofHours(1), 10)).isZero();
        assertThat(window.isEmpty()).isTrue();
        assertThat(window.values()).isEmpty();
    }
}
