package com.spansentinel.core.detection;

import com.spansentinel.core.model.BaselineStats;
import com.spansentinel.core.model.DetectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ExponentialMovingAverageDetector}.
 */
class ExponentialMovingAverageDetectorTest {

    @Test
    @DisplayName("EMA is seeded with the oldest sample and folded forward")
    void shouldFoldHistory() {
        DetectionResult result = new ExponentialMovingAverageDetector(0.5, 0.2)
                .detect(30, new double[]{10, 20}, BaselineStats.EMPTY);

        assertThat(result.getExpected()).isCloseTo(15.0, within(1e-9));
        assertThat(result.getScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getDescription()).contains("above EMA");
    }

    @Test
    @DisplayName("Alpha of one tracks the latest sample")
    void shouldTrackLatestWithAlphaOne() {
        DetectionResult result = new ExponentialMovingAverageDetector(1.0, 0.2)
                .detect(40, new double[]{10, 20, 40}, BaselineStats.EMPTY);

        assertThat(result.getExpected()).isEqualTo(40.0);
        assertThat(result.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Empty history and zero EMA skip the check")
    void shouldSkipDegenerateInputs() {
        ExponentialMovingAverageDetector detector = new ExponentialMovingAverageDetector(0.3, 0.2);

        assertThat(detector.detect(5, new double[0], BaselineStats.EMPTY).getDescription())
                .contains("No historical data");
        DetectionResult zero = detector.detect(5, new double[]{0, 0}, BaselineStats.EMPTY);
        assertThat(zero.isAnomaly()).isFalse();
        assertThat(zero.getDescription()).isEqualTo("EMA is zero");
    }

    @Test
    @DisplayName("Negative EMA gives a negative score that never fires")
    void shouldNotFireOnNegativeEma() {
        DetectionResult result = new ExponentialMovingAverageDetector(0.5, 0.2)
                .detect(-5, new double[]{-10, -10}, BaselineStats.EMPTY);

        assertThat(result.getExpected()).isCloseTo(-10.0, within(1e-9));
        assertThat(result.getScore()).isCloseTo(-0.5, within(1e-9));
        assertThat(result.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should reject alpha outside (0, 1]")
    void shouldRejectInvalidAlpha() {
        assertThatThrownBy(() -> new ExponentialMovingAverageDetector(0, 0.2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialMovingAverageDetector(1.5, 0.2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
