package com.spansentinel.core.detection;

import com.spansentinel.core.model.AnomalySeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeverityClassifier}.
 */
class SeverityClassifierTest {

    @Test
    @DisplayName("A ratio of exactly 3.0 is high, not critical")
    void shouldTreatBoundaryAsLowerTier() {
        assertThat(SeverityClassifier.classify(9, 3)).isEqualTo(AnomalySeverity.HIGH);
    }

    @Test
    @DisplayName("Should map ratios to tiers")
    void shouldMapRatios() {
        assertThat(SeverityClassifier.classify(9.3, 3)).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(SeverityClassifier.classify(6.3, 3)).isEqualTo(AnomalySeverity.HIGH);
        assertThat(SeverityClassifier.classify(6, 3)).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(SeverityClassifier.classify(4.5, 3)).isEqualTo(AnomalySeverity.LOW);
        assertThat(SeverityClassifier.classify(3.1, 3)).isEqualTo(AnomalySeverity.LOW);
    }

    @Test
    @DisplayName("A negative threshold is compared by magnitude")
    void shouldUseThresholdMagnitude() {
        assertThat(SeverityClassifier.classify(0.7, -0.2)).isEqualTo(AnomalySeverity.CRITICAL);
    }

    @Test
    @DisplayName("A zero threshold makes any positive score critical")
    void shouldTreatZeroThresholdAsCritical() {
        assertThat(SeverityClassifier.classify(1, 0)).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(SeverityClassifier.classify(0, 0)).isEqualTo(AnomalySeverity.LOW);
    }
}
