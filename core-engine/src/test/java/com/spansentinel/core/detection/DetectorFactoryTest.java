package com.spansentinel.core.detection;

import com.spansentinel.core.model.DetectionMethod;
import com.spansentinel.core.model.DetectionRule;
import com.spansentinel.core.model.RuleConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create a detector for every method")
    void shouldCreateDetectorForEveryMethod() {
        RuleConfig config = new RuleConfig();
        config.setMaxThreshold(100.0);

        assertThat(DetectorFactory.create(DetectionMethod.Z_SCORE, config)).isInstanceOf(ZScoreDetector.class);
        assertThat(DetectorFactory.create(DetectionMethod.IQR, config)).isInstanceOf(IqrDetector.class);
        assertThat(DetectorFactory.create(DetectionMethod.MAD, config)).isInstanceOf(MadDetector.class);
        assertThat(DetectorFactory.create(DetectionMethod.MOVING_AVERAGE, config))
                .isInstanceOf(MovingAverageDetector.class);
        assertThat(DetectorFactory.create(DetectionMethod.EXPONENTIAL_EMA, config))
                .isInstanceOf(ExponentialMovingAverageDetector.class);
        assertThat(DetectorFactory.create(DetectionMethod.THRESHOLD, config)).isInstanceOf(ThresholdDetector.class);

        for (DetectionMethod method : DetectionMethod.values()) {
            assertThat(DetectorFactory.create(method, config).getMethod()).isEqualTo(method);
        }
    }

    @Test
    @DisplayName("Should pass the rule's parameters to the detector")
    void shouldPassParameters() {
        DetectionRule rule = rule("z_score");
        rule.getConfig().setZscoreThreshold(2.5);

        AnomalyDetector detector = DetectorFactory.create(rule);

        assertThat(detector).isInstanceOf(ZScoreDetector.class);
        assertThat(((ZScoreDetector) detector).getThreshold()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should accept method names case-insensitively")
    void shouldBeCaseInsensitive() {
        assertThat(DetectorFactory.create(rule("MOVING_AVERAGE"))).isInstanceOf(MovingAverageDetector.class);
    }

    @Test
    @DisplayName("Should throw for unknown method")
    void shouldThrowForUnknownMethod() {
        assertThatThrownBy(() -> DetectorFactory.create(rule("prophet")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prophet");
    }

    @Test
    @DisplayName("Should throw for null rule")
    void shouldThrowForNullRule() {
        assertThatThrownBy(() -> DetectorFactory.create(null))
                .isInstanceOf(NullPointerException.class);
    }

    // Helpers

    private static DetectionRule rule(String method) {
        DetectionRule rule = new DetectionRule();
        rule.setName("test_rule");
        rule.setType("latency");
        rule.setMethod(method);
        return rule;
    }
}
