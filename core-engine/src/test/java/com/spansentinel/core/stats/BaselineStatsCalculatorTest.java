package com.spansentinel.core.stats;

import com.spansentinel.core.model.BaselineStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineStatsCalculator}.
 */
class BaselineStatsCalculatorTest {

    @Test
    @DisplayName("Should compute the full summary of a known sample")
    void shouldComputeKnownSummary() {
        BaselineStats stats = BaselineStatsCalculator.calculate(new double[]{9, 2, 4, 4, 5, 4, 7, 5});

        assertThat(stats.getMean()).isCloseTo(5.0, within(1e-9));
        assertThat(stats.getStdDev()).isCloseTo(2.0, within(1e-9));
        assertThat(stats.getMedian()).isEqualTo(4.5);
        assertThat(stats.getMin()).isEqualTo(2.0);
        assertThat(stats.getMax()).isEqualTo(9.0);
        assertThat(stats.getQ1()).isCloseTo(4.0, within(1e-9));
        assertThat(stats.getQ3()).isCloseTo(5.5, within(1e-9));
        assertThat(stats.getIqr()).isCloseTo(1.5, within(1e-9));
        assertThat(stats.getMad()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should not reorder the caller's array")
    void shouldNotModifyInput() {
        double[] samples = {3, 1, 2};
        BaselineStatsCalculator.calculate(samples);

        assertThat(samples).containsExactly(3, 1, 2);
    }

    @Test
    @DisplayName("Empty input yields the all-zero summary")
    void shouldReturnEmptyForNoSamples() {
        assertThat(BaselineStatsCalculator.calculate(new double[0])).isEqualTo(BaselineStats.EMPTY);
    }

    @Test
    @DisplayName("Constant samples have zero spread")
    void shouldHaveZeroSpreadForConstantSamples() {
        double[] samples = new double[30];
        Arrays.fill(samples, 10);

        BaselineStats stats = BaselineStatsCalculator.calculate(samples);

        assertThat(stats.getMean()).isEqualTo(10.0);
        assertThat(stats.getStdDev()).isZero();
        assertThat(stats.getIqr()).isZero();
        assertThat(stats.getMad()).isZero();
    }

    @Test
    @DisplayName("Order statistics are monotone for arbitrary samples")
    void shouldKeepOrderStatisticsMonotone() {
        Random random = new Random(42);
        for (int run = 0; run < 50; run++) {
            double[] samples = new double[1 + random.nextInt(100)];
            for (int i = 0; i < samples.length; i++) {
                samples[i] = random.nextGaussian() * 100;
            }

            BaselineStats stats = BaselineStatsCalculator.calculate(samples);

            assertThat(stats.getMin()).isLessThanOrEqualTo(stats.getQ1());
            assertThat(stats.getQ1()).isLessThanOrEqualTo(stats.getMedian());
            assertThat(stats.getMedian()).isLessThanOrEqualTo(stats.getQ3());
            assertThat(stats.getQ3()).isLessThanOrEqualTo(stats.getMax());
            assertThat(stats.getIqr()).isGreaterThanOrEqualTo(0);
        }
    }

    @Test
    @DisplayName("Should reject null samples")
    void shouldRejectNull() {
        assertThatThrownBy(() -> BaselineStatsCalculator.calculate(null))
                .isInstanceOf(NullPointerException.class);
    }
}
