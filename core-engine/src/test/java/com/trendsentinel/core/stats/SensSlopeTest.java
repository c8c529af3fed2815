package com.trendsentinel.core.stats;

import com.trendsentinel.core.config.CensoringConfig;
import com.trendsentinel.core.model.CensorKind;
import com.trendsentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SensSlope}.
 */
class SensSlopeTest {

    private final SensSlope estimator = new SensSlope();

    @Test
    @DisplayName("Should recover the slope of an exact line")
    void shouldRecoverLineSlope() {
        double[] t = {0, 1, 2, 3, 4, 5};
        double[] y = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            y[i] = 2 * t[i] + 1;
        }

        assertThat(estimator.estimate(TimeSeries.of(t, y))).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("A single outlier should not move the median slope")
    void shouldResistOutlier() {
        double[] t = {0, 1, 2, 3, 4, 5, 6};
        double[] y = {0, 1, 2, 300, 4, 5, 6};

        assertThat(estimator.estimate(TimeSeries.of(t, y))).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should return NaN when no pair has distinct times")
    void shouldReturnNanWithoutPairs() {
        assertThat(estimator.estimate(TimeSeries.of(new double[]{1, 1}, new double[]{2, 3}))).isNaN();
        assertThat(estimator.estimate(TimeSeries.of(new double[]{1}, new double[]{2}))).isNaN();
    }

    @Test
    @DisplayName("Should drop ambiguous censored pairs and impute the rest")
    void shouldDropAmbiguousCensoredPairs() {
        TimeSeries censored = TimeSeries.censored(
                new double[]{0, 1, 2},
                new double[]{4, 2, 3},
                new boolean[]{true, false, false},
                new CensorKind[]{CensorKind.LEFT, null, null});
        SensSlope halfLimit = new SensSlope(CensoringConfig.builder().leftMultiplier(0.5).build());

        // both pairs with "<4" are ambiguous, only (2, 3) survives
        assertThat(halfLimit.estimate(censored)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Pair count should not overflow past 46341 observations")
    void pairCountShouldUseLongArithmetic() {
        assertThat(SensSlope.pairCount(46_342)).isEqualTo(1_073_767_311L);
        assertThat(SensSlope.pairCount(70_000)).isEqualTo(2_449_965_000L);
        assertThat(SensSlope.pairCount(1)).isZero();
    }

    @Test
    @DisplayName("Should reject series with more pairs than an array can hold")
    void shouldRejectOversizeSeries() {
        int n = 70_000;
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i;
        }

        assertThatThrownBy(() -> estimator.estimate(TimeSeries.of(t, t)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("70000 observations")
                .hasMessageContaining("aggregate");
    }
}
