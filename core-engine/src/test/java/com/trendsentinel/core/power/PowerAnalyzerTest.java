package com.trendsentinel.core.power;

import com.trendsentinel.core.config.PowerConfig;
import com.trendsentinel.core.model.NoteCode;
import com.trendsentinel.core.model.PowerResult;
import com.trendsentinel.core.model.SlopeUnit;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.model.TimeSeries;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PowerAnalyzer}.
 */
class PowerAnalyzerTest {

    private final PowerAnalyzer analyzer = new PowerAnalyzer();

    @Nested
    @DisplayName("Minimum detectable trend")
    class MinimumDetectableTrend {

        @Test
        @DisplayName("Should interpolate the first crossing of the target power")
        void shouldInterpolateCrossing() {
            double mdt = PowerAnalyzer.minimumDetectableTrend(new double[]{0, 1, 2}, new double[]{0.1, 0.5, 0.9});

            assertThat(mdt).isCloseTo(1.75, within(1e-12));
        }

        @Test
        @DisplayName("Should return the first slope when it already reaches the target")
        void shouldReturnFirstSlopeWhenAlreadyPowered() {
            assertThat(PowerAnalyzer.minimumDetectableTrend(new double[]{0.5, 1}, new double[]{0.85, 1.0}))
                    .isEqualTo(0.5);
        }

        @Test
        @DisplayName("Should return NaN when the target is never reached")
        void shouldReturnNanWhenNeverReached() {
            assertThat(PowerAnalyzer.minimumDetectableTrend(new double[]{0, 1}, new double[]{0.1, 0.7})).isNaN();
        }

        @Test
        @DisplayName("Should skip rows without a detection rate")
        void shouldSkipNanRows() {
            double mdt = PowerAnalyzer.minimumDetectableTrend(
                    new double[]{0, 1, 2, 3}, new double[]{0.2, Double.NaN, 0.6, 1.0});

            assertThat(mdt).isCloseTo(2.5, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Should reject an unknown slope unit")
        void shouldRejectUnknownUnit() {
            assertThatThrownBy(() -> PowerConfig.builder().slopeUnit("fortnight"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown slope unit");
        }

        @Test
        @DisplayName("Should compute the work estimate as a plain product")
        void shouldEstimateCost() {
            assertThat(PowerAnalyzer.estimateCost(100, 1000, 100, 5, 100)).isEqualTo(5_000_000_000L);
            assertThat(PowerAnalyzer.estimateCost(10, 10, 10, 1, 0)).isEqualTo(1000L);
        }

        @Test
        @DisplayName("Empty slope list should return an empty curve")
        void emptySlopesShouldReturnEmptyCurve() {
            PowerResult result = analyzer.powerCurve(whiteNoise(20, 1L), new double[0], quickConfig().build());

            assertThat(result.getRows()).isEmpty();
            assertThat(result.getMinDetectableTrend()).isNaN();
            assertThat(result.isAborted()).isFalse();
        }
    }

    @Nested
    @DisplayName("Simulation")
    class Simulation {

        @Test
        @DisplayName("Large slope should be detected and zero slope mostly not")
        void shouldSeparateTrendFromNoise() {
            PowerConfig config = quickConfig().nSimulations(10).nSurrogatesInner(39).build();

            PowerResult result = analyzer.powerCurve(whiteNoise(40, 4L), new double[]{0, 0.2}, config);

            double[] rates = result.getDetectionRates();
            assertThat(rates[0]).isLessThanOrEqualTo(0.5);
            assertThat(rates[1]).isGreaterThanOrEqualTo(0.8);
            assertThat(result.getMinDetectableTrend()).isBetween(0.0, 0.2);
            assertThat(result.getNoiseMethod()).isEqualTo(SurrogateMethod.IAAFT);
            assertThat(result.getRows().get(1).getCompletedSimulations()).isEqualTo(10);
        }

        @Test
        @DisplayName("Parallel and sequential runs should give identical rows")
        void parallelismShouldNotChangeResult() {
            TimeSeries series = whiteNoise(30, 6L);
            double[] slopes = {0, 0.1};

            PowerResult sequential = analyzer.powerCurve(series, slopes, quickConfig().parallelism(1).build());
            PowerResult parallel = analyzer.powerCurve(series, slopes, quickConfig().parallelism(3).build());

            assertThat(parallel.getRows()).isEqualTo(sequential.getRows());
            assertThat(parallel.getMinDetectableTrend()).isEqualTo(sequential.getMinDetectableTrend());
        }

        @Test
        @DisplayName("Abort should keep finished rows and leave the rest empty")
        void abortShouldKeepCompletedRows() {
            AtomicInteger calls = new AtomicInteger();

            PowerResult result = analyzer.powerCurve(whiteNoise(30, 2L), new double[]{0, 1, 2},
                    quickConfig().build(), () -> calls.getAndIncrement() >= 4);

            double[] rates = result.getDetectionRates();
            assertThat(rates[0]).isNotNaN();
            assertThat(rates[1]).isNaN();
            assertThat(rates[2]).isNaN();
            assertThat(result.isAborted()).isTrue();
            assertThat(result.hasNote(NoteCode.ABORTED)).isTrue();
        }

        @Test
        @DisplayName("Non-finite slope should leave its row empty with a note")
        void nanSlopeShouldBeNoted() {
            PowerResult result = analyzer.powerCurve(whiteNoise(20, 3L), new double[]{Double.NaN, 0},
                    quickConfig().nSimulations(2).build());

            assertThat(result.getDetectionRates()[0]).isNaN();
            assertThat(result.getDetectionRates()[1]).isNotNaN();
            assertThat(result.hasNote(NoteCode.NAN_SLOPE)).isTrue();
        }

        @Test
        @DisplayName("Slopes in years should be converted to per-second slopes")
        void yearSlopeShouldBeConverted() {
            PowerResult result = analyzer.powerCurve(whiteNoise(20, 3L), new double[]{1},
                    quickConfig().nSimulations(2).slopeUnit(SlopeUnit.YEAR).build());

            assertThat(result.getRows().get(0).getInternalSlope()).isCloseTo(1 / 31_557_600.0, within(1e-20));
            assertThat(result.getSlopeUnit()).isEqualTo(SlopeUnit.YEAR);
        }

        @Test
        @DisplayName("Expensive configuration should warn and honour an immediate abort")
        void expensiveRunShouldWarnAndAbort() {
            PowerConfig config = quickConfig().nSimulations(200).nSurrogatesInner(100_000).build();

            PowerResult result = analyzer.powerCurve(whiteNoise(40, 8L), new double[]{0, 1, 2}, config, () -> true);

            assertThat(result.hasNote(NoteCode.PERFORMANCE_WARNING)).isTrue();
            assertThat(result.hasNote(NoteCode.ABORTED)).isTrue();
            assertThat(result.getDetectionRates()).containsOnly(Double.NaN);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static PowerConfig.Builder quickConfig() {
        return PowerConfig.builder()
                .nSimulations(4)
                .nSurrogatesInner(19)
                .method(SurrogateMethod.AUTO)
                .seed(42L);
    }

    private static TimeSeries whiteNoise(int n, long seed) {
        Well19937c rng = new Well19937c(seed);
        double[] t = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i;
            y[i] = rng.nextGaussian();
        }
        return TimeSeries.of(t, y);
    }
}
