package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.config.SpectralConfig;
import com.trendsentinel.core.exception.MissingCapabilityException;
import com.trendsentinel.core.exception.NumericalException;
import com.trendsentinel.core.model.CensorKind;
import com.trendsentinel.core.model.Note;
import com.trendsentinel.core.model.NoteCode;
import com.trendsentinel.core.model.SignificanceResult;
import com.trendsentinel.core.model.SurrogateEnsemble;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.spectral.LombScarglePeriodogram;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SurrogateSignificanceTester}.
 */
class SurrogateSignificanceTesterTest {

    private final SurrogateSignificanceTester tester = SurrogateSignificanceTester.builder().build();

    @Nested
    @DisplayName("Significance")
    class Significance {

        @Test
        @DisplayName("White noise without a trend should not be significant")
        void whiteNoiseShouldNotBeSignificant() {
            Well19937c rng = new Well19937c(42L);
            double[] t = regularTimes(100);
            double[] y = new double[100];
            for (int i = 0; i < y.length; i++) {
                y[i] = rng.nextGaussian();
            }

            SignificanceResult result = tester.test(TimeSeries.of(t, y), SurrogateMethod.IAAFT, 199, 42L);

            assertThat(result.getPValue()).isGreaterThan(0.05);
            assertThat(result.isSignificant()).isFalse();
            assertThat(result.getMethod()).isEqualTo(SurrogateMethod.IAAFT);
            assertThat(result.getSurrogateScores()).hasSize(199);
        }

        @Test
        @DisplayName("Strong linear trend should be significant")
        void strongTrendShouldBeSignificant() {
            Well19937c rng = new Well19937c(42L);
            double[] t = regularTimes(100);
            double[] y = new double[100];
            for (int i = 0; i < y.length; i++) {
                y[i] = 0.1 * t[i] + rng.nextGaussian();
            }

            SignificanceResult result = tester.test(TimeSeries.of(t, y), SurrogateMethod.AUTO, 199, 42L);

            assertThat(result.getPValue()).isLessThan(0.05);
            assertThat(result.isSignificant()).isTrue();
            assertThat(result.getOriginalScore()).isPositive();
        }

        @Test
        @DisplayName("IAAFT rejection rate on trend-free noise should stay near the nominal level")
        void iaaftRejectionRateShouldBeCalibrated() {
            double rate = rejectionRate(tester, regularTimes(64), SurrogateMethod.IAAFT, 2024L);

            assertThat(rate).isBetween(0.02, 0.08);
        }

        @Test
        @DisplayName("Spectral rejection rate on irregularly sampled noise should stay near the nominal level")
        void spectralRejectionRateShouldBeCalibrated() {
            SurrogateSignificanceTester spectral = SurrogateSignificanceTester.builder()
                    .periodogramProvider(new LombScarglePeriodogram())
                    .build();

            double rate = rejectionRate(spectral, jitteredTimes(64, 7L), SurrogateMethod.SPECTRAL, 2025L);

            assertThat(rate).isBetween(0.02, 0.08);
        }

        @Test
        @DisplayName("Constant input should return p = 1 without generating surrogates")
        void constantInputShouldReturnOne() {
            double[] y = new double[50];
            java.util.Arrays.fill(y, 3.0);

            SignificanceResult result = tester.test(TimeSeries.of(regularTimes(50), y), SurrogateMethod.AUTO, 20, 1L);

            assertThat(result.getPValue()).isEqualTo(1.0);
            assertThat(result.getOriginalScore()).isZero();
            assertThat(result.getSurrogateScores()).hasSize(20).containsOnly(0.0);
            assertThat(result.hasNote(NoteCode.CONSTANT_INPUT)).isTrue();
        }

        @Test
        @DisplayName("Two observations should still produce a valid result")
        void twoObservationsShouldWork() {
            SignificanceResult result = tester.test(TimeSeries.of(new double[]{0, 1}, new double[]{1, 2}),
                    SurrogateMethod.IAAFT, 9, 1L);

            assertThat(result.getOriginalScore()).isEqualTo(1.0);
            assertThat(result.getSurrogateScores()).hasSize(9);
            assertThat(result.getPValue()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        }

        @Test
        @DisplayName("Same seed should reproduce the result and row order should not matter")
        void shouldBeDeterministicAndOrderFree() {
            double[] t = regularTimes(30);
            double[] y = new double[30];
            for (int i = 0; i < y.length; i++) {
                y[i] = Math.sin(i) + 0.05 * i;
            }
            TimeSeries series = TimeSeries.of(t, y);
            int[] reversed = new int[30];
            for (int i = 0; i < reversed.length; i++) {
                reversed[i] = 29 - i;
            }

            SignificanceResult first = tester.test(series, SurrogateMethod.IAAFT, 50, 11L);
            SignificanceResult second = tester.test(series.select(reversed), SurrogateMethod.IAAFT, 50, 11L);

            assertThat(second.getPValue()).isEqualTo(first.getPValue());
            assertThat(second.getSurrogateScores()).containsExactly(first.getSurrogateScores());
        }
    }

    @Nested
    @DisplayName("Non-finite input")
    class NonFiniteInput {

        @Test
        @DisplayName("A single NaN in a trending series should fail instead of returning p = 1")
        void singleNanShouldFail() {
            double[] y = new double[40];
            for (int i = 0; i < y.length; i++) {
                y[i] = i + Math.sin(i);
            }
            y[10] = Double.NaN;

            assertThatThrownBy(() -> tester.test(TimeSeries.of(regularTimes(40), y), SurrogateMethod.IAAFT, 99, 1L))
                    .isInstanceOf(NumericalException.class)
                    .hasMessageContaining("row 10");
        }

        @Test
        @DisplayName("All-NaN input should fail for both methods")
        void allNanShouldFail() {
            double[] y = new double[20];
            java.util.Arrays.fill(y, Double.NaN);
            TimeSeries series = TimeSeries.of(regularTimes(20), y);
            SurrogateSignificanceTester spectral = SurrogateSignificanceTester.builder()
                    .periodogramProvider(new LombScarglePeriodogram())
                    .build();

            assertThatThrownBy(() -> tester.test(series, SurrogateMethod.IAAFT, 19, 1L))
                    .isInstanceOf(NumericalException.class)
                    .hasMessageContaining("row 0");
            assertThatThrownBy(() -> spectral.test(series, SurrogateMethod.SPECTRAL, 19, 1L))
                    .isInstanceOf(NumericalException.class);
        }

        @Test
        @DisplayName("Infinite values should fail with the original row index")
        void infiniteValueShouldNameRow() {
            double[] t = {3, 0, 2, 1};
            double[] y = {1, 2, Double.POSITIVE_INFINITY, 4};

            assertThatThrownBy(() -> tester.test(TimeSeries.of(t, y), SurrogateMethod.IAAFT, 9, 1L))
                    .isInstanceOf(NumericalException.class)
                    .hasMessageContaining("row 2");
        }
    }

    @Nested
    @DisplayName("Diagnostics")
    class Diagnostics {

        @Test
        @DisplayName("Retained ensemble should carry one score per realization")
        void retainedEnsembleShouldCarryScores() {
            SurrogateSignificanceTester retaining = SurrogateSignificanceTester.builder()
                    .retainEnsemble(true)
                    .build();
            double[] y = new double[30];
            for (int i = 0; i < y.length; i++) {
                y[i] = Math.cos(0.7 * i) + 0.02 * i;
            }

            SignificanceResult result = retaining.test(TimeSeries.of(regularTimes(30), y),
                    SurrogateMethod.IAAFT, 25, 4L);

            assertThat(result.getEnsemble()).isPresent();
            SurrogateEnsemble ensemble = result.getEnsemble().get();
            assertThat(ensemble.size()).isEqualTo(25);
            assertThat(ensemble.hasScores()).isTrue();
            assertThat(ensemble.getScores()).containsExactly(result.getSurrogateScores());
        }

        @Test
        @DisplayName("Ensemble should be discarded unless retention is requested")
        void ensembleShouldBeDiscardedByDefault() {
            double[] y = {3, 1, 4, 1, 5, 9, 2, 6};

            SignificanceResult result = tester.test(TimeSeries.of(regularTimes(8), y), SurrogateMethod.IAAFT, 9, 2L);

            assertThat(result.getEnsemble()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Method resolution")
    class MethodResolution {

        private final double[] unevenTimes = {0, 1, 3, 4, 8, 9, 10, 15, 16, 20, 21, 27};

        @Test
        @DisplayName("AUTO on uneven sampling without a provider should fall back to IAAFT")
        void autoWithoutProviderShouldFallBack() {
            List<Note> notes = new ArrayList<>();

            SurrogateMethod resolved = tester.resolveMethod(SurrogateMethod.AUTO, unevenTimes, notes);

            assertThat(resolved).isEqualTo(SurrogateMethod.IAAFT);
            assertThat(notes).extracting(Note::getCode).containsExactly(NoteCode.METHOD_FALLBACK);
        }

        @Test
        @DisplayName("AUTO on uneven sampling with a provider should choose spectral synthesis")
        void autoWithProviderShouldChooseSpectral() {
            SurrogateSignificanceTester withProvider = SurrogateSignificanceTester.builder()
                    .periodogramProvider(new LombScarglePeriodogram())
                    .build();
            double[] y = new double[unevenTimes.length];
            for (int i = 0; i < y.length; i++) {
                y[i] = Math.cos(unevenTimes[i]) + 0.1 * unevenTimes[i];
            }

            SignificanceResult result = withProvider.test(TimeSeries.of(unevenTimes, y), SurrogateMethod.AUTO, 19, 5L);

            assertThat(result.getMethod()).isEqualTo(SurrogateMethod.SPECTRAL);
            assertThat(result.getNotes()).isEmpty();
            assertThat(result.getPValue()).isBetween(1 / 20.0, 1.0);
        }

        @Test
        @DisplayName("AUTO on uniform sampling should choose IAAFT silently")
        void autoOnUniformShouldChooseIaaft() {
            List<Note> notes = new ArrayList<>();

            assertThat(tester.resolveMethod(SurrogateMethod.AUTO, regularTimes(10), notes))
                    .isEqualTo(SurrogateMethod.IAAFT);
            assertThat(notes).isEmpty();
        }

        @Test
        @DisplayName("SPECTRAL without a provider should fail unless fallback is enabled")
        void spectralWithoutProvider() {
            assertThatThrownBy(() -> tester.resolveMethod(SurrogateMethod.SPECTRAL, unevenTimes, new ArrayList<>()))
                    .isInstanceOf(MissingCapabilityException.class);

            SurrogateSignificanceTester lenient = SurrogateSignificanceTester.builder()
                    .spectralConfig(SpectralConfig.builder().fallbackToIaaft(true).build())
                    .build();
            List<Note> notes = new ArrayList<>();
            assertThat(lenient.resolveMethod(SurrogateMethod.SPECTRAL, unevenTimes, notes))
                    .isEqualTo(SurrogateMethod.IAAFT);
            assertThat(notes).extracting(Note::getCode).contains(NoteCode.METHOD_FALLBACK);
        }

        @Test
        @DisplayName("Explicit IAAFT on uneven sampling should be flagged")
        void explicitIaaftOnUnevenShouldBeFlagged() {
            List<Note> notes = new ArrayList<>();

            tester.resolveMethod(SurrogateMethod.IAAFT, unevenTimes, notes);

            assertThat(notes).extracting(Note::getCode).containsExactly(NoteCode.UNEVEN_SAMPLING_IAAFT);
        }
    }

    @Nested
    @DisplayName("Censoring")
    class Censoring {

        @Test
        @DisplayName("Censored input should be noted, including a score change from imputation")
        void censoredInputShouldBeNoted() {
            TimeSeries series = TimeSeries.censored(
                    regularTimes(6),
                    new double[]{10, 6, 7, 8, 9, 11},
                    new boolean[]{true, false, false, false, false, false},
                    new CensorKind[]{CensorKind.LEFT, null, null, null, null, null});

            SignificanceResult result = tester.test(series, SurrogateMethod.IAAFT, 30, 3L);

            assertThat(result.getOriginalScore()).isEqualTo(11.0);
            assertThat(result.hasNote(NoteCode.CENSORED_SURROGATES)).isTrue();
            assertThat(result.hasNote(NoteCode.IMPUTATION_CHANGED_STATISTIC)).isTrue();
        }
    }

    @Nested
    @DisplayName("Arguments and helpers")
    class Arguments {

        @Test
        @DisplayName("Should reject a non-positive surrogate count and a single observation")
        void shouldRejectBadArguments() {
            TimeSeries series = TimeSeries.of(regularTimes(5), new double[]{1, 2, 3, 4, 5});

            assertThatThrownBy(() -> tester.test(series, SurrogateMethod.IAAFT, 0, 1L))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nSurrogates");
            assertThatThrownBy(() -> tester.test(TimeSeries.of(new double[]{0}, new double[]{1}),
                    SurrogateMethod.IAAFT, 10, 1L))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("at least 2");
        }

        @Test
        @DisplayName("p-value should count ties with the observed score as extreme")
        void pValueShouldCountTies() {
            assertThat(SurrogateSignificanceTester.pValue(4, new double[]{-4, 1, 5, 2}))
                    .isCloseTo(3 / 5.0, within(1e-12));
            assertThat(SurrogateSignificanceTester.pValue(10, new double[]{0, 1}))
                    .isCloseTo(1 / 3.0, within(1e-12));
        }

        @Test
        @DisplayName("z-score should be zero when surrogate scores do not vary")
        void zScoreShouldHandleZeroSpread() {
            assertThat(SurrogateSignificanceTester.zScore(5, new double[]{2, 2, 2})).isZero();
            assertThat(SurrogateSignificanceTester.zScore(5, new double[]{1})).isZero();
            assertThat(SurrogateSignificanceTester.zScore(3, new double[]{-1, 1})).isCloseTo(3 / Math.sqrt(2),
                    within(1e-12));
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[] regularTimes(int n) {
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i;
        }
        return t;
    }

    private static double[] jitteredTimes(int n, long seed) {
        Well19937c rng = new Well19937c(seed);
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i + 0.8 * (rng.nextDouble() - 0.5);
        }
        return t;
    }

    /**
     * Fraction of 400 white-noise draws rejected at 5% with 99 surrogates.
     * With 99 surrogates {@code p <= 0.05} has exact size 0.05 under
     * exchangeability.
     */
    private static double rejectionRate(SurrogateSignificanceTester tester, double[] t,
                                        SurrogateMethod method, long seed) {
        Well19937c rng = new Well19937c(seed);
        int draws = 400;
        int rejections = 0;
        for (int d = 0; d < draws; d++) {
            double[] y = new double[t.length];
            for (int i = 0; i < y.length; i++) {
                y[i] = rng.nextGaussian();
            }
            if (tester.test(TimeSeries.of(t, y), method, 99, d).getPValue() <= 0.05) {
                rejections++;
            }
        }
        return rejections / (double) draws;
    }
}
