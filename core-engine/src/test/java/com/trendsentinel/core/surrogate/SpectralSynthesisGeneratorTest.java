package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.config.SpectralConfig;
import com.trendsentinel.core.exception.MissingCapabilityException;
import com.trendsentinel.core.exception.NumericalException;
import com.trendsentinel.core.model.RefinementStatus;
import com.trendsentinel.core.model.SurrogateEnsemble;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.spectral.LombScarglePeriodogram;
import com.trendsentinel.core.stats.Ranks;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SpectralSynthesisGenerator}.
 */
class SpectralSynthesisGeneratorTest {

    private final SpectralSynthesisGenerator generator =
            new SpectralSynthesisGenerator(new LombScarglePeriodogram(), SpectralConfig.defaults());

    private double[] times;
    private double[] values;

    @BeforeEach
    void setUp() {
        Well19937c rng = new Well19937c(21L);
        times = new double[40];
        double t = 0;
        for (int i = 0; i < times.length; i++) {
            // quarter-unit steps keep the times exactly representable after a large offset
            t += 0.25 * (1 + rng.nextInt(8));
            times[i] = t;
        }
        values = new double[times.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.cos(0.3 * times[i]) + 0.5 * rng.nextGaussian();
        }
    }

    @Test
    @DisplayName("Every realization should hold exactly the template values")
    void realizationsShouldKeepValueMultiset() {
        SurrogateEnsemble ensemble = generator.generate(times, values, null, 5, 17L);

        assertThat(ensemble.getMethod()).isEqualTo(SurrogateMethod.SPECTRAL);
        double[] expected = Ranks.sortedCopy(values);
        for (int k = 0; k < ensemble.size(); k++) {
            assertThat(Ranks.sortedCopy(ensemble.getRealization(k))).containsExactly(expected);
            assertThat(ensemble.getStatus(k)).isEqualTo(RefinementStatus.MAX_ITER_REACHED);
        }
        assertThat(ensemble.getNotes()).isEmpty();
    }

    @Test
    @DisplayName("Same seed should reproduce the ensemble")
    void sameSeedShouldReproduce() {
        SurrogateEnsemble first = generator.generate(times, values, null, 3, 4L);
        SurrogateEnsemble second = generator.generate(times, values, null, 3, 4L);
        SurrogateEnsemble other = generator.generate(times, values, null, 3, 5L);

        assertThat(first.getRealization(2)).containsExactly(second.getRealization(2));
        assertThat(first.getRealization(0)).isNotEqualTo(other.getRealization(0));
    }

    @Test
    @DisplayName("Refinement should end every realization in a terminal state")
    void refinementShouldTerminate() {
        SpectralSynthesisGenerator refining = new SpectralSynthesisGenerator(new LombScarglePeriodogram(),
                SpectralConfig.builder().maxIter(3).build());

        SurrogateEnsemble ensemble = refining.generate(times, values, null, 4, 8L);

        for (int k = 0; k < ensemble.size(); k++) {
            assertThat(ensemble.getStatus(k).isTerminal()).isTrue();
            assertThat(Ranks.sortedCopy(ensemble.getRealization(k))).containsExactly(Ranks.sortedCopy(values));
        }
    }

    @Test
    @DisplayName("Large time offsets should not change the result")
    void timeOffsetShouldNotMatter() {
        double[] offset = new double[times.length];
        for (int i = 0; i < times.length; i++) {
            offset[i] = times[i] + 1.7e9;
        }

        SurrogateEnsemble base = generator.generate(times, values, null, 2, 31L);
        SurrogateEnsemble shifted = generator.generate(offset, values, null, 2, 31L);

        assertThat(shifted.getRealization(1)).containsExactly(base.getRealization(1));
    }

    @Test
    @DisplayName("Should fail without a periodogram provider")
    void shouldFailWithoutProvider() {
        SpectralSynthesisGenerator bare = new SpectralSynthesisGenerator(null, SpectralConfig.defaults());

        assertThatThrownBy(() -> bare.generate(times, values, null, 2, 1L))
                .isInstanceOf(MissingCapabilityException.class)
                .satisfies(e -> assertThat(((MissingCapabilityException) e).getCapability())
                        .isEqualTo("periodogram"));
    }

    @Test
    @DisplayName("Constant template should yield copies even without a provider")
    void constantTemplateShouldYieldCopies() {
        SpectralSynthesisGenerator bare = new SpectralSynthesisGenerator(null, SpectralConfig.defaults());
        double[] constant = new double[times.length];
        java.util.Arrays.fill(constant, 7.0);

        SurrogateEnsemble ensemble = bare.generate(times, constant, null, 2, 1L);

        assertThat(ensemble.getRealization(0)).containsExactly(constant);
        assertThat(ensemble.countStatus(RefinementStatus.CONVERGED)).isEqualTo(2);
    }

    @Test
    @DisplayName("Non-finite values should surface as a numerical error")
    void nonFiniteValuesShouldFail() {
        double[] broken = values.clone();
        broken[5] = Double.NaN;

        assertThatThrownBy(() -> generator.generate(times, broken, null, 2, 1L))
                .isInstanceOf(NumericalException.class);
    }

    @Test
    @DisplayName("Synthesis band should drop bins slower than the baseline and above the mean Nyquist frequency")
    void synthesisBandShouldSpanBaselineToNyquist() {
        double[] regular = new double[64];
        for (int i = 0; i < regular.length; i++) {
            regular[i] = i;
        }
        double[] grid = new LombScarglePeriodogram().frequencyGrid(regular, SpectralConfig.defaults());

        double[] band = SpectralSynthesisGenerator.synthesisBand(regular, grid);

        assertThat(grid[0]).isLessThan(1.0 / 63);
        assertThat(grid[grid.length - 1]).isGreaterThan(0.5);
        assertThat(band).isNotEmpty().hasSizeLessThan(grid.length);
        assertThat(band[0]).isGreaterThanOrEqualTo(1.0 / 63 * (1 - 1e-9));
        assertThat(band[band.length - 1]).isLessThanOrEqualTo(0.5 * (1 + 1e-9));
    }

    @Test
    @DisplayName("Synthesis band should fall back to the whole grid when no bin qualifies")
    void synthesisBandShouldFallBackWhenEmpty() {
        double[] pair = {0, 10};
        double[] grid = {0.01, 0.03, 0.05, 0.07, 0.09};

        assertThat(SpectralSynthesisGenerator.synthesisBand(pair, grid)).containsExactly(grid);
    }

    @Test
    @DisplayName("Shift should move the earliest time to zero")
    void shiftShouldAnchorAtZero() {
        assertThat(SpectralSynthesisGenerator.shift(new double[]{5, 3, 9})).containsExactly(2, 0, 6);
    }
}
