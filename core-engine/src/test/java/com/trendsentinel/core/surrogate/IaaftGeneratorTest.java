package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.config.IaaftConfig;
import com.trendsentinel.core.exception.NumericalException;
import com.trendsentinel.core.model.NoteCode;
import com.trendsentinel.core.model.RefinementStatus;
import com.trendsentinel.core.model.SurrogateEnsemble;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.spectral.Dft;
import com.trendsentinel.core.stats.Ranks;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IaaftGenerator}.
 */
class IaaftGeneratorTest {

    private final IaaftGenerator generator = new IaaftGenerator();

    @Test
    @DisplayName("Every realization should be a permutation of the template")
    void realizationsShouldKeepValueMultiset() {
        double[] template = noisySinusoid(64, 3, 11L);

        SurrogateEnsemble ensemble = generator.generate(template, 10, 5L);

        assertThat(ensemble.getMethod()).isEqualTo(SurrogateMethod.IAAFT);
        assertThat(ensemble.size()).isEqualTo(10);
        double[] expected = Ranks.sortedCopy(template);
        for (int k = 0; k < ensemble.size(); k++) {
            assertThat(Ranks.sortedCopy(ensemble.getRealization(k))).containsExactly(expected);
            assertThat(ensemble.getStatus(k).isTerminal()).isTrue();
        }
    }

    @Test
    @DisplayName("Realizations should keep the dominant frequency of the template")
    void realizationsShouldKeepDominantFrequency() {
        double[] template = noisySinusoid(128, 5, 3L);

        SurrogateEnsemble ensemble = generator.generate(template, 5, 99L);

        for (int k = 0; k < ensemble.size(); k++) {
            assertThat(dominantBin(ensemble.getRealization(k))).isEqualTo(5);
        }
    }

    @Test
    @DisplayName("Realizations should differ from the template ordering")
    void realizationsShouldBeShuffled() {
        double[] template = noisySinusoid(64, 2, 1L);

        SurrogateEnsemble ensemble = generator.generate(template, 3, 8L);

        assertThat(ensemble.getRealization(0)).isNotEqualTo(template);
        assertThat(ensemble.getRealization(0)).isNotEqualTo(ensemble.getRealization(1));
    }

    @Test
    @DisplayName("Same seed should give identical ensembles")
    void sameSeedShouldReproduce() {
        double[] template = noisySinusoid(50, 4, 2L);

        SurrogateEnsemble first = generator.generate(template, 4, 123L);
        SurrogateEnsemble second = generator.generate(template, 4, 123L);

        for (int k = 0; k < 4; k++) {
            assertThat(first.getRealization(k)).containsExactly(second.getRealization(k));
            assertThat(first.getStatus(k)).isEqualTo(second.getStatus(k));
        }
    }

    @Test
    @DisplayName("Constant template should yield converged copies")
    void constantTemplateShouldYieldCopies() {
        double[] template = {2.5, 2.5, 2.5, 2.5};

        SurrogateEnsemble ensemble = generator.generate(template, 3, 1L);

        assertThat(ensemble.getRealization(2)).containsExactly(template);
        assertThat(ensemble.countStatus(RefinementStatus.CONVERGED)).isEqualTo(3);
        assertThat(ensemble.getNotes()).isEmpty();
    }

    @Test
    @DisplayName("A NaN in the template should fail instead of yielding copies")
    void nanTemplateShouldFail() {
        double[] template = noisySinusoid(32, 2, 4L);
        template[3] = Double.NaN;

        assertThatThrownBy(() -> generator.generate(template, 3, 1L))
                .isInstanceOf(NumericalException.class)
                .hasMessageContaining("index 3");
    }

    @Test
    @DisplayName("An all-NaN template should fail")
    void allNanTemplateShouldFail() {
        double[] template = new double[16];
        java.util.Arrays.fill(template, Double.NaN);

        assertThatThrownBy(() -> generator.generate(template, 2, 1L))
                .isInstanceOf(NumericalException.class)
                .hasMessageContaining("index 0");
    }

    @Test
    @DisplayName("Single iteration budget should report non-convergence")
    void tightBudgetShouldReportNotConverged() {
        IaaftGenerator oneStep = new IaaftGenerator(IaaftConfig.builder().maxIter(1).tolerance(1e-12).build());

        SurrogateEnsemble ensemble = oneStep.generate(noisySinusoid(64, 3, 4L), 4, 6L);

        assertThat(ensemble.getNotes()).extracting(n -> n.getCode()).containsExactly(NoteCode.NOT_CONVERGED);
        assertThat(ensemble.countStatus(RefinementStatus.CONVERGED)).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive surrogate count")
    void shouldRejectNonPositiveCount() {
        assertThatThrownBy(() -> generator.generate(new double[]{1, 2, 3}, 0, 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("count");
    }

    @Test
    @DisplayName("Stepping a terminal state should return it unchanged")
    void terminalStepShouldBeIdentity() {
        double[] template = noisySinusoid(16, 2, 5L);
        IaaftIteration done = new IaaftIteration(template, 0.0, 3, RefinementStatus.CONVERGED);

        IaaftIteration next = IaaftGenerator.step(done, Dft.amplitudes(template), Ranks.sortedCopy(template),
                StatUtils.populationVariance(template), IaaftConfig.defaults());

        assertThat(next).isSameAs(done);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[] noisySinusoid(int n, int cycles, long seed) {
        Well19937c rng = new Well19937c(seed);
        double[] x = new double[n];
        for (int j = 0; j < n; j++) {
            x[j] = 2 * Math.sin(2 * Math.PI * cycles * j / n) + 0.3 * rng.nextGaussian();
        }
        return x;
    }

    private static int dominantBin(double[] x) {
        double[] amp = Dft.amplitudes(x);
        int best = 1;
        for (int k = 2; k <= x.length / 2; k++) {
            if (amp[k] > amp[best]) {
                best = k;
            }
        }
        return best;
    }
}
