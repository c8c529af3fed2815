package com.trendsentinel.core.bootstrap;

import com.trendsentinel.core.model.BootstrapParams;
import com.trendsentinel.core.model.BootstrapTestResult;
import com.trendsentinel.core.model.SlopeConfidenceInterval;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.random.SeedSequence;
import com.trendsentinel.core.stats.Autocorrelation;
import com.trendsentinel.core.stats.MannKendall;
import com.trendsentinel.core.stats.RankStatistic;
import com.trendsentinel.core.stats.SensSlope;
import com.trendsentinel.core.stats.SlopeEstimator;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Moving-block-bootstrap null model for the trend score and confidence
 * interval for the slope.
 *
 * <p>
 * Both operations sort the rows chronologically (stable), detrend the values
 * with the estimated slope about the median time and resample
 * (residual, censored, kind) triples in blocks while the time axis stays
 * fixed. Blocks keep short-range dependence intact, so the resampled series
 * carry the serial correlation of the data but not its trend.
 * </p>
 *
 * <ul>
 * <li>{@link #testScore} scores the residual resamples directly: they are the
 * no-trend world the observed score is compared with.</li>
 * <li>{@link #confidenceInterval} adds the observed slope back to each
 * resample, re-estimates the slope and returns percentile bounds.</li>
 * </ul>
 *
 * <p>
 * Replicate {@code b} uses its own seed derived from the call seed, so
 * results depend only on the data and the seed.
 * </p>
 *
 * @since 1.0.0
 */
public final class BlockBootstrapTester {

    private static final Logger LOG = LoggerFactory.getLogger(BlockBootstrapTester.class);

    private final RankStatistic rankStatistic;
    private final SlopeEstimator slopeEstimator;

    public BlockBootstrapTester() {
        this(new MannKendall(), new SensSlope());
    }

    public BlockBootstrapTester(RankStatistic rankStatistic, SlopeEstimator slopeEstimator) {
        this.rankStatistic = Objects.requireNonNull(rankStatistic, "rankStatistic must not be null");
        this.slopeEstimator = Objects.requireNonNull(slopeEstimator, "slopeEstimator must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Block-bootstrap significance of the trend score.
     *
     * @param series observed series, at least two rows, any row order
     * @param params block length, replicate count
     * @param seed   resampling seed
     * @return {@code p = mean(|S_b| >= |S_obs|)} with the bootstrap distribution
     */
    public BootstrapTestResult testScore(TimeSeries series, BootstrapParams params, long seed) {
        Prepared prepared = prepare(series, params);
        TimeSeries sorted = prepared.sorted;
        double observed = rankStatistic.score(sorted);

        int n = sorted.size();
        double[] times = sorted.times();
        SeedSequence seeds = SeedSequence.of(seed);
        double[] scores = new double[params.getNBootstrap()];
        for (int b = 0; b < scores.length; b++) {
            int[] idx = BlockBootstrap.resampleIndices(n, prepared.blockSize, seeds.generator(b));
            scores[b] = rankStatistic.score(resample(sorted, prepared.residuals, idx, times, null));
        }

        double threshold = Math.abs(observed);
        int extreme = 0;
        for (double s : scores) {
            if (Math.abs(s) >= threshold) {
                extreme++;
            }
        }
        double pValue = (double) extreme / scores.length;
        double variance = scores.length > 1 ? StatUtils.variance(scores) : 0.0;
        LOG.info("Block bootstrap test: n={}, block={}, B={}, S={}, p={}",
                n, prepared.blockSize, scores.length, observed, pValue);
        return new BootstrapTestResult(pValue, observed, scores, variance, prepared.blockSize, List.of());
    }

    /**
     * Block-bootstrap percentile confidence interval for the slope.
     *
     * @param series observed series, at least two rows, any row order
     * @param params block length, replicate count and {@code alpha}
     * @param seed   resampling seed
     * @return observed slope with {@code (alpha/2, 1 - alpha/2)} percentile bounds
     */
    public SlopeConfidenceInterval confidenceInterval(TimeSeries series, BootstrapParams params, long seed) {
        Prepared prepared = prepare(series, params);
        TimeSeries sorted = prepared.sorted;

        int n = sorted.size();
        double[] times = sorted.times();
        double[] trend = new double[n];
        for (int i = 0; i < n; i++) {
            trend[i] = prepared.slope * prepared.centeredTimes[i];
        }
        SeedSequence seeds = SeedSequence.of(seed);
        double[] slopes = new double[params.getNBootstrap()];
        for (int b = 0; b < slopes.length; b++) {
            int[] idx = BlockBootstrap.resampleIndices(n, prepared.blockSize, seeds.generator(b));
            slopes[b] = slopeEstimator.estimate(resample(sorted, prepared.residuals, idx, times, trend));
        }

        double alpha = params.getAlpha();
        double[] finite = finiteValues(slopes);
        double lower = Double.NaN;
        double upper = Double.NaN;
        if (finite.length > 0) {
            Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
            lower = percentile.evaluate(finite, 100 * alpha / 2);
            upper = percentile.evaluate(finite, 100 * (1 - alpha / 2));
        }
        LOG.info("Block bootstrap slope CI: slope={}, [{}, {}] at alpha={}", prepared.slope, lower, upper, alpha);
        return new SlopeConfidenceInterval(prepared.slope, lower, upper, alpha, slopes, prepared.blockSize);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Prepared prepare(TimeSeries series, BootstrapParams params) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(params, "params must not be null");
        if (series.size() < 2) {
            throw new IllegalArgumentException("series must have at least 2 observations, got: " + series.size());
        }
        TimeSeries sorted = series.select(series.chronologicalOrder());
        int n = sorted.size();
        double[] values = sorted.values();

        int blockSize;
        if (params.isAutoBlockSize()) {
            double[] acf = Autocorrelation.acf(values, (n + 1) / 2);
            blockSize = BlockBootstrap.optimalBlockSize(n, acf);
            LOG.debug("Automatic block size {} for n={}", blockSize, n);
        } else {
            blockSize = params.getBlockSize().getAsInt();
        }

        double slope = slopeEstimator.estimate(sorted);
        if (Double.isNaN(slope)) {
            LOG.debug("Slope undefined, detrending with 0");
            slope = 0.0;
        }
        double[] times = sorted.times();
        double medianTime = new Median().evaluate(times);
        double[] centered = new double[n];
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            centered[i] = times[i] - medianTime;
            residuals[i] = values[i] - slope * centered[i];
        }
        return new Prepared(sorted, blockSize, slope, centered, residuals);
    }

    /**
     * Resampled residual rows on the fixed time axis, plus {@code trend} when
     * given.
     */
    private static TimeSeries resample(TimeSeries sorted, double[] residuals, int[] idx,
                                       double[] times, double[] trend) {
        TimeSeries picked = sorted.select(idx);
        double[] values = new double[idx.length];
        for (int i = 0; i < idx.length; i++) {
            values[i] = residuals[idx[i]] + (trend != null ? trend[i] : 0.0);
        }
        return TimeSeries.censored(times, values, picked.censoredFlags(), picked.kinds());
    }

    private static double[] finiteValues(double[] values) {
        int count = 0;
        double[] out = new double[values.length];
        for (double v : values) {
            if (Double.isFinite(v)) {
                out[count++] = v;
            }
        }
        double[] trimmed = new double[count];
        System.arraycopy(out, 0, trimmed, 0, count);
        return trimmed;
    }

    private static final class Prepared {
        private final TimeSeries sorted;
        private final int blockSize;
        private final double slope;
        private final double[] centeredTimes;
        private final double[] residuals;

        private Prepared(TimeSeries sorted, int blockSize, double slope, double[] centeredTimes,
                         double[] residuals) {
            this.sorted = sorted;
            this.blockSize = blockSize;
            this.slope = slope;
            this.centeredTimes = centeredTimes;
            this.residuals = residuals;
        }
    }

    @Override
    public String toString() {
        return "BlockBootstrapTester{rankStatistic=" + rankStatistic + ", slopeEstimator=" + slopeEstimator + '}';
    }
}
