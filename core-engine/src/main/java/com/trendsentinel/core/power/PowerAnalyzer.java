package com.trendsentinel.core.power;

import com.trendsentinel.core.config.PowerConfig;
import com.trendsentinel.core.model.Note;
import com.trendsentinel.core.model.NoteCode;
import com.trendsentinel.core.model.PowerResult;
import com.trendsentinel.core.model.SignificanceResult;
import com.trendsentinel.core.model.SlopePower;
import com.trendsentinel.core.model.SurrogateEnsemble;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.random.SeedSequence;
import com.trendsentinel.core.spectral.LombScarglePeriodogram;
import com.trendsentinel.core.surrogate.SurrogateSignificanceTester;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Monte Carlo power of the surrogate trend test against colored noise.
 *
 * <h3>Procedure</h3>
 * <ol>
 * <li>Optionally remove the least-squares line from the input so the noise
 * model carries no trend.</li>
 * <li>Draw {@code nSimulations} noise realizations with the resolved
 * surrogate method (the noise bank).</li>
 * <li>For every candidate slope and realization inject
 * {@code slope * (t - mean(t))} and run the surrogate test with
 * {@code nSurrogatesInner} surrogates; a detection is {@code p < alpha}.</li>
 * <li>The minimum detectable trend is the first linear crossing of
 * {@link PowerResult#TARGET_POWER} along the candidate slopes.</li>
 * </ol>
 *
 * <h3>Seeding and parallelism</h3>
 * <p>
 * The noise bank uses stream 0 of the root {@link SeedSequence}; the inner
 * test for slope {@code s} and realization {@code i} uses stream
 * {@code 1 + s * nSimulations + i}. Seeds are fixed before any work is
 * scheduled, so results are bit-identical at any {@code parallelism}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PowerAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(PowerAnalyzer.class);

    /** Estimated work units above which a run is flagged as expensive. */
    public static final double COST_WARNING_THRESHOLD = 1e8;

    private final SurrogateSignificanceTester tester;

    /**
     * Analyzer with a Mann-Kendall tester and the Lomb-Scargle periodogram.
     */
    public PowerAnalyzer() {
        this(SurrogateSignificanceTester.builder()
                .periodogramProvider(new LombScarglePeriodogram())
                .build());
    }

    public PowerAnalyzer(SurrogateSignificanceTester tester) {
        this.tester = Objects.requireNonNull(tester, "tester must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Estimate the power curve.
     *
     * @see #powerCurve(TimeSeries, double[], PowerConfig, BooleanSupplier)
     */
    public PowerResult powerCurve(TimeSeries series, double[] slopes, PowerConfig config) {
        return powerCurve(series, slopes, config, () -> false);
    }

    /**
     * Estimate the power curve, checking {@code abortRequested} before each
     * simulation.
     *
     * <p>
     * On abort, completed slope rows are kept, the others have a NaN
     * detection rate, and the result is flagged {@code aborted} with an
     * {@link NoteCode#ABORTED} note. With {@code parallelism > 1} the
     * supplier is polled from worker threads.
     * </p>
     *
     * @param series         template series (noise model), at least two rows
     * @param slopes         candidate slopes in {@code config.getSlopeUnit()} units
     * @param config         simulation settings
     * @param abortRequested cooperative cancellation flag
     * @return power per slope and the minimum detectable trend
     */
    public PowerResult powerCurve(TimeSeries series, double[] slopes, PowerConfig config,
                                  BooleanSupplier abortRequested) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(slopes, "slopes must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(abortRequested, "abortRequested must not be null");
        if (series.size() < 2) {
            throw new IllegalArgumentException("series must have at least 2 observations, got: " + series.size());
        }

        TimeSeries sorted = series.select(series.chronologicalOrder());
        double[] times = sorted.times();
        int n = times.length;
        int nSim = config.getNSimulations();

        List<Note> notes = new ArrayList<>();
        SurrogateMethod method = tester.resolveMethod(config.getMethod(), times, notes);
        PowerResult.Builder result = PowerResult.builder()
                .nSimulations(nSim)
                .nSurrogatesInner(config.getNSurrogatesInner())
                .alpha(config.getAlpha())
                .noiseMethod(method)
                .slopeUnit(config.getSlopeUnit());

        if (slopes.length == 0) {
            return result.notes(notes).build();
        }

        long cost = estimateCost(n, config.getNSurrogatesInner(), nSim, slopes.length, iterationsOf(method));
        if (cost > COST_WARNING_THRESHOLD) {
            String message = "Power analysis is expensive (~" + cost
                    + " work units); consider fewer simulations, surrogates or slopes";
            LOG.warn(message);
            notes.add(Note.of(NoteCode.PERFORMANCE_WARNING, message));
        }

        SeedSequence seeds = config.getSeed().isPresent()
                ? SeedSequence.of(config.getSeed().getAsLong())
                : SeedSequence.random();

        double[] template = config.isDetrendInput() ? detrend(times, sorted.values()) : sorted.values();
        SurrogateEnsemble noiseBank = tester.generatorFor(method)
                .generate(times, template, null, nSim, seeds.derive(0));
        notes.addAll(noiseBank.getNotes());

        double meanTime = StatUtils.mean(times);
        double[] centered = new double[n];
        for (int i = 0; i < n; i++) {
            centered[i] = times[i] - meanTime;
        }

        // --- Schedule simulations ---
        double[][] noise = new double[nSim][];
        for (int i = 0; i < nSim; i++) {
            noise[i] = noiseBank.getRealization(i);
        }
        int[][] detections = new int[slopes.length][];
        double[] internal = new double[slopes.length];
        List<SimulationTask> tasks = new ArrayList<>();
        for (int s = 0; s < slopes.length; s++) {
            internal[s] = config.getSlopeUnit().toPerSecond(slopes[s]);
            if (!Double.isFinite(slopes[s])) {
                String message = "Slope at index " + s + " is " + slopes[s] + "; row left empty";
                LOG.warn(message);
                notes.add(Note.of(NoteCode.NAN_SLOPE, message));
                continue;
            }
            detections[s] = new int[]{0, 0};
            for (int i = 0; i < nSim; i++) {
                long seed = seeds.derive(1L + (long) s * nSim + i);
                tasks.add(new SimulationTask(s, internal[s], noise[i], seed));
            }
        }

        AtomicBoolean aborted = new AtomicBoolean(false);
        run(tasks, config, times, centered, method, abortRequested, aborted, detections);

        // --- Assemble rows ---
        double[] rates = new double[slopes.length];
        for (int s = 0; s < slopes.length; s++) {
            if (detections[s] == null || detections[s][1] < nSim) {
                rates[s] = Double.NaN;
                result.row(SlopePower.notSimulated(slopes[s], internal[s]));
            } else {
                rates[s] = (double) detections[s][0] / nSim;
                result.row(new SlopePower(slopes[s], internal[s], detections[s][0], nSim, rates[s]));
            }
        }
        if (aborted.get()) {
            String message = "Power analysis aborted; unfinished slopes have NaN power";
            LOG.warn(message);
            notes.add(Note.of(NoteCode.ABORTED, message));
        }

        double mdt = minimumDetectableTrend(slopes, rates);
        LOG.info("Power analysis: method={}, n={}, simulations={}, slopes={}, MDT={}{}",
                method, n, nSim, slopes.length, mdt, aborted.get() ? " (aborted)" : "");
        return result
                .minDetectableTrend(mdt)
                .aborted(aborted.get())
                .notes(notes)
                .build();
    }

    /**
     * First linear crossing of {@link PowerResult#TARGET_POWER}. Rows with a
     * NaN slope or rate are skipped. If the first usable row already reaches
     * the target its slope is returned.
     *
     * @param slopes candidate slopes, in evaluation order
     * @param rates  detection rate per slope
     * @return the interpolated slope, or NaN if the target is never reached
     */
    public static double minimumDetectableTrend(double[] slopes, double[] rates) {
        if (slopes.length != rates.length) {
            throw new IllegalArgumentException("Expected one rate per slope: " + rates.length + " != " + slopes.length);
        }
        int previous = -1;
        for (int k = 0; k < slopes.length; k++) {
            if (Double.isNaN(slopes[k]) || Double.isNaN(rates[k])) {
                continue;
            }
            if (rates[k] >= PowerResult.TARGET_POWER) {
                if (previous < 0) {
                    return slopes[k];
                }
                double x0 = slopes[previous];
                double y0 = rates[previous];
                double y1 = rates[k];
                if (y1 == y0) {
                    return x0;
                }
                return x0 + (PowerResult.TARGET_POWER - y0) * (slopes[k] - x0) / (y1 - y0);
            }
            previous = k;
        }
        return Double.NaN;
    }

    /**
     * @return {@code samples * inner * simulations * slopes * iterations}
     */
    public static long estimateCost(int samples, int innerSurrogates, int simulations, int slopes, int iterations) {
        return (long) samples * innerSurrogates * simulations * slopes * Math.max(iterations, 1);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void run(List<SimulationTask> tasks, PowerConfig config, double[] times, double[] centered,
                     SurrogateMethod method, BooleanSupplier abortRequested, AtomicBoolean aborted,
                     int[][] detections) {
        if (config.getParallelism() == 1 || tasks.size() < 2) {
            for (SimulationTask task : tasks) {
                Boolean detected = simulate(task, config, times, centered, method, abortRequested, aborted);
                record(detections, task, detected);
            }
            return;
        }

        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(config.getParallelism(), r -> {
            Thread t = new Thread(r, "power-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Boolean>> futures = new ArrayList<>(tasks.size());
            for (SimulationTask task : tasks) {
                futures.add(workers.submit(
                        () -> simulate(task, config, times, centered, method, abortRequested, aborted)));
            }
            for (int k = 0; k < futures.size(); k++) {
                record(detections, tasks.get(k), futures.get(k).get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Power analysis interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Power simulation failed", e.getCause());
        } finally {
            workers.shutdownNow();
        }
    }

    /**
     * @return whether the trend was detected, or {@code null} if skipped on abort
     */
    private Boolean simulate(SimulationTask task, PowerConfig config, double[] times, double[] centered,
                             SurrogateMethod method, BooleanSupplier abortRequested, AtomicBoolean aborted) {
        if (aborted.get()) {
            return null;
        }
        if (abortRequested.getAsBoolean()) {
            aborted.set(true);
            return null;
        }
        double[] noise = task.noise;
        double[] values = new double[noise.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = noise[i] + task.internalSlope * centered[i];
        }
        SignificanceResult inner = tester.test(TimeSeries.of(times, values), null, method,
                config.getNSurrogatesInner(), task.seed);
        return inner.getPValue() < config.getAlpha();
    }

    private static void record(int[][] detections, SimulationTask task, Boolean detected) {
        if (detected == null) {
            return;
        }
        int[] row = detections[task.slopeIndex];
        if (detected) {
            row[0]++;
        }
        row[1]++;
    }

    private int iterationsOf(SurrogateMethod method) {
        return method == SurrogateMethod.SPECTRAL
                ? tester.getSpectralConfig().getMaxIter()
                : tester.getIaaftConfig().getMaxIter();
    }

    /**
     * Residuals of the least-squares line, fitted on mean-centered times.
     */
    static double[] detrend(double[] times, double[] values) {
        double meanTime = StatUtils.mean(times);
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < times.length; i++) {
            regression.addData(times[i] - meanTime, values[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        if (Double.isNaN(slope)) {
            return values.clone();
        }
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] - (intercept + slope * (times[i] - meanTime));
        }
        return out;
    }

    private static final class SimulationTask {
        private final int slopeIndex;
        private final double internalSlope;
        private final double[] noise;
        private final long seed;

        private SimulationTask(int slopeIndex, double internalSlope, double[] noise, long seed) {
            this.slopeIndex = slopeIndex;
            this.internalSlope = internalSlope;
            this.noise = noise;
            this.seed = seed;
        }
    }

    @Override
    public String toString() {
        return "PowerAnalyzer{tester=" + tester + '}';
    }
}
