package com.trendsentinel.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Immutable, ordered sequence of (time, value, censored, kind) observations.
 *
 * <p>
 * Rows are kept in the order supplied by the caller; nothing in this library
 * reorders or mutates a series in place. Operations that need chronological
 * order work on a copy obtained through {@link #chronologicalOrder()} and
 * {@link #select(int[])}.
 * </p>
 *
 * <p>
 * For censored observations the value is the detection limit and
 * {@link #kind(int)} tells on which side of the limit the true value lies.
 * The censored flag and the kind must agree: a row is censored exactly when
 * its kind is not {@link CensorKind#NONE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries {

    private final double[] times;
    private final double[] values;
    private final boolean[] censored;
    private final CensorKind[] kinds;

    private TimeSeries(double[] times, double[] values, boolean[] censored, CensorKind[] kinds) {
        this.times = times;
        this.values = values;
        this.censored = censored;
        this.kinds = kinds;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * Create an uncensored series.
     *
     * @param times  observation times; must not be {@code null}
     * @param values observed values, same length as {@code times}
     * @return a new series
     * @throws IllegalArgumentException if the lengths differ or a time is not
     *                                  finite
     */
    public static TimeSeries of(double[] times, double[] values) {
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(values, "values must not be null");
        CensorKind[] kinds = new CensorKind[values.length];
        Arrays.fill(kinds, CensorKind.NONE);
        return censored(times, values, new boolean[values.length], kinds);
    }

    /**
     * Create a series with censoring information.
     *
     * @param times    observation times
     * @param values   observed values or detection limits
     * @param censored per-row censored flag
     * @param kinds    per-row censoring kind; {@code null} entries are read as
     *                 {@link CensorKind#NONE}
     * @return a new series
     * @throws IllegalArgumentException if lengths differ, a time is not finite,
     *                                  or a flag disagrees with its kind
     */
    public static TimeSeries censored(double[] times, double[] values, boolean[] censored, CensorKind[] kinds) {
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(censored, "censored must not be null");
        Objects.requireNonNull(kinds, "kinds must not be null");

        int n = values.length;
        if (times.length != n || censored.length != n || kinds.length != n) {
            throw new IllegalArgumentException(String.format(
                    "Series arrays must have equal length: times=%d, values=%d, censored=%d, kinds=%d",
                    times.length, n, censored.length, kinds.length));
        }

        CensorKind[] kindCopy = new CensorKind[n];
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(times[i])) {
                throw new IllegalArgumentException("Time at index " + i + " is not finite: " + times[i]);
            }
            CensorKind kind = kinds[i] == null ? CensorKind.NONE : kinds[i];
            if (censored[i] != (kind != CensorKind.NONE)) {
                throw new IllegalArgumentException("Censored flag and kind disagree at index " + i
                        + ": censored=" + censored[i] + ", kind=" + kind);
            }
            kindCopy[i] = kind;
        }
        return new TimeSeries(times.clone(), values.clone(), censored.clone(), kindCopy);
    }

    /**
     * Create an uncensored series from instants, expressed as epoch seconds
     * with sub-second precision.
     *
     * @param instants observation instants
     * @param values   observed values
     * @return a new series whose times are seconds since the epoch
     */
    public static TimeSeries fromInstants(Instant[] instants, double[] values) {
        Objects.requireNonNull(instants, "instants must not be null");
        double[] seconds = new double[instants.length];
        for (int i = 0; i < instants.length; i++) {
            Instant instant = Objects.requireNonNull(instants[i], "instant at index " + i + " is null");
            seconds[i] = instant.getEpochSecond() + instant.getNano() / 1e9;
        }
        return of(seconds, values);
    }

    // ---------------------------------------------------------------
    // Derivation
    // ---------------------------------------------------------------

    /**
     * Same times, new values, every row uncensored.
     *
     * @param newValues replacement values
     * @return a new uncensored series
     */
    public TimeSeries withUncensoredValues(double[] newValues) {
        return of(times, newValues);
    }

    /**
     * Rows reordered (or repeated) according to {@code order}.
     *
     * @param order row indices into this series
     * @return a new series with {@code order.length} rows
     */
    public TimeSeries select(int[] order) {
        Objects.requireNonNull(order, "order must not be null");
        int m = order.length;
        double[] t = new double[m];
        double[] v = new double[m];
        boolean[] c = new boolean[m];
        CensorKind[] k = new CensorKind[m];
        for (int i = 0; i < m; i++) {
            int src = order[i];
            t[i] = times[src];
            v[i] = values[src];
            c[i] = censored[src];
            k[i] = kinds[src];
        }
        return new TimeSeries(t, v, c, k);
    }

    /**
     * Stable chronological permutation: rows sorted by time, ties kept in
     * their original order.
     *
     * @return row indices in chronological order
     */
    public int[] chronologicalOrder() {
        return IntStream.range(0, times.length)
                .boxed()
                .sorted(Comparator.comparingDouble(i -> times[i]))
                .mapToInt(Integer::intValue)
                .toArray();
    }

    /**
     * @return {@code true} if the rows are already in non-decreasing time order
     */
    public boolean isChronological() {
        for (int i = 1; i < times.length; i++) {
            if (times[i] < times[i - 1]) {
                return false;
            }
        }
        return true;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int size() {
        return values.length;
    }

    public double time(int i) {
        return times[i];
    }

    public double value(int i) {
        return values[i];
    }

    public boolean isCensored(int i) {
        return censored[i];
    }

    public CensorKind kind(int i) {
        return kinds[i];
    }

    /** @return a copy of the times */
    public double[] times() {
        return times.clone();
    }

    /** @return a copy of the values */
    public double[] values() {
        return values.clone();
    }

    /** @return a copy of the censored flags */
    public boolean[] censoredFlags() {
        return censored.clone();
    }

    /** @return a copy of the censoring kinds */
    public CensorKind[] kinds() {
        return kinds.clone();
    }

    public boolean hasCensoring() {
        for (boolean c : censored) {
            if (c) {
                return true;
            }
        }
        return false;
    }

    public int censoredCount() {
        int count = 0;
        for (boolean c : censored) {
            if (c) {
                count++;
            }
        }
        return count;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return Arrays.equals(times, that.times)
                && Arrays.equals(values, that.values)
                && Arrays.equals(censored, that.censored)
                && Arrays.equals(kinds, that.kinds);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(times);
        result = 31 * result + Arrays.hashCode(values);
        result = 31 * result + Arrays.hashCode(censored);
        return 31 * result + Arrays.hashCode(kinds);
    }

    @Override
    public String toString() {
        return "TimeSeries{size=" + values.length + ", censored=" + censoredCount() + '}';
    }
}
