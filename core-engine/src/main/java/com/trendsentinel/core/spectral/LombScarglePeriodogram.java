package com.trendsentinel.core.spectral;

import com.trendsentinel.core.config.SpectralConfig;
import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;
import java.util.Objects;

/**
 * Generalized (floating-mean, weighted) Lomb-Scargle periodogram evaluated
 * directly on an arbitrary frequency grid.
 *
 * <p>
 * Cost is O(N &middot; F). For each frequency the time offset &tau; is chosen
 * so the sine and cosine terms are orthogonal under the weights; with
 * {@code fitMean} an offset term is fitted jointly.
 * </p>
 *
 * <h3>Normalizations</h3>
 * <ul>
 * <li>{@code STANDARD}: fraction of weighted variance explained</li>
 * <li>{@code MODEL}: explained over residual</li>
 * <li>{@code LOG}: {@code -ln(1 - standard)}</li>
 * <li>{@code PSD}: half the raw power scaled by {@code sum(1/dy^2)}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class LombScarglePeriodogram implements PeriodogramProvider {

    @Override
    public double[] frequencyGrid(double[] times, SpectralConfig config) {
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(config, "config must not be null");
        int n = times.length;
        double baseline = StatUtils.max(times) - StatUtils.min(times);
        if (n < 2 || !(baseline > 0)) {
            throw new IllegalArgumentException("Frequency grid needs at least two distinct times, got baseline: "
                    + baseline);
        }
        return switch (config.getFrequencyMethod()) {
            case AUTO -> autoGrid(n, baseline, config.getSamplesPerPeak(), config.getNyquistFactor());
            case LOG -> logGrid(times, baseline);
        };
    }

    @Override
    public Periodogram compute(double[] times, double[] values, double[] dy,
                               double[] frequencies, SpectralConfig config) {
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(frequencies, "frequencies must not be null");
        Objects.requireNonNull(config, "config must not be null");
        int n = times.length;
        if (values.length != n || (dy != null && dy.length != n)) {
            throw new IllegalArgumentException("times, values and dy must have equal length");
        }

        double[] w = new double[n];
        double weightSum = 0;
        for (int i = 0; i < n; i++) {
            double sigma = dy == null ? 1.0 : dy[i];
            if (!(sigma > 0)) {
                throw new IllegalArgumentException("dy must be > 0, got: " + sigma + " at index " + i);
            }
            w[i] = 1.0 / (sigma * sigma);
            weightSum += w[i];
        }
        for (int i = 0; i < n; i++) {
            w[i] /= weightSum;
        }

        boolean fitMean = config.isFitMean();
        double[] y = values.clone();
        if (config.isCenterData() || fitMean) {
            double mean = dot(w, y);
            for (int i = 0; i < n; i++) {
                y[i] -= mean;
            }
        }
        double ybar = dot(w, y);
        double yy = 0;
        for (int i = 0; i < n; i++) {
            yy += w[i] * y[i] * y[i];
        }
        yy -= ybar * ybar;

        double[] power = new double[frequencies.length];
        for (int f = 0; f < frequencies.length; f++) {
            double raw = rawPower(times, y, w, ybar, 2 * Math.PI * frequencies[f], fitMean);
            power[f] = normalize(raw, yy, weightSum, config.getNormalization());
        }
        return new Periodogram(frequencies, power);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double rawPower(double[] t, double[] y, double[] w, double ybar,
                                   double omega, boolean fitMean) {
        int n = t.length;
        double s2 = 0;
        double c2 = 0;
        double s = 0;
        double c = 0;
        for (int i = 0; i < n; i++) {
            double sin = Math.sin(omega * t[i]);
            double cos = Math.cos(omega * t[i]);
            s2 += 2 * w[i] * sin * cos;
            c2 += w[i] * (cos * cos - sin * sin);
            s += w[i] * sin;
            c += w[i] * cos;
        }
        if (fitMean) {
            s2 -= 2 * s * c;
            c2 -= c * c - s * s;
        }
        double halfAngle = 0.5 * Math.atan2(s2, c2);

        double yc = 0;
        double ys = 0;
        double cc = 0;
        double ss = 0;
        double ct = 0;
        double st = 0;
        for (int i = 0; i < n; i++) {
            double arg = omega * t[i] - halfAngle;
            double cos = Math.cos(arg);
            double sin = Math.sin(arg);
            yc += w[i] * y[i] * cos;
            ys += w[i] * y[i] * sin;
            cc += w[i] * cos * cos;
            ss += w[i] * sin * sin;
            ct += w[i] * cos;
            st += w[i] * sin;
        }
        if (fitMean) {
            yc -= ybar * ct;
            ys -= ybar * st;
            cc -= ct * ct;
            ss -= st * st;
        }
        double p = 0;
        if (cc > 0) {
            p += yc * yc / cc;
        }
        if (ss > 0) {
            p += ys * ys / ss;
        }
        return p;
    }

    private static double normalize(double p, double yy, double weightSum, Normalization normalization) {
        return switch (normalization) {
            case STANDARD -> p / yy;
            case MODEL -> p / (yy - p);
            case LOG -> -Math.log(1 - p / yy);
            case PSD -> 0.5 * p * weightSum;
        };
    }

    static double[] autoGrid(int n, double baseline, double samplesPerPeak, double nyquistFactor) {
        double df = 1.0 / baseline / samplesPerPeak;
        double fmin = 0.5 * df;
        double fmax = nyquistFactor * 0.5 * n / baseline;
        int nf = 1 + (int) Math.round((fmax - fmin) / df);
        double[] grid = new double[nf];
        for (int k = 0; k < nf; k++) {
            grid[k] = fmin + df * k;
        }
        return grid;
    }

    static double[] logGrid(double[] times, double baseline) {
        int n = times.length;
        double[] sorted = times.clone();
        Arrays.sort(sorted);
        double meanStep = (sorted[n - 1] - sorted[0]) / (n - 1);
        double fmin = 1.0 / baseline;
        double fmax = n / (2 * meanStep);
        int count = 2 * n;
        double[] grid = new double[count];
        double logMin = Math.log(fmin);
        double logStep = (Math.log(fmax) - logMin) / (count - 1);
        for (int k = 0; k < count; k++) {
            grid[k] = Math.exp(logMin + logStep * k);
        }
        grid[0] = fmin;
        grid[count - 1] = fmax;
        return grid;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    @Override
    public String toString() {
        return "LombScarglePeriodogram{}";
    }
}
