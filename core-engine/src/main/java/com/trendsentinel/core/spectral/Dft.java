package com.trendsentinel.core.spectral;

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.Objects;

/**
 * Discrete Fourier transform of any length.
 *
 * <p>
 * Power-of-two lengths go straight to Commons Math's radix-2
 * {@link FastFourierTransformer}. Other lengths use Bluestein's chirp-z
 * algorithm, which rewrites the transform as a circular convolution of
 * power-of-two length. Complex data is carried as a {@code double[2][n]}
 * array of real and imaginary parts, the layout
 * {@link FastFourierTransformer#transformInPlace} works on.
 * </p>
 *
 * @since 1.0.0
 */
public final class Dft {

    private Dft() {
    }

    // ---------------------------------------------------------------
    // Complex transforms
    // ---------------------------------------------------------------

    /**
     * Forward transform, {@code X[k] = sum x[j] exp(-2 pi i jk / n)}.
     *
     * @param re real parts
     * @param im imaginary parts, same length
     * @return new {@code {re, im}} array
     */
    public static double[][] forward(double[] re, double[] im) {
        Objects.requireNonNull(re, "re must not be null");
        Objects.requireNonNull(im, "im must not be null");
        if (re.length != im.length) {
            throw new IllegalArgumentException("re and im lengths differ: " + re.length + " != " + im.length);
        }
        int n = re.length;
        double[][] data = {re.clone(), im.clone()};
        if (n <= 1) {
            return data;
        }
        if (ArithmeticUtils.isPowerOfTwo(n)) {
            FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.FORWARD);
            return data;
        }
        return bluestein(data[0], data[1]);
    }

    /**
     * Inverse transform including the {@code 1/n} factor.
     *
     * @param re real parts
     * @param im imaginary parts, same length
     * @return new {@code {re, im}} array
     */
    public static double[][] inverse(double[] re, double[] im) {
        int n = re.length;
        double[] conj = new double[n];
        for (int i = 0; i < n; i++) {
            conj[i] = -im[i];
        }
        double[][] out = forward(re, conj);
        for (int i = 0; i < n; i++) {
            out[0][i] /= n;
            out[1][i] = -out[1][i] / n;
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Real-signal helpers
    // ---------------------------------------------------------------

    /**
     * @param x real signal
     * @return magnitude of every DFT bin
     */
    public static double[] amplitudes(double[] x) {
        double[][] spec = forward(x, new double[x.length]);
        double[] amp = new double[x.length];
        for (int k = 0; k < x.length; k++) {
            amp[k] = Math.hypot(spec[0][k], spec[1][k]);
        }
        return amp;
    }

    /**
     * Replace the Fourier magnitudes of {@code x} with {@code amplitudes},
     * keeping its phases, and return the real part of the inverse.
     *
     * <p>
     * Bins where {@code x} has zero magnitude take phase zero. When
     * {@code amplitudes} comes from a real signal the result is real up to
     * rounding.
     * </p>
     *
     * @param x          real signal supplying the phases
     * @param amplitudes target magnitude per bin, length {@code x.length}
     * @return real signal with the target amplitude spectrum
     */
    public static double[] imposeAmplitudes(double[] x, double[] amplitudes) {
        if (x.length != amplitudes.length) {
            throw new IllegalArgumentException("Expected " + x.length + " amplitudes, got: " + amplitudes.length);
        }
        int n = x.length;
        double[][] spec = forward(x, new double[n]);
        for (int k = 0; k < n; k++) {
            double phase = Math.atan2(spec[1][k], spec[0][k]);
            spec[0][k] = amplitudes[k] * Math.cos(phase);
            spec[1][k] = amplitudes[k] * Math.sin(phase);
        }
        return inverse(spec[0], spec[1])[0];
    }

    // ---------------------------------------------------------------
    // Bluestein
    // ---------------------------------------------------------------

    private static double[][] bluestein(double[] re, double[] im) {
        int n = re.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) {
            m <<= 1;
        }

        // chirp w[j] = exp(-i pi j^2 / n); j^2 reduced mod 2n keeps the angle exact
        double[] wRe = new double[n];
        double[] wIm = new double[n];
        long period = 2L * n;
        for (int j = 0; j < n; j++) {
            long jj = ((long) j * j) % period;
            double angle = Math.PI * jj / n;
            wRe[j] = Math.cos(angle);
            wIm[j] = -Math.sin(angle);
        }

        double[][] a = new double[2][m];
        for (int j = 0; j < n; j++) {
            a[0][j] = re[j] * wRe[j] - im[j] * wIm[j];
            a[1][j] = re[j] * wIm[j] + im[j] * wRe[j];
        }
        double[][] b = new double[2][m];
        b[0][0] = wRe[0];
        b[1][0] = -wIm[0];
        for (int j = 1; j < n; j++) {
            b[0][j] = wRe[j];
            b[1][j] = -wIm[j];
            b[0][m - j] = wRe[j];
            b[1][m - j] = -wIm[j];
        }

        FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.FORWARD);
        FastFourierTransformer.transformInPlace(b, DftNormalization.STANDARD, TransformType.FORWARD);
        for (int k = 0; k < m; k++) {
            double r = a[0][k] * b[0][k] - a[1][k] * b[1][k];
            double i = a[0][k] * b[1][k] + a[1][k] * b[0][k];
            a[0][k] = r;
            a[1][k] = i;
        }
        FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.INVERSE);

        double[][] out = new double[2][n];
        for (int k = 0; k < n; k++) {
            out[0][k] = a[0][k] * wRe[k] - a[1][k] * wIm[k];
            out[1][k] = a[0][k] * wIm[k] + a[1][k] * wRe[k];
        }
        return out;
    }
}
