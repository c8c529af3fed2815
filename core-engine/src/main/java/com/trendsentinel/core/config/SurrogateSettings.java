package com.trendsentinel.core.config;

import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.spectral.FrequencyMethod;
import com.trendsentinel.core.spectral.Normalization;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code surrogate:} section of the analysis YAML.
 *
 * <pre>
 * surrogate:
 *   method: auto
 *   count: 1000
 *   maxIter: 100
 *   tolerance: 1.0e-6
 *   frequencyMethod: auto
 *   normalization: standard
 *   spectralMaxIter: 1
 *   leftCensorMultiplier: 0.5
 *   rightCensorMultiplier: 1.1
 * </pre>
 *
 * @since 1.0.0
 */
public class SurrogateSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String method = "auto";
    private int count = 1000;

    // --- IAAFT ---
    private int maxIter = IaaftConfig.DEFAULT_MAX_ITER;
    private double tolerance = IaaftConfig.DEFAULT_TOLERANCE;

    // --- Spectral synthesis ---
    private String frequencyMethod = "auto";
    private String normalization = "standard";
    private boolean fitMean = true;
    private boolean centerData = true;
    private int spectralMaxIter = 1;
    private boolean fallbackToIaaft;

    // --- Censoring ---
    private double leftCensorMultiplier = CensoringConfig.DEFAULT_LEFT_MULTIPLIER;
    private double rightCensorMultiplier = CensoringConfig.DEFAULT_RIGHT_MULTIPLIER;

    /**
     * @throws IllegalStateException listing every invalid field
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collect(errors, this::toMethod);
        if (count <= 0) {
            errors.add("surrogate.count must be > 0, got: " + count);
        }
        collect(errors, this::toIaaftConfig);
        collect(errors, this::toSpectralConfig);
        collect(errors, this::toCensoringConfig);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    static void collect(List<String> errors, Runnable conversion) {
        try {
            conversion.run();
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add(e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Conversion to typed configuration
    // ---------------------------------------------------------------

    public SurrogateMethod toMethod() {
        return SurrogateMethod.fromString(method);
    }

    public IaaftConfig toIaaftConfig() {
        return IaaftConfig.builder()
                .maxIter(maxIter)
                .tolerance(tolerance)
                .build();
    }

    public SpectralConfig toSpectralConfig() {
        return SpectralConfig.builder()
                .frequencyMethod(FrequencyMethod.fromString(frequencyMethod))
                .normalization(Normalization.fromString(normalization))
                .fitMean(fitMean)
                .centerData(centerData)
                .maxIter(spectralMaxIter)
                .fallbackToIaaft(fallbackToIaaft)
                .build();
    }

    public CensoringConfig toCensoringConfig() {
        return CensoringConfig.builder()
                .leftMultiplier(leftCensorMultiplier)
                .rightMultiplier(rightCensorMultiplier)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public int getMaxIter() {
        return maxIter;
    }

    public void setMaxIter(int maxIter) {
        this.maxIter = maxIter;
    }

    public double getTolerance() {
        return tolerance;
    }

    public void setTolerance(double tolerance) {
        this.tolerance = tolerance;
    }

    public String getFrequencyMethod() {
        return frequencyMethod;
    }

    public void setFrequencyMethod(String frequencyMethod) {
        this.frequencyMethod = frequencyMethod;
    }

    public String getNormalization() {
        return normalization;
    }

    public void setNormalization(String normalization) {
        this.normalization = normalization;
    }

    public boolean isFitMean() {
        return fitMean;
    }

    public void setFitMean(boolean fitMean) {
        this.fitMean = fitMean;
    }

    public boolean isCenterData() {
        return centerData;
    }

    public void setCenterData(boolean centerData) {
        this.centerData = centerData;
    }

    public int getSpectralMaxIter() {
        return spectralMaxIter;
    }

    public void setSpectralMaxIter(int spectralMaxIter) {
        this.spectralMaxIter = spectralMaxIter;
    }

    public boolean isFallbackToIaaft() {
        return fallbackToIaaft;
    }

    public void setFallbackToIaaft(boolean fallbackToIaaft) {
        this.fallbackToIaaft = fallbackToIaaft;
    }

    public double getLeftCensorMultiplier() {
        return leftCensorMultiplier;
    }

    public void setLeftCensorMultiplier(double leftCensorMultiplier) {
        this.leftCensorMultiplier = leftCensorMultiplier;
    }

    public double getRightCensorMultiplier() {
        return rightCensorMultiplier;
    }

    public void setRightCensorMultiplier(double rightCensorMultiplier) {
        this.rightCensorMultiplier = rightCensorMultiplier;
    }

    @Override
    public String toString() {
        return "SurrogateSettings{method='" + method + "', count=" + count
                + ", maxIter=" + maxIter + ", tolerance=" + tolerance
                + ", frequencyMethod='" + frequencyMethod + "', normalization='" + normalization
                + "', spectralMaxIter=" + spectralMaxIter + '}';
    }
}
