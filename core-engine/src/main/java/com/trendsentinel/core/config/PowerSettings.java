package com.trendsentinel.core.config;

import com.trendsentinel.core.model.SlopeUnit;
import com.trendsentinel.core.model.SurrogateMethod;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code power:} section of the analysis YAML.
 *
 * @since 1.0.0
 */
public class PowerSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int simulations = PowerConfig.DEFAULT_N_SIMULATIONS;
    private int innerSurrogates = PowerConfig.DEFAULT_N_SURROGATES_INNER;
    private double alpha = PowerConfig.DEFAULT_ALPHA;
    private String slopeUnit;
    private boolean detrendInput = true;
    private String method = "auto";
    private int parallelism = 1;

    /**
     * @throws IllegalStateException listing every invalid field
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        SurrogateSettings.collect(errors, () -> toPowerConfig(null));
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    /**
     * @param seed root seed shared by the whole analysis, or {@code null}
     * @return typed configuration
     */
    public PowerConfig toPowerConfig(Long seed) {
        PowerConfig.Builder builder = PowerConfig.builder()
                .nSimulations(simulations)
                .nSurrogatesInner(innerSurrogates)
                .alpha(alpha)
                .slopeUnit(SlopeUnit.fromString(slopeUnit))
                .detrendInput(detrendInput)
                .method(SurrogateMethod.fromString(method))
                .parallelism(parallelism);
        if (seed != null) {
            builder.seed(seed);
        }
        return builder.build();
    }

    public int getSimulations() {
        return simulations;
    }

    public void setSimulations(int simulations) {
        this.simulations = simulations;
    }

    public int getInnerSurrogates() {
        return innerSurrogates;
    }

    public void setInnerSurrogates(int innerSurrogates) {
        this.innerSurrogates = innerSurrogates;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public String getSlopeUnit() {
        return slopeUnit;
    }

    public void setSlopeUnit(String slopeUnit) {
        this.slopeUnit = slopeUnit;
    }

    public boolean isDetrendInput() {
        return detrendInput;
    }

    public void setDetrendInput(boolean detrendInput) {
        this.detrendInput = detrendInput;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    @Override
    public String toString() {
        return "PowerSettings{simulations=" + simulations + ", innerSurrogates=" + innerSurrogates
                + ", alpha=" + alpha + ", slopeUnit='" + slopeUnit + "', method='" + method
                + "', parallelism=" + parallelism + '}';
    }
}
