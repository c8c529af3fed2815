package com.trendsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the analysis YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * seed: 42
 * surrogate:
 *   method: auto
 *   count: 1000
 * bootstrap:
 *   blockSize: null   # auto
 *   samples: 1000
 * power:
 *   simulations: 100
 *   innerSurrogates: 1000
 *   slopeUnit: year
 * </pre>
 *
 * <p>
 * Every section is optional; a missing section keeps its defaults. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long seed;
    private SurrogateSettings surrogate = new SurrogateSettings();
    private BootstrapSettings bootstrap = new BootstrapSettings();
    private PowerSettings power = new PowerSettings();

    /**
     * Validate every section. Collects all errors and throws a single
     * exception if any section is invalid.
     *
     * @throws IllegalStateException if one or more sections are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            surrogate.validate();
        } catch (IllegalStateException e) {
            errors.add("surrogate: " + e.getMessage());
        }
        try {
            bootstrap.validate();
        } catch (IllegalStateException e) {
            errors.add("bootstrap: " + e.getMessage());
        }
        try {
            power.validate();
        } catch (IllegalStateException e) {
            errors.add("power: " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public PowerConfig toPowerConfig() {
        return power.toPowerConfig(seed);
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public SurrogateSettings getSurrogate() {
        return surrogate;
    }

    public void setSurrogate(SurrogateSettings surrogate) {
        this.surrogate = surrogate != null ? surrogate : new SurrogateSettings();
    }

    public BootstrapSettings getBootstrap() {
        return bootstrap;
    }

    public void setBootstrap(BootstrapSettings bootstrap) {
        this.bootstrap = bootstrap != null ? bootstrap : new BootstrapSettings();
    }

    public PowerSettings getPower() {
        return power;
    }

    public void setPower(PowerSettings power) {
        this.power = power != null ? power : new PowerSettings();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{seed=" + seed + ", surrogate=" + surrogate
                + ", bootstrap=" + bootstrap + ", power=" + power + '}';
    }
}
