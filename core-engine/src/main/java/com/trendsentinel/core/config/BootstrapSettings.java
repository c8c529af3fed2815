package com.trendsentinel.core.config;

import com.trendsentinel.core.model.BootstrapParams;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code bootstrap:} section of the analysis YAML. A missing or {@code null}
 * {@code blockSize} selects the automatic block length.
 *
 * @since 1.0.0
 */
public class BootstrapSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private Integer blockSize;
    private int samples = 1000;
    private double alpha = 0.05;

    /**
     * @throws IllegalStateException listing every invalid field
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        SurrogateSettings.collect(errors, this::toParams);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public BootstrapParams toParams() {
        return BootstrapParams.builder()
                .blockSize(blockSize)
                .nBootstrap(samples)
                .alpha(alpha)
                .build();
    }

    public Integer getBlockSize() {
        return blockSize;
    }

    public void setBlockSize(Integer blockSize) {
        this.blockSize = blockSize;
    }

    public int getSamples() {
        return samples;
    }

    public void setSamples(int samples) {
        this.samples = samples;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    @Override
    public String toString() {
        return "BootstrapSettings{blockSize=" + blockSize + ", samples=" + samples + ", alpha=" + alpha + '}';
    }
}
