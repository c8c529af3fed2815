package com.trendsentinel.core.surrogate;

import com.trendsentinel.core.config.IaaftConfig;
import com.trendsentinel.core.config.SpectralConfig;
import com.trendsentinel.core.model.SurrogateMethod;
import com.trendsentinel.core.spectral.PeriodogramProvider;

import java.util.Objects;

/**
 * Creates the {@link SurrogateGenerator} for a concrete method.
 *
 * <p>
 * {@link SurrogateMethod#AUTO} must be resolved against the sampling first;
 * see {@link SurrogateSignificanceTester#resolveMethod}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SurrogateGeneratorFactory {

    private SurrogateGeneratorFactory() {
        // utility class, not instantiable
    }

    /**
     * @param method   resolved method; must not be {@code AUTO}
     * @param provider periodogram capability, may be {@code null}
     * @param iaaft    IAAFT settings
     * @param spectral spectral-synthesis settings
     * @return a generator for {@code method}
     * @throws IllegalArgumentException if {@code method} is {@code AUTO}
     */
    public static SurrogateGenerator create(SurrogateMethod method, PeriodogramProvider provider,
                                            IaaftConfig iaaft, SpectralConfig spectral) {
        Objects.requireNonNull(method, "SurrogateMethod must not be null");
        return switch (method) {
            case IAAFT -> new IaaftGenerator(iaaft);
            case SPECTRAL -> new SpectralSynthesisGenerator(provider, spectral);
            case AUTO -> throw new IllegalArgumentException(
                    "AUTO must be resolved to IAAFT or SPECTRAL before creating a generator");
        };
    }
}
