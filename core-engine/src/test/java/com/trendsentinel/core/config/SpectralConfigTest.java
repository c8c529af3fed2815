package com.trendsentinel.core.config;

import com.trendsentinel.core.spectral.FrequencyMethod;
import com.trendsentinel.core.spectral.Normalization;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SpectralConfig}.
 */
class SpectralConfigTest {

    @Test
    @DisplayName("Defaults should describe a single uncorrected synthesis pass")
    void defaultsShouldBeSinglePass() {
        SpectralConfig config = SpectralConfig.defaults();

        assertThat(config.getFrequencyMethod()).isEqualTo(FrequencyMethod.AUTO);
        assertThat(config.getNormalization()).isEqualTo(Normalization.STANDARD);
        assertThat(config.getMaxIter()).isEqualTo(1);
        assertThat(config.getDampingExponent()).isEqualTo(SpectralConfig.DEFAULT_DAMPING_EXPONENT);
        assertThat(config.isFallbackToIaaft()).isFalse();
    }

    @Test
    @DisplayName("Should reject a zero iteration budget")
    void shouldRejectZeroMaxIter() {
        assertThatThrownBy(() -> SpectralConfig.builder().maxIter(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxIter");
    }

    @Test
    @DisplayName("Should parse frequency method and normalization names")
    void shouldParseEnumNames() {
        assertThat(FrequencyMethod.fromString("Log")).isEqualTo(FrequencyMethod.LOG);
        assertThat(Normalization.fromString("psd")).isEqualTo(Normalization.PSD);
        assertThatThrownBy(() -> Normalization.fromString("raw"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
