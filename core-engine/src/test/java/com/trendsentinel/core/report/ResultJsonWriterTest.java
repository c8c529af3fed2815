package com.trendsentinel.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendsentinel.core.model.BootstrapTestResult;
import com.trendsentinel.core.model.Note;
import com.trendsentinel.core.model.NoteCode;
import com.trendsentinel.core.model.PowerResult;
import com.trendsentinel.core.model.SignificanceResult;
import com.trendsentinel.core.model.SlopePower;
import com.trendsentinel.core.model.SlopeUnit;
import com.trendsentinel.core.model.SurrogateMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResultJsonWriter}.
 */
class ResultJsonWriterTest {

    private final ResultJsonWriter writer = new ResultJsonWriter();
    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Significance result should carry p-value, method and notes")
    void shouldWriteSignificanceResult() throws Exception {
        SignificanceResult result = SignificanceResult.builder()
                .method(SurrogateMethod.IAAFT)
                .originalScore(12)
                .surrogateScores(new double[]{1, -3, 4})
                .pValue(0.25)
                .zScore(2.5)
                .nSurrogates(3)
                .note(Note.of(NoteCode.METHOD_FALLBACK, "fell back"))
                .build();

        JsonNode json = reader.readTree(writer.write(result));

        assertThat(json.get("pValue").asDouble()).isEqualTo(0.25);
        assertThat(json.get("zScore").asDouble()).isEqualTo(2.5);
        assertThat(json.get("nSurrogates").asInt()).isEqualTo(3);
        assertThat(json.get("method").asText()).isEqualTo("IAAFT");
        assertThat(json.get("significant").asBoolean()).isFalse();
        assertThat(json.get("surrogateScores")).hasSize(3);
        assertThat(json.get("notes").get(0).get("code").asText()).isEqualTo("METHOD_FALLBACK");
    }

    @Test
    @DisplayName("NaN minimum detectable trend should be written as a string")
    void shouldWriteNanAsString() throws Exception {
        PowerResult result = PowerResult.builder()
                .row(new SlopePower(0.0, 0.0, 1, 10, 0.1))
                .row(SlopePower.notSimulated(1.0, 1.0))
                .nSimulations(10)
                .nSurrogatesInner(99)
                .alpha(0.05)
                .noiseMethod(SurrogateMethod.SPECTRAL)
                .slopeUnit(SlopeUnit.NONE)
                .aborted(true)
                .build();

        JsonNode json = reader.readTree(writer.write(result));

        assertThat(json.get("minDetectableTrend").asText()).isEqualTo("NaN");
        assertThat(json.get("rows").get(1).get("detectionRate").asText()).isEqualTo("NaN");
        assertThat(json.get("aborted").asBoolean()).isTrue();
        assertThat(json.get("nSimulations").asInt()).isEqualTo(10);
    }

    @Test
    @DisplayName("Pretty output should be indented")
    void prettyOutputShouldBeIndented() {
        BootstrapTestResult result = new BootstrapTestResult(0.5, 3, new double[]{1, 2}, 0.5, 4, List.of());

        String json = new ResultJsonWriter(true).write(result);

        assertThat(json).contains("\n").contains("\"blockSize\" : 4");
    }
}
