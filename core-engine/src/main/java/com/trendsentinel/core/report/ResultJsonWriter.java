package com.trendsentinel.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.trendsentinel.core.model.BootstrapTestResult;
import com.trendsentinel.core.model.PowerResult;
import com.trendsentinel.core.model.SignificanceResult;
import com.trendsentinel.core.model.SlopeConfidenceInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Renders analysis results as JSON.
 *
 * <p>
 * Non-finite doubles (NaN minimum detectable trend, NaN rows of an aborted
 * power run) are written as the strings {@code "NaN"}, {@code "Infinity"} and
 * {@code "-Infinity"}. Instances are thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResultJsonWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultJsonWriter.class);

    private final ObjectMapper mapper;

    public ResultJsonWriter() {
        this(false);
    }

    /**
     * @param pretty indent the output
     */
    public ResultJsonWriter(boolean pretty) {
        this.mapper = JsonMapper.builder()
                .enable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                .configure(SerializationFeature.INDENT_OUTPUT, pretty)
                .build();
    }

    public String write(SignificanceResult result) {
        return serialize(result);
    }

    public String write(PowerResult result) {
        return serialize(result);
    }

    public String write(BootstrapTestResult result) {
        return serialize(result);
    }

    public String write(SlopeConfidenceInterval result) {
        return serialize(result);
    }

    private String serialize(Object result) {
        Objects.requireNonNull(result, "result must not be null");
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}", result.getClass().getSimpleName(), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize " + result.getClass().getSimpleName(), e);
        }
    }
}
