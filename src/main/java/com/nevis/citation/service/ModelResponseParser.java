package com.nevis.citation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.citation.exception.AnalysisUnavailableException;
import org.springframework.stereotype.Component;

/**
 * Reads the JSON objects the chat model is asked to return. Models tend to wrap them in
 * markdown fences or add prose around them, so only the outermost object is parsed.
 */
@Component
public class ModelResponseParser {

    private final ObjectMapper objectMapper;

    public ModelResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public <T> T parse(String raw, Class<T> type) {
        if (raw == null || raw.isBlank()) {
            throw new AnalysisUnavailableException("Model returned an empty response");
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new AnalysisUnavailableException("Model response is not a JSON object");
        }
        try {
            return objectMapper.readValue(raw.substring(start, end + 1), type);
        } catch (JsonProcessingException e) {
            throw new AnalysisUnavailableException("Model response could not be parsed", e);
        }
    }

    static double clamp(Double value) {
        if (value == null || value.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
