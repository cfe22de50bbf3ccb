package com.funnelanalytics.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelanalytics.domain.exception.InvalidInputException;
import com.funnelanalytics.domain.exception.StorageFailureException;
import com.funnelanalytics.domain.model.FunnelStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Converts the JSON text columns (steps, metadata) to and from domain values.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonColumnMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<FunnelStep>> STEPS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String writeMap(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Metadata is not serializable as JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * Unreadable stored metadata becomes null so the owning event is still
     * counted (and lands in the "Unknown" segment).
     */
    public Map<String, Object> readMap(String json, Object ownerId) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on {}, treating as empty: {}", ownerId, e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Corrupt stored steps make the definition unusable and surface as a
     * storage failure.
     */
    public List<FunnelStep> readSteps(String json, Object funnelId) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STEPS_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Stored steps of funnel {} are not valid JSON: {}", funnelId, e.getOriginalMessage(), e);
            throw new StorageFailureException("Stored steps of funnel " + funnelId + " are unreadable", e);
        }
    }
}
