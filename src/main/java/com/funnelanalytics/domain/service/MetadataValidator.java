package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.exception.InvalidInputException;

import java.util.List;
import java.util.Map;

/**
 * Checks event metadata at ingestion. Values may be strings, numbers,
 * booleans, null, or nested maps and lists of those.
 */
public final class MetadataValidator {

    private static final int MAX_DEPTH = 8;

    private MetadataValidator() {
    }

    public static void validate(Map<String, Object> metadata) {
        if (metadata != null) {
            validateMap(metadata, "metadata", 0);
        }
    }

    private static void validateMap(Map<?, ?> map, String path, int depth) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key) || key.isBlank()) {
                throw new InvalidInputException("Metadata keys must be non-blank strings at " + path);
            }
            validateValue(entry.getValue(), path + "." + key, depth + 1);
        }
    }

    private static void validateValue(Object value, String path, int depth) {
        if (depth > MAX_DEPTH) {
            throw new InvalidInputException("Metadata nested deeper than " + MAX_DEPTH + " levels at " + path);
        }
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return;
        }
        if (value instanceof Map<?, ?> nested) {
            validateMap(nested, path, depth);
            return;
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                validateValue(list.get(i), path + "[" + i + "]", depth + 1);
            }
            return;
        }
        throw new InvalidInputException(
                "Unsupported metadata value of type " + value.getClass().getSimpleName() + " at " + path);
    }
}
