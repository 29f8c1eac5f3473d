package com.flowmetrics.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class RecordChecks {

    private static final ObjectMapper METADATA_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static {
        METADATA_MAPPER.findAndRegisterModules();
        METADATA_MAPPER.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    private RecordChecks() {}

    static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    static void requireFinite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite");
        }
    }

    /** Storage keeps epoch millis, so records carry the same precision. */
    static Instant truncate(Instant timestamp) {
        return timestamp == null ? null : timestamp.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Deep copy in stored JSON form: numbers, dates and nested values come back exactly as a read from storage
     * would produce them, nested collections are unmodifiable, and top-level null entries are dropped.
     */
    static Map<String, Object> copyMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> present = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (key != null && value != null) {
                present.put(key, value);
            }
        });
        if (present.isEmpty()) {
            return Map.of();
        }
        LinkedHashMap<String, Object> document;
        try {
            document = METADATA_MAPPER.readValue(METADATA_MAPPER.writeValueAsBytes(present), MAP_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException("metadata is not representable as JSON: " + e.getMessage(), e);
        }
        return freezeMap(document);
    }

    private static Map<String, Object> freezeMap(Map<String, Object> map) {
        Map<String, Object> frozen = new LinkedHashMap<>();
        map.forEach((key, value) -> frozen.put(key, freeze(value)));
        return Collections.unmodifiableMap(frozen);
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return freezeMap((Map<String, Object>) nested);
        }
        if (value instanceof List<?> list) {
            List<Object> frozen = new ArrayList<>(list.size());
            list.forEach(item -> frozen.add(freeze(item)));
            return Collections.unmodifiableList(frozen);
        }
        return value;
    }
}
