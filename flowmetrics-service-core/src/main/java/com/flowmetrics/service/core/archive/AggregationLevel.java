package com.flowmetrics.service.core.archive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public enum AggregationLevel {
    HOURLY("hourly", Duration.ofHours(1)),
    DAILY("daily", Duration.ofDays(1));

    private final String wireValue;
    private final Duration duration;

    AggregationLevel(String wireValue, Duration duration) {
        this.wireValue = wireValue;
        this.duration = duration;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public Duration duration() {
        return duration;
    }

    /** Aligns the instant to the start of the containing UTC bucket. */
    public Instant align(Instant instant) {
        long bucketMillis = duration.toMillis();
        long alignedMillis = Math.floorDiv(instant.toEpochMilli(), bucketMillis) * bucketMillis;
        return Instant.ofEpochMilli(alignedMillis);
    }

    @JsonCreator
    public static AggregationLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Aggregation level is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AggregationLevel level : values()) {
            if (level.wireValue.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported aggregation level: " + value);
    }
}
