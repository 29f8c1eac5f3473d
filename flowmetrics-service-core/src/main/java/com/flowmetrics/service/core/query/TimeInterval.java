package com.flowmetrics.service.core.query;

import com.flowmetrics.service.core.error.MetricsStoreException;
import java.time.Duration;
import java.util.Locale;

public enum TimeInterval {
    MINUTE("minute", Duration.ofMinutes(1)),
    HOUR("hour", Duration.ofHours(1)),
    DAY("day", Duration.ofDays(1));

    private final String wireValue;
    private final Duration duration;

    TimeInterval(String wireValue, Duration duration) {
        this.wireValue = wireValue;
        this.duration = duration;
    }

    public String wireValue() {
        return wireValue;
    }

    public Duration duration() {
        return duration;
    }

    public static TimeInterval fromString(String value) {
        if (value == null || value.isBlank()) {
            return HOUR;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TimeInterval interval : values()) {
            if (interval.wireValue.equals(normalized)) {
                return interval;
            }
        }
        throw MetricsStoreException.invalidQuery("Unsupported interval: " + value);
    }
}
