package com.flowmetrics.service.core.query;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flowmetrics.service.core.archive.AggregateStats;
import com.flowmetrics.service.core.error.MetricsStoreException;
import java.util.Locale;

public enum Aggregation {
    AVG("avg"),
    SUM("sum"),
    COUNT("count"),
    MIN("min"),
    MAX("max"),
    STDDEV("stddev");

    private final String wireValue;

    Aggregation(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Extracts this aggregation from merged statistics; empty input yields {@code null} except for count and sum. */
    public Double apply(AggregateStats stats) {
        return switch (this) {
            case AVG -> stats.mean();
            case SUM -> stats.sum();
            case COUNT -> (double) stats.count();
            case MIN -> stats.minOrNull();
            case MAX -> stats.maxOrNull();
            case STDDEV -> stats.stddev();
        };
    }

    public static Aggregation fromString(String value) {
        if (value == null || value.isBlank()) {
            throw MetricsStoreException.invalidQuery("Aggregation is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Aggregation aggregation : values()) {
            if (aggregation.wireValue.equals(normalized)) {
                return aggregation;
            }
        }
        throw MetricsStoreException.invalidQuery("Unknown aggregation: " + value);
    }
}
