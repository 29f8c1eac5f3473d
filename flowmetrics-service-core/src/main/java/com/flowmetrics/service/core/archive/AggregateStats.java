package com.flowmetrics.service.core.archive;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The statistics that survive compaction. Mean and variance are recoverable from these five fields; percentiles
 * are not, which is why archive-backed percentiles are labelled approximate.
 */
public record AggregateStats(
        @JsonProperty("count") long count,
        @JsonProperty("sum") double sum,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("sum_squares") double sumSquares) {

    public static final AggregateStats EMPTY = new AggregateStats(0, 0.0, 0.0, 0.0, 0.0);

    public AggregateStats {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
    }

    public static AggregateStats of(double value) {
        return new AggregateStats(1, value, value, value, value * value);
    }

    public static AggregateStats of(double... values) {
        AggregateStats stats = EMPTY;
        for (double value : values) {
            stats = stats.plus(value);
        }
        return stats;
    }

    public AggregateStats plus(double value) {
        return merge(of(value));
    }

    public AggregateStats merge(AggregateStats other) {
        if (other == null || other.count == 0) {
            return this;
        }
        if (count == 0) {
            return other;
        }
        return new AggregateStats(
                count + other.count,
                sum + other.sum,
                Math.min(min, other.min),
                Math.max(max, other.max),
                sumSquares + other.sumSquares);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return count == 0;
    }

    /** {@code null} for an empty set, never NaN. */
    @JsonIgnore
    public Double mean() {
        return count == 0 ? null : sum / count;
    }

    /** Population variance via {@code E[x^2] - E[x]^2}, clamped at zero against rounding. */
    @JsonIgnore
    public Double variance() {
        if (count == 0) {
            return null;
        }
        double mean = sum / count;
        return Math.max(0.0, sumSquares / count - mean * mean);
    }

    @JsonIgnore
    public Double stddev() {
        Double variance = variance();
        return variance == null ? null : Math.sqrt(variance);
    }

    @JsonIgnore
    public Double minOrNull() {
        return count == 0 ? null : min;
    }

    @JsonIgnore
    public Double maxOrNull() {
        return count == 0 ? null : max;
    }
}
