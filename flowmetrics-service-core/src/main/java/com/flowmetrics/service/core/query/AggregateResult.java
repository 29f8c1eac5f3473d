package com.flowmetrics.service.core.query;

/**
 * Scalar aggregate. {@code value} is {@code null} where the aggregation is undefined on an empty set
 * (avg, stddev, min, max); count and sum of an empty set are zero.
 */
public record AggregateResult(
        Aggregation aggregation, Double value, long count, boolean includesDetailed, boolean includesArchive) {

    public boolean isEmpty() {
        return count == 0;
    }
}
