package com.flowmetrics.service.core.retention;

import com.flowmetrics.model.MetricTable;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;

/** Outcome of one retention pass. {@code failures} maps each table that failed to the error message. */
@Builder
public record CompactionReport(
        Instant startedAt,
        Instant finishedAt,
        Map<MetricTable, Integer> purgedRows,
        int purgedBuckets,
        Map<MetricTable, Integer> compactedRows,
        Map<MetricTable, Integer> hourlyBucketsWritten,
        Map<MetricTable, Integer> hourlyBucketsRolledUp,
        boolean vacuumed,
        Map<MetricTable, String> failures) {

    public boolean hasFailures() {
        return failures != null && !failures.isEmpty();
    }

    public int totalCompactedRows() {
        return compactedRows == null
                ? 0
                : compactedRows.values().stream().mapToInt(Integer::intValue).sum();
    }
}
