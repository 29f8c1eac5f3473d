package com.flowmetrics.service.core.export;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.query.TimeRange;
import java.util.Map;

public record ExportResult(
        ExportFormat format,
        String target,
        Map<MetricTable, Long> recordCounts,
        boolean compressed,
        TimeRange range) {

    public long totalRecords() {
        return recordCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
