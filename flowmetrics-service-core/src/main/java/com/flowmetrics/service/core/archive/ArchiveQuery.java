package com.flowmetrics.service.core.archive;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.query.SortOrder;
import com.flowmetrics.service.core.query.TimeRange;

/**
 * Selection over archived buckets. Null fields match anything; the range applies to the bucket start and results
 * are ordered by it.
 * A {@code limit} of zero means unbounded.
 */
public record ArchiveQuery(
        MetricTable sourceTable,
        AggregationLevel level,
        String scopeId,
        String metricKind,
        TimeRange range,
        int limit,
        int offset,
        SortOrder order) {

    public ArchiveQuery {
        range = range == null ? TimeRange.all() : range;
        order = order == null ? SortOrder.ASC : order;
    }

    public static ArchiveQuery forTable(MetricTable sourceTable, TimeRange range) {
        return new ArchiveQuery(sourceTable, null, null, null, range, 0, 0, SortOrder.ASC);
    }

    public ArchiveQuery withLevel(AggregationLevel level) {
        return new ArchiveQuery(sourceTable, level, scopeId, metricKind, range, limit, offset, order);
    }

    public ArchiveQuery withScope(String scopeId) {
        return new ArchiveQuery(sourceTable, level, scopeId, metricKind, range, limit, offset, order);
    }

    public ArchiveQuery withMetricKind(String metricKind) {
        return new ArchiveQuery(sourceTable, level, scopeId, metricKind, range, limit, offset, order);
    }
}
