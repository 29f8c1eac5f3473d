package com.flowmetrics.service.core.query;

import com.flowmetrics.model.MetricTable;

/** Raw-row selection. A {@code limit} of zero is only accepted for streamed reads. */
public record RecordQuery(
        MetricTable table, MetricFilters filters, TimeRange range, int limit, int offset, SortOrder order) {

    public RecordQuery {
        filters = filters == null ? MetricFilters.none() : filters;
        range = range == null ? TimeRange.all() : range;
        order = order == null ? SortOrder.ASC : order;
    }

    public static RecordQuery of(MetricTable table, MetricFilters filters, TimeRange range, int limit) {
        return new RecordQuery(table, filters, range, limit, 0, SortOrder.ASC);
    }

    public static RecordQuery stream(MetricTable table, MetricFilters filters, TimeRange range) {
        return new RecordQuery(table, filters, range, 0, 0, SortOrder.ASC);
    }

    public RecordQuery withRange(TimeRange range) {
        return new RecordQuery(table, filters, range, limit, offset, order);
    }
}
