package com.flowmetrics.service.core.query;

import com.flowmetrics.model.MetricKinds;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.error.MetricsStoreException;
import java.util.Locale;

/**
 * Numeric columns that aggregates, percentiles and rankings may target. For task rows each column also names the
 * archived metric kind it compacts into.
 */
public enum ValueColumn {
    DURATION_MS(MetricKinds.TASK_DURATION_MS, MetricTable.TASK_METRICS),
    TOKENS_USED(MetricKinds.TASK_TOKENS_USED, MetricTable.TASK_METRICS),
    FILES_CHANGED(MetricKinds.TASK_FILES_CHANGED, MetricTable.TASK_METRICS),
    /** 1.0 for a successful task, 0.0 otherwise; its mean is the success rate. */
    SUCCESS(MetricKinds.TASK_SUCCESS, MetricTable.TASK_METRICS),
    VALUE("value", null);

    private final String columnName;
    private final MetricTable onlyTable;

    ValueColumn(String columnName, MetricTable onlyTable) {
        this.columnName = columnName;
        this.onlyTable = onlyTable;
    }

    public String columnName() {
        return columnName;
    }

    public boolean supports(MetricTable table) {
        if (!table.isDetailed()) {
            return false;
        }
        if (onlyTable == null) {
            return table != MetricTable.TASK_METRICS;
        }
        return onlyTable == table;
    }

    public static ValueColumn defaultFor(MetricTable table) {
        return table == MetricTable.TASK_METRICS ? DURATION_MS : VALUE;
    }

    public static ValueColumn resolve(MetricTable table, String name) {
        if (name == null || name.isBlank()) {
            return defaultFor(table);
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ValueColumn column : values()) {
            if (column.columnName.equals(normalized) && column.supports(table)) {
                return column;
            }
        }
        throw MetricsStoreException.invalidQuery("Unknown column " + name + " for table " + table.tableName());
    }
}
