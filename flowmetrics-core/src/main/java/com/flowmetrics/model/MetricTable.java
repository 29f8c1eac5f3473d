package com.flowmetrics.model;

import java.util.List;
import java.util.Locale;

/**
 * Logical tables of the store. The three detailed tables hold individually identifiable rows; {@link #METRICS_ARCHIVE}
 * holds compacted aggregate buckets.
 */
public enum MetricTable {
    TASK_METRICS("task_metrics", "agent_id"),
    AGENT_METRICS("agent_metrics", "agent_id"),
    SWARM_METRICS("swarm_metrics", "swarm_id"),
    METRICS_ARCHIVE("metrics_archive", "scope_id");

    private static final List<MetricTable> DETAILED = List.of(TASK_METRICS, AGENT_METRICS, SWARM_METRICS);

    private final String tableName;
    private final String scopeColumn;

    MetricTable(String tableName, String scopeColumn) {
        this.tableName = tableName;
        this.scopeColumn = scopeColumn;
    }

    public String tableName() {
        return tableName;
    }

    public String scopeColumn() {
        return scopeColumn;
    }

    public boolean isDetailed() {
        return this != METRICS_ARCHIVE;
    }

    public static List<MetricTable> detailedTables() {
        return DETAILED;
    }

    public static MetricTable fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric table is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MetricTable table : values()) {
            if (table.tableName.equals(normalized)) {
                return table;
            }
        }
        // short aliases used by callers: "task", "agent", "swarm", "archive"
        for (MetricTable table : values()) {
            if (table.tableName.startsWith(normalized + "_")) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown metric table: " + value);
    }
}
