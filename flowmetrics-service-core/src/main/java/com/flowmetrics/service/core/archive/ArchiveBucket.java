package com.flowmetrics.service.core.archive;

import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * One compacted aggregate: every detailed row of {@code sourceTable} for one scope and kind whose timestamp falls
 * inside {@code [bucketStart, bucketStart + level)}. {@code id} is {@code null} until the bucket is persisted.
 */
public record ArchiveBucket(
        Long id,
        MetricTable sourceTable,
        AggregationLevel level,
        Instant bucketStart,
        String scopeId,
        String metricKind,
        AggregateStats stats)
        implements MetricRecord {

    public ArchiveBucket {
        if (sourceTable == null || !sourceTable.isDetailed()) {
            throw new IllegalArgumentException("sourceTable must be a detailed table");
        }
        if (level == null || bucketStart == null) {
            throw new IllegalArgumentException("level and bucketStart are required");
        }
        if (scopeId == null || metricKind == null) {
            throw new IllegalArgumentException("scopeId and metricKind are required");
        }
        stats = stats == null ? AggregateStats.EMPTY : stats;
    }

    public static ArchiveBucket pending(
            MetricTable sourceTable,
            AggregationLevel level,
            Instant instant,
            String scopeId,
            String metricKind,
            AggregateStats stats) {
        return new ArchiveBucket(null, sourceTable, level, level.align(instant), scopeId, metricKind, stats);
    }

    public Key key() {
        return new Key(sourceTable, level, bucketStart, scopeId, metricKind);
    }

    public LocalDate archiveDate() {
        return LocalDate.ofInstant(bucketStart, ZoneOffset.UTC);
    }

    public ArchiveBucket mergedWith(AggregateStats more) {
        return new ArchiveBucket(id, sourceTable, level, bucketStart, scopeId, metricKind, stats.merge(more));
    }

    @Override
    public MetricTable table() {
        return MetricTable.METRICS_ARCHIVE;
    }

    @Override
    public Instant timestamp() {
        return bucketStart;
    }

    @Override
    public Map<String, Object> metadata() {
        return Map.of();
    }

    @Override
    public ArchiveBucket withTimestamp(Instant timestamp) {
        return new ArchiveBucket(id, sourceTable, level, timestamp, scopeId, metricKind, stats);
    }

    /** Natural identity of a bucket; the archive holds at most one row per key. */
    public record Key(
            MetricTable sourceTable, AggregationLevel level, Instant bucketStart, String scopeId, String metricKind) {}
}
