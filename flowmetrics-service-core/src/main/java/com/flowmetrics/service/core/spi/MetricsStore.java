package com.flowmetrics.service.core.spi;

import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.service.core.archive.AggregateStats;
import com.flowmetrics.service.core.query.MetricFilters;
import com.flowmetrics.service.core.query.RecordQuery;
import com.flowmetrics.service.core.query.TimeRange;
import com.flowmetrics.service.core.query.TimeSeriesPoint;
import com.flowmetrics.service.core.query.ValueColumn;
import com.flowmetrics.service.core.retention.CompactionCandidate;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Detailed-tier storage primitives. Implementations translate medium errors into
 * {@link com.flowmetrics.service.core.error.MetricsStoreException} and release their handles on every exit path.
 * Filters handed to these methods have already been validated for the table.
 */
public interface MetricsStore {

    /** Appends one record atomically. A record without a timestamp is stamped with the store clock. */
    void write(MetricRecord record);

    /** Appends all records in one transaction; either every record is visible afterwards or none is. */
    void writeBatch(List<? extends MetricRecord> records);

    /** Ordered by timestamp, then insertion order. */
    List<MetricRecord> readRange(RecordQuery query);

    /**
     * Streams matching rows to {@code sink} without materializing the result. Stops with
     * {@code CANCELLED} when the calling thread is interrupted.
     *
     * @return number of rows delivered
     */
    long streamRange(RecordQuery query, Consumer<? super MetricRecord> sink);

    AggregateStats aggregateDetailed(MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range);

    Map<String, AggregateStats> aggregateDetailedByScope(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range);

    List<Double> readColumnSorted(MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range);

    List<TimeSeriesPoint> aggregateByTime(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range, long bucketMillis);

    List<TaskMetric> slowestTasks(MetricFilters filters, TimeRange range, int limit);

    /** Most recent row per metric kind for one agent or swarm. */
    List<MetricRecord> latestPerKind(MetricTable table, String scopeId, TimeRange range);

    /**
     * Distinct series in the range, ordered: the scope id for task rows, scope id and metric kind otherwise. Each
     * entry maps filter key to value.
     */
    List<Map<String, String>> distinctSeries(MetricTable table, TimeRange range);

    List<CompactionCandidate> selectCompactionCandidates(MetricTable table, Instant olderThan, int limit);

    int deleteOlderThan(MetricTable table, Instant cutoff);

    /**
     * Runs {@code action} against one consistent snapshot of the store, so reads spanning the detailed and the
     * archive tier never observe a compaction half-applied.
     */
    <T> T readConsistently(Supplier<T> action);

    void vacuum();

    void analyze();
}
