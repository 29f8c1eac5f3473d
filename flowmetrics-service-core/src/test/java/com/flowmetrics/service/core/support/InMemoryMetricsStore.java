package com.flowmetrics.service.core.support;

import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.service.core.archive.AggregateStats;
import com.flowmetrics.service.core.error.MetricsStoreException;
import com.flowmetrics.service.core.query.MetricFilters;
import com.flowmetrics.service.core.query.RecordQuery;
import com.flowmetrics.service.core.query.TimeRange;
import com.flowmetrics.service.core.query.TimeSeriesPoint;
import com.flowmetrics.service.core.query.ValueColumn;
import com.flowmetrics.service.core.retention.CompactionCandidate;
import com.flowmetrics.service.core.spi.MetricsStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/** Thread-safe list-backed store covering writes, range reads and the retention primitives. */
public class InMemoryMetricsStore implements MetricsStore {

    private final List<Row> rows = new ArrayList<>();
    private long nextId = 1;
    private volatile RuntimeException failure;
    private int batches;

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public synchronized List<MetricRecord> all() {
        List<MetricRecord> out = new ArrayList<>(rows.size());
        rows.forEach(row -> out.add(row.record()));
        return out;
    }

    public synchronized int size() {
        return rows.size();
    }

    public synchronized int batches() {
        return batches;
    }

    @Override
    public void write(MetricRecord record) {
        writeBatch(List.of(record));
    }

    @Override
    public synchronized void writeBatch(List<? extends MetricRecord> records) {
        RuntimeException current = failure;
        if (current != null) {
            throw current;
        }
        batches++;
        for (MetricRecord record : records) {
            rows.add(new Row(nextId++, record));
        }
    }

    @Override
    public synchronized List<MetricRecord> readRange(RecordQuery query) {
        List<MetricRecord> out = new ArrayList<>();
        for (Row row : rows) {
            if (row.record().table() == query.table() && query.range().contains(row.record().timestamp())) {
                out.add(row.record());
            }
        }
        return out;
    }

    @Override
    public long streamRange(RecordQuery query, Consumer<? super MetricRecord> sink) {
        List<MetricRecord> matched = readRange(query);
        matched.forEach(sink);
        return matched.size();
    }

    @Override
    public AggregateStats aggregateDetailed(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range) {
        throw new UnsupportedOperationException();
    }

    @Override
    public Map<String, AggregateStats> aggregateDetailedByScope(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range) {
        throw new UnsupportedOperationException();
    }

    @Override
    public List<Double> readColumnSorted(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range) {
        throw new UnsupportedOperationException();
    }

    @Override
    public List<TimeSeriesPoint> aggregateByTime(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range, long bucketMillis) {
        throw new UnsupportedOperationException();
    }

    @Override
    public List<TaskMetric> slowestTasks(MetricFilters filters, TimeRange range, int limit) {
        throw new UnsupportedOperationException();
    }

    @Override
    public List<MetricRecord> latestPerKind(MetricTable table, String scopeId, TimeRange range) {
        throw new UnsupportedOperationException();
    }

    @Override
    public List<Map<String, String>> distinctSeries(MetricTable table, TimeRange range) {
        throw new UnsupportedOperationException();
    }

    @Override
    public synchronized List<CompactionCandidate> selectCompactionCandidates(
            MetricTable table, Instant olderThan, int limit) {
        List<CompactionCandidate> out = new ArrayList<>();
        for (Row row : rows) {
            if (out.size() == limit) {
                break;
            }
            if (row.record().table() == table && row.record().timestamp().isBefore(olderThan)) {
                out.add(new CompactionCandidate(row.id(), row.record()));
            }
        }
        return out;
    }

    /** Removes rows by id, as an archive commit would. */
    public synchronized int deleteIds(MetricTable table, Collection<Long> ids) {
        int before = rows.size();
        rows.removeIf(row -> row.record().table() == table && ids.contains(row.id()));
        return before - rows.size();
    }

    @Override
    public synchronized int deleteOlderThan(MetricTable table, Instant cutoff) {
        int before = rows.size();
        rows.removeIf(row -> row.record().table() == table && row.record().timestamp().isBefore(cutoff));
        return before - rows.size();
    }

    @Override
    public <T> T readConsistently(Supplier<T> action) {
        synchronized (this) {
            return action.get();
        }
    }

    @Override
    public void vacuum() {}

    @Override
    public void analyze() {}

    public static MetricsStoreException unavailable() {
        return MetricsStoreException.storageUnavailable("disk detached", null);
    }

    private record Row(long id, MetricRecord record) {}
}
