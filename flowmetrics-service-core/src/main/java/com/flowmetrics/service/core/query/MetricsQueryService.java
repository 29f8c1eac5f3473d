package com.flowmetrics.service.core.query;

import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.service.core.archive.AggregateStats;
import com.flowmetrics.service.core.archive.AggregationLevel;
import com.flowmetrics.service.core.archive.ArchiveBucket;
import com.flowmetrics.service.core.archive.ArchiveQuery;
import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.MetricsStoreException;
import com.flowmetrics.service.core.retention.RetentionCutoffs;
import com.flowmetrics.service.core.spi.ArchiveStore;
import com.flowmetrics.service.core.spi.MetricsStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read-only questions over the detailed and archived tiers. Every range is clamped to the final retention cutoff,
 * so nothing older than the daily window is ever returned. Reads that combine both tiers run against one store
 * snapshot and therefore never count a compacted row twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricsQueryService {

    public static final int MAX_LIMIT = 100_000;

    public static final String TASK_COUNT = "task_count";
    public static final String SUCCESS_RATE = "success_rate";

    private final MetricsStore metricsStore;
    private final ArchiveStore archiveStore;
    private final MetricsProperties properties;
    private final Clock clock;

    public List<MetricRecord> getRecords(MetricTable table, MetricFilters filters, TimeRange range, int limit) {
        return getRecords(RecordQuery.of(table, filters, range, limit));
    }

    /** Raw rows; the archive table returns {@link ArchiveBucket}s. */
    public List<MetricRecord> getRecords(RecordQuery query) {
        if (query.table() == null) {
            throw MetricsStoreException.invalidQuery("Table is required");
        }
        if (query.limit() <= 0 || query.limit() > MAX_LIMIT) {
            throw MetricsStoreException.invalidQuery("Limit must be between 1 and " + MAX_LIMIT);
        }
        if (query.offset() < 0) {
            throw MetricsStoreException.invalidQuery("Offset must be >= 0");
        }
        List<MetricFilters.Term> terms = query.filters().resolve(query.table());
        RecordQuery effective = query.withRange(clamp(query.range()));
        if (effective.range().isEmpty()) {
            return List.of();
        }
        if (query.table() == MetricTable.METRICS_ARCHIVE) {
            return new ArrayList<>(archiveStore.findBuckets(toArchiveQuery(effective, terms)));
        }
        return metricsStore.readRange(effective);
    }

    /**
     * Streams detailed rows in timestamp order without materializing them.
     *
     * @return number of rows delivered
     */
    public long streamRecords(RecordQuery query, Consumer<? super MetricRecord> sink) {
        requireDetailed(query.table());
        query.filters().resolve(query.table());
        RecordQuery effective = query.withRange(clamp(query.range()));
        if (effective.range().isEmpty()) {
            return 0;
        }
        return metricsStore.streamRange(effective, sink);
    }

    public AggregateResult aggregate(
            MetricTable table, Aggregation aggregation, MetricFilters filters, TimeRange range) {
        return aggregate(table, aggregation, null, filters, range);
    }

    /**
     * Scalar aggregate of {@code column} (default {@code duration_ms} for tasks, {@code value} otherwise), merging
     * detailed rows with archived buckets that start inside the range.
     */
    public AggregateResult aggregate(
            MetricTable table, Aggregation aggregation, String column, MetricFilters filters, TimeRange range) {
        requireDetailed(table);
        if (aggregation == null) {
            throw MetricsStoreException.invalidQuery("Aggregation is required");
        }
        ValueColumn valueColumn = ValueColumn.resolve(table, column);
        MetricFilters safeFilters = filters == null ? MetricFilters.none() : filters;
        List<MetricFilters.Term> terms = safeFilters.resolve(table);
        TieredStats stats = collectStats(table, valueColumn, safeFilters, terms, clamp(range));
        AggregateStats merged = stats.merged();
        return new AggregateResult(
                aggregation,
                aggregation.apply(merged),
                merged.count(),
                !stats.detailed().isEmpty(),
                !stats.archived().isEmpty());
    }

    /**
     * Percentile {@code p} in {@code [0, 1]}. Exact over detailed rows; when archived buckets also fall inside the
     * range their points are interpolated and the result is flagged {@code APPROXIMATE} or {@code MIXED}.
     */
    public PercentileResult percentile(
            MetricTable table, String column, double p, MetricFilters filters, TimeRange range) {
        requireDetailed(table);
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw MetricsStoreException.invalidQuery("Percentile must be within [0, 1]: " + p);
        }
        ValueColumn valueColumn = ValueColumn.resolve(table, column);
        MetricFilters safeFilters = filters == null ? MetricFilters.none() : filters;
        List<MetricFilters.Term> terms = safeFilters.resolve(table);
        TimeRange effective = clamp(range);
        if (effective.isEmpty()) {
            return new PercentileResult(p, null, 0, PercentileResult.Precision.EXACT);
        }
        return metricsStore.readConsistently(() -> {
            List<Double> exact = metricsStore.readColumnSorted(table, valueColumn, safeFilters, effective);
            List<AggregateStats> archived = new ArrayList<>();
            for (ArchiveBucket bucket : archivedBuckets(table, valueColumn, safeFilters, terms, effective)) {
                archived.add(bucket.stats());
            }
            long archivedCount = archived.stream().mapToLong(AggregateStats::count).sum();
            if (archivedCount == 0) {
                return new PercentileResult(
                        p, PercentileEstimator.exact(exact, p), exact.size(), PercentileResult.Precision.EXACT);
            }
            PercentileResult.Precision precision =
                    exact.isEmpty() ? PercentileResult.Precision.APPROXIMATE : PercentileResult.Precision.MIXED;
            return new PercentileResult(
                    p, PercentileEstimator.estimate(exact, archived, p), exact.size() + archivedCount, precision);
        });
    }

    public List<TopNEntry> topN(MetricTable table, String metricKind, SortOrder order, int n) {
        return topN(table, metricKind, order, n, TimeRange.all());
    }

    /**
     * Ranks agents or swarms by the mean of {@code metricKind} over the range. For tasks the kind is a value column,
     * {@code success_rate} or {@code task_count}.
     */
    public List<TopNEntry> topN(MetricTable table, String metricKind, SortOrder order, int n, TimeRange range) {
        requireDetailed(table);
        if (n <= 0 || n > MAX_LIMIT) {
            throw MetricsStoreException.invalidQuery("n must be between 1 and " + MAX_LIMIT);
        }
        if (metricKind == null || metricKind.isBlank()) {
            throw MetricsStoreException.invalidQuery("Metric kind is required for top-n");
        }
        boolean byCount = false;
        ValueColumn column;
        MetricFilters filters = MetricFilters.none();
        if (table == MetricTable.TASK_METRICS) {
            String kind = metricKind.trim().toLowerCase(Locale.ROOT);
            if (TASK_COUNT.equals(kind)) {
                byCount = true;
                column = ValueColumn.DURATION_MS;
            } else if (SUCCESS_RATE.equals(kind)) {
                column = ValueColumn.SUCCESS;
            } else {
                column = ValueColumn.resolve(table, kind);
            }
        } else {
            column = ValueColumn.VALUE;
            filters = MetricFilters.of("metric_kind", metricKind);
        }
        List<MetricFilters.Term> terms = filters.resolve(table);
        TimeRange effective = clamp(range);
        if (effective.isEmpty()) {
            return List.of();
        }
        MetricFilters selection = filters;
        Map<String, AggregateStats> byScope = metricsStore.readConsistently(() -> {
            Map<String, AggregateStats> merged =
                    new HashMap<>(metricsStore.aggregateDetailedByScope(table, column, selection, effective));
            for (ArchiveBucket bucket : archivedBuckets(table, column, selection, terms, effective)) {
                merged.merge(bucket.scopeId(), bucket.stats(), AggregateStats::merge);
            }
            return merged;
        });

        List<TopNEntry> entries = new ArrayList<>(byScope.size());
        for (Map.Entry<String, AggregateStats> entry : byScope.entrySet()) {
            AggregateStats stats = entry.getValue();
            if (stats.isEmpty()) {
                continue;
            }
            double value = byCount ? stats.count() : stats.mean();
            entries.add(new TopNEntry(entry.getKey(), value, stats.count()));
        }
        Comparator<TopNEntry> byValue = Comparator.comparingDouble(TopNEntry::value);
        if (order != SortOrder.ASC) {
            byValue = byValue.reversed();
        }
        entries.sort(byValue.thenComparing(TopNEntry::scopeId));
        return entries.size() > n ? new ArrayList<>(entries.subList(0, n)) : entries;
    }

    /** Time-series buckets over the detailed tier. */
    public List<TimeSeriesPoint> aggregateByTime(
            MetricTable table, String column, TimeInterval interval, MetricFilters filters, TimeRange range) {
        requireDetailed(table);
        ValueColumn valueColumn = ValueColumn.resolve(table, column);
        MetricFilters safeFilters = filters == null ? MetricFilters.none() : filters;
        safeFilters.resolve(table);
        TimeRange effective = clamp(range);
        if (effective.isEmpty()) {
            return List.of();
        }
        TimeInterval bucket = interval == null ? TimeInterval.HOUR : interval;
        return metricsStore.aggregateByTime(
                table, valueColumn, safeFilters, effective, bucket.duration().toMillis());
    }

    /** One filter set per distinct series of {@code table} in the range, usable to stream that series alone. */
    public List<MetricFilters> series(MetricTable table, TimeRange range) {
        requireDetailed(table);
        TimeRange effective = clamp(range);
        if (effective.isEmpty()) {
            return List.of();
        }
        List<MetricFilters> result = new ArrayList<>();
        for (Map<String, String> series : metricsStore.distinctSeries(table, effective)) {
            result.add(MetricFilters.from(series));
        }
        return result;
    }

    public List<TaskMetric> slowestTasks(int n, MetricFilters filters, TimeRange range) {
        if (n <= 0 || n > MAX_LIMIT) {
            throw MetricsStoreException.invalidQuery("n must be between 1 and " + MAX_LIMIT);
        }
        MetricFilters safeFilters = filters == null ? MetricFilters.none() : filters;
        safeFilters.resolve(MetricTable.TASK_METRICS);
        TimeRange effective = clamp(range);
        if (effective.isEmpty()) {
            return List.of();
        }
        return metricsStore.slowestTasks(safeFilters, effective, n);
    }

    /** Headline task statistics over the detailed tier. */
    public TaskSummary summaryStats(TimeRange range) {
        TimeRange effective = clamp(range);
        if (effective.isEmpty()) {
            return TaskSummary.empty();
        }
        MetricTable table = MetricTable.TASK_METRICS;
        MetricFilters none = MetricFilters.none();
        return metricsStore.readConsistently(() -> {
            AggregateStats duration = metricsStore.aggregateDetailed(table, ValueColumn.DURATION_MS, none, effective);
            if (duration.isEmpty()) {
                return TaskSummary.empty();
            }
            AggregateStats success = metricsStore.aggregateDetailed(table, ValueColumn.SUCCESS, none, effective);
            AggregateStats tokens = metricsStore.aggregateDetailed(table, ValueColumn.TOKENS_USED, none, effective);
            List<Double> sorted = metricsStore.readColumnSorted(table, ValueColumn.DURATION_MS, none, effective);
            int agents = metricsStore
                    .aggregateDetailedByScope(table, ValueColumn.DURATION_MS, none, effective)
                    .size();
            long total = duration.count();
            long successful = Math.round(success.sum());
            return new TaskSummary(
                    total,
                    successful,
                    (double) successful / total,
                    duration.mean(),
                    PercentileEstimator.exact(sorted, 0.95),
                    PercentileEstimator.exact(sorted, 0.99),
                    Math.round(tokens.sum()),
                    tokens.mean(),
                    agents);
        });
    }

    public AgentPerformance agentPerformance(String agentId, TimeRange range) {
        if (agentId == null || agentId.isBlank()) {
            throw MetricsStoreException.invalidQuery("agentId is required");
        }
        MetricTable table = MetricTable.TASK_METRICS;
        MetricFilters filters = MetricFilters.of("agent_id", agentId);
        List<MetricFilters.Term> terms = filters.resolve(table);
        TimeRange effective = clamp(range);
        return metricsStore.readConsistently(() -> {
            TieredStats duration = collectStats(table, ValueColumn.DURATION_MS, filters, terms, effective);
            TieredStats success = collectStats(table, ValueColumn.SUCCESS, filters, terms, effective);
            TieredStats tokens = collectStats(table, ValueColumn.TOKENS_USED, filters, terms, effective);
            long total = duration.merged().count();
            long successful = Math.round(success.merged().sum());
            double successRate = total == 0 ? 0.0 : (double) successful / total;
            return new AgentPerformance(
                    agentId,
                    total,
                    successful,
                    successRate,
                    total == 0 ? 0.0 : 1.0 - successRate,
                    duration.merged().mean(),
                    Math.round(tokens.merged().sum()),
                    !duration.archived().isEmpty());
        });
    }

    public SwarmHealth swarmHealth(String swarmId, TimeRange range) {
        if (swarmId == null || swarmId.isBlank()) {
            throw MetricsStoreException.invalidQuery("swarmId is required");
        }
        TimeRange effective = clamp(range);
        if (effective.isEmpty()) {
            return new SwarmHealth(swarmId, Map.of(), null);
        }
        Map<String, Double> latest = new TreeMap<>();
        Instant lastUpdated = null;
        for (MetricRecord record : metricsStore.latestPerKind(MetricTable.SWARM_METRICS, swarmId, effective)) {
            if (record instanceof SwarmMetric swarm) {
                latest.put(swarm.metricKind(), swarm.value());
                if (lastUpdated == null || swarm.timestamp().isAfter(lastUpdated)) {
                    lastUpdated = swarm.timestamp();
                }
            }
        }
        return new SwarmHealth(swarmId, latest, lastUpdated);
    }

    /** Latest value per kind for one agent, the agent-side counterpart of {@link #swarmHealth}. */
    public Map<String, Double> latestAgentMetrics(String agentId, TimeRange range) {
        if (agentId == null || agentId.isBlank()) {
            throw MetricsStoreException.invalidQuery("agentId is required");
        }
        TimeRange effective = clamp(range);
        Map<String, Double> latest = new TreeMap<>();
        if (effective.isEmpty()) {
            return latest;
        }
        for (MetricRecord record : metricsStore.latestPerKind(MetricTable.AGENT_METRICS, agentId, effective)) {
            if (record instanceof AgentMetric agent) {
                latest.put(agent.metricKind(), agent.value());
            }
        }
        return latest;
    }

    TimeRange clamp(TimeRange range) {
        TimeRange safe = range == null ? TimeRange.all() : range;
        return safe.clampFrom(RetentionCutoffs.finalCutoff(clock, properties.getRetention()));
    }

    private TieredStats collectStats(
            MetricTable table,
            ValueColumn column,
            MetricFilters filters,
            List<MetricFilters.Term> terms,
            TimeRange range) {
        if (range.isEmpty()) {
            return new TieredStats(AggregateStats.EMPTY, AggregateStats.EMPTY);
        }
        return metricsStore.readConsistently(() -> {
            AggregateStats detailed = metricsStore.aggregateDetailed(table, column, filters, range);
            AggregateStats archived = AggregateStats.EMPTY;
            for (ArchiveBucket bucket : archivedBuckets(table, column, filters, terms, range)) {
                archived = archived.merge(bucket.stats());
            }
            return new TieredStats(detailed, archived);
        });
    }

    /** Buckets that answer the same question as the detailed rows, or none when a filter has no archived form. */
    private List<ArchiveBucket> archivedBuckets(
            MetricTable table,
            ValueColumn column,
            MetricFilters filters,
            List<MetricFilters.Term> terms,
            TimeRange range) {
        if (!filters.archiveCompatible(table)) {
            return List.of();
        }
        String scopeId = termValue(terms, table.scopeColumn());
        String kind = column == ValueColumn.VALUE ? termValue(terms, "metric_kind") : column.columnName();
        ArchiveQuery query = ArchiveQuery.forTable(table, range).withScope(scopeId).withMetricKind(kind);
        return archiveStore.findBuckets(query);
    }

    private ArchiveQuery toArchiveQuery(RecordQuery query, List<MetricFilters.Term> terms) {
        String sourceTable = termValue(terms, "source_table");
        String level = termValue(terms, "aggregation_level");
        return new ArchiveQuery(
                sourceTable == null ? null : MetricTable.fromString(sourceTable),
                level == null ? null : AggregationLevel.fromString(level),
                termValue(terms, "scope_id"),
                termValue(terms, "metric_kind"),
                query.range(),
                query.limit(),
                query.offset(),
                query.order());
    }

    private static String termValue(List<MetricFilters.Term> terms, String key) {
        for (MetricFilters.Term term : terms) {
            if (!term.metadata() && term.key().equals(key)) {
                return term.value();
            }
        }
        return null;
    }

    private static void requireDetailed(MetricTable table) {
        if (table == null || !table.isDetailed()) {
            throw MetricsStoreException.invalidQuery(
                    "Operation requires a detailed table: " + (table == null ? null : table.tableName()));
        }
    }

    record TieredStats(AggregateStats detailed, AggregateStats archived) {
        AggregateStats merged() {
            return detailed.merge(archived);
        }
    }
}
