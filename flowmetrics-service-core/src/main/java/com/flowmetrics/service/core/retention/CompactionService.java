package com.flowmetrics.service.core.retention;

import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricKinds;
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
import com.flowmetrics.service.core.query.TimeRange;
import com.flowmetrics.service.core.spi.ArchiveStore;
import com.flowmetrics.service.core.spi.MetricsStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Enforces the three-tier retention policy. A pass purges expired data, compacts detailed rows into hourly buckets,
 * rolls old hourly buckets into daily ones and optionally vacuums. Every archive write commits together with the
 * delete of the rows it replaces, so a crashed pass can simply be re-run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompactionService {

    private final MetricsStore metricsStore;
    private final ArchiveStore archiveStore;
    private final MetricsProperties properties;
    private final Clock clock;

    private final ReentrantLock passLock = new ReentrantLock();
    private volatile CompactionReport lastReport;

    /**
     * Runs one full retention pass. Passes never overlap; a caller arriving while one is running waits up to the
     * storage lock timeout.
     *
     * @throws MetricsStoreException {@code RETENTION_FAILURE} after all tables were processed if any of them failed
     */
    public CompactionReport runCompaction() {
        long waitMillis = properties.getStorage().getLockTimeout().toMillis();
        try {
            if (!passLock.tryLock(waitMillis, TimeUnit.MILLISECONDS)) {
                throw MetricsStoreException.timeout("Timed out waiting for running retention pass", null);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw MetricsStoreException.cancelled("Interrupted while waiting for retention pass");
        }
        try {
            return runPass();
        } finally {
            passLock.unlock();
        }
    }

    public CompactionReport lastReport() {
        return lastReport;
    }

    private CompactionReport runPass() {
        MetricsProperties.Retention retention = properties.getRetention();
        RetentionCutoffs cutoffs = RetentionCutoffs.from(clock, retention);
        log.info(
                "Retention pass started detailedBefore={} hourlyBefore={} purgeBefore={}",
                cutoffs.detailed(),
                cutoffs.hourly(),
                cutoffs.daily());

        Map<MetricTable, String> failures = new EnumMap<>(MetricTable.class);
        Map<MetricTable, Integer> purged = new EnumMap<>(MetricTable.class);
        Map<MetricTable, Integer> compacted = new EnumMap<>(MetricTable.class);
        Map<MetricTable, Integer> written = new EnumMap<>(MetricTable.class);
        Map<MetricTable, Integer> rolledUp = new EnumMap<>(MetricTable.class);
        RuntimeException firstFailure = null;
        int purgedBuckets = 0;

        for (MetricTable table : MetricTable.detailedTables()) {
            try {
                purged.put(table, metricsStore.deleteOlderThan(table, cutoffs.daily()));
            } catch (RuntimeException ex) {
                firstFailure = recordFailure(failures, table, "purge", ex, firstFailure);
            }
        }
        try {
            purgedBuckets = archiveStore.purgeOlderThan(cutoffs.daily());
        } catch (RuntimeException ex) {
            firstFailure = recordFailure(failures, MetricTable.METRICS_ARCHIVE, "purge", ex, firstFailure);
        }

        for (MetricTable table : MetricTable.detailedTables()) {
            try {
                int[] result = compactTable(table, cutoffs, retention.getBatchSize());
                compacted.put(table, result[0]);
                written.put(table, result[1]);
            } catch (RuntimeException ex) {
                firstFailure = recordFailure(failures, table, "compaction", ex, firstFailure);
            }
        }

        for (MetricTable table : MetricTable.detailedTables()) {
            try {
                rolledUp.put(table, rollupTable(table, cutoffs));
            } catch (RuntimeException ex) {
                firstFailure = recordFailure(failures, table, "daily rollup", ex, firstFailure);
            }
        }

        boolean vacuumed = false;
        if (retention.isVacuumAfterCompaction()) {
            try {
                metricsStore.vacuum();
                metricsStore.analyze();
                vacuumed = true;
            } catch (RuntimeException ex) {
                log.error("Vacuum after retention pass failed", ex);
            }
        }

        CompactionReport report = CompactionReport.builder()
                .startedAt(cutoffs.now())
                .finishedAt(clock.instant())
                .purgedRows(purged)
                .purgedBuckets(purgedBuckets)
                .compactedRows(compacted)
                .hourlyBucketsWritten(written)
                .hourlyBucketsRolledUp(rolledUp)
                .vacuumed(vacuumed)
                .failures(failures)
                .build();
        lastReport = report;
        log.info(
                "Retention pass finished purged={} purgedBuckets={} compacted={} bucketsWritten={} rolledUp={} failures={}",
                purged,
                purgedBuckets,
                compacted,
                written,
                rolledUp,
                failures.keySet());
        if (report.hasFailures()) {
            throw MetricsStoreException.retentionFailure(
                    "Retention pass failed for " + failures.keySet() + ": " + failures.values(), firstFailure);
        }
        return report;
    }

    private int[] compactTable(MetricTable table, RetentionCutoffs cutoffs, int batchSize) {
        int rows = 0;
        int buckets = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw MetricsStoreException.cancelled("Compaction of " + table.tableName() + " interrupted");
            }
            List<CompactionCandidate> batch =
                    metricsStore.selectCompactionCandidates(table, cutoffs.detailed(), batchSize);
            if (batch.isEmpty()) {
                break;
            }
            Collection<ArchiveBucket> grouped = bucketize(batch, AggregationLevel.HOURLY);
            List<Long> ids = new ArrayList<>(batch.size());
            for (CompactionCandidate candidate : batch) {
                ids.add(candidate.rowId());
            }
            int deleted = archiveStore.commitCompaction(table, grouped, ids);
            rows += deleted;
            buckets += grouped.size();
            if (log.isDebugEnabled()) {
                log.debug("Compacted batch table={} rows={} buckets={}", table.tableName(), deleted, grouped.size());
            }
            if (deleted == 0) {
                log.warn("Compaction batch for {} deleted no rows; stopping this table", table.tableName());
                break;
            }
        }
        return new int[] {rows, buckets};
    }

    private int rollupTable(MetricTable table, RetentionCutoffs cutoffs) {
        List<ArchiveBucket> hourly = archiveStore.findBuckets(ArchiveQuery.forTable(
                        table, TimeRange.between(null, cutoffs.hourly()))
                .withLevel(AggregationLevel.HOURLY));
        if (hourly.isEmpty()) {
            return 0;
        }
        Map<ArchiveBucket.Key, ArchiveBucket> daily = new LinkedHashMap<>();
        List<Long> replaced = new ArrayList<>(hourly.size());
        for (ArchiveBucket bucket : hourly) {
            ArchiveBucket target = ArchiveBucket.pending(
                    table,
                    AggregationLevel.DAILY,
                    bucket.bucketStart(),
                    bucket.scopeId(),
                    bucket.metricKind(),
                    AggregateStats.EMPTY);
            daily.merge(target.key(), target.mergedWith(bucket.stats()), (a, b) -> a.mergedWith(b.stats()));
            replaced.add(bucket.id());
        }
        archiveStore.commitRollup(daily.values(), replaced);
        return replaced.size();
    }

    static Collection<ArchiveBucket> bucketize(List<CompactionCandidate> candidates, AggregationLevel level) {
        Map<ArchiveBucket.Key, ArchiveBucket> buckets = new LinkedHashMap<>();
        for (CompactionCandidate candidate : candidates) {
            MetricRecord record = candidate.record();
            for (Map.Entry<String, Double> sample : samples(record).entrySet()) {
                ArchiveBucket bucket = ArchiveBucket.pending(
                        record.table(),
                        level,
                        record.timestamp(),
                        record.scopeId(),
                        sample.getKey(),
                        AggregateStats.of(sample.getValue()));
                buckets.merge(bucket.key(), bucket, (a, b) -> a.mergedWith(b.stats()));
            }
        }
        return buckets.values();
    }

    /** The (metric kind, value) pairs a detailed row contributes to the archive. */
    static Map<String, Double> samples(MetricRecord record) {
        Map<String, Double> samples = new LinkedHashMap<>();
        if (record instanceof TaskMetric task) {
            samples.put(MetricKinds.TASK_DURATION_MS, (double) task.durationMs());
            samples.put(MetricKinds.TASK_TOKENS_USED, (double) task.tokensUsed());
            samples.put(MetricKinds.TASK_FILES_CHANGED, (double) task.filesChanged());
            samples.put(MetricKinds.TASK_SUCCESS, task.success() ? 1.0 : 0.0);
        } else if (record instanceof AgentMetric agent) {
            samples.put(agent.metricKind(), agent.value());
        } else if (record instanceof SwarmMetric swarm) {
            samples.put(swarm.metricKind(), swarm.value());
        } else {
            throw new IllegalArgumentException("Not a detailed record: " + record.getClass().getSimpleName());
        }
        return samples;
    }

    private RuntimeException recordFailure(
            Map<MetricTable, String> failures,
            MetricTable table,
            String step,
            RuntimeException ex,
            RuntimeException firstFailure) {
        log.error("Retention {} failed for {}", step, table.tableName(), ex);
        failures.merge(table, step + ": " + ex.getMessage(), (a, b) -> a + "; " + b);
        return firstFailure == null ? ex : firstFailure;
    }
}
