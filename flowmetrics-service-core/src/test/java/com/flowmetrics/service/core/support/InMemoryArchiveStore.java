package com.flowmetrics.service.core.support;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.archive.ArchiveBucket;
import com.flowmetrics.service.core.archive.ArchiveQuery;
import com.flowmetrics.service.core.spi.ArchiveStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Archive fake that merges on the bucket key and deletes source rows from an {@link InMemoryMetricsStore}. */
public class InMemoryArchiveStore implements ArchiveStore {

    private final InMemoryMetricsStore detailed;
    private final Map<ArchiveBucket.Key, ArchiveBucket> buckets = new LinkedHashMap<>();
    private long nextId = 1;
    private RuntimeException failureFor;
    private MetricTable failingTable;

    public InMemoryArchiveStore(InMemoryMetricsStore detailed) {
        this.detailed = detailed;
    }

    public void failCompactionOf(MetricTable table, RuntimeException failure) {
        this.failingTable = table;
        this.failureFor = failure;
    }

    public synchronized List<ArchiveBucket> all() {
        return new ArrayList<>(buckets.values());
    }

    @Override
    public synchronized List<ArchiveBucket> findBuckets(ArchiveQuery query) {
        List<ArchiveBucket> out = new ArrayList<>();
        for (ArchiveBucket bucket : buckets.values()) {
            if ((query.sourceTable() == null || bucket.sourceTable() == query.sourceTable())
                    && (query.level() == null || bucket.level() == query.level())
                    && (query.scopeId() == null || bucket.scopeId().equals(query.scopeId()))
                    && (query.metricKind() == null || bucket.metricKind().equals(query.metricKind()))
                    && query.range().contains(bucket.bucketStart())) {
                out.add(bucket);
            }
        }
        return out;
    }

    @Override
    public synchronized int commitCompaction(
            MetricTable table, Collection<ArchiveBucket> incoming, Collection<Long> sourceRowIds) {
        if (table == failingTable) {
            throw failureFor;
        }
        incoming.forEach(this::merge);
        return detailed.deleteIds(table, sourceRowIds);
    }

    @Override
    public synchronized int commitRollup(Collection<ArchiveBucket> rolledUp, Collection<Long> replacedBucketIds) {
        int before = buckets.size();
        buckets.values().removeIf(bucket -> replacedBucketIds.contains(bucket.id()));
        int removed = before - buckets.size();
        rolledUp.forEach(this::merge);
        return removed;
    }

    @Override
    public synchronized int purgeOlderThan(Instant cutoff) {
        int before = buckets.size();
        buckets.values().removeIf(bucket -> bucket.bucketStart().isBefore(cutoff));
        return before - buckets.size();
    }

    @Override
    public synchronized long countBuckets() {
        return buckets.size();
    }

    private void merge(ArchiveBucket bucket) {
        buckets.merge(
                bucket.key(),
                new ArchiveBucket(
                        nextId++,
                        bucket.sourceTable(),
                        bucket.level(),
                        bucket.bucketStart(),
                        bucket.scopeId(),
                        bucket.metricKind(),
                        bucket.stats()),
                (existing, added) -> existing.mergedWith(added.stats()));
    }
}
