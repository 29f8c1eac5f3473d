package com.flowmetrics.service.core.spi;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.archive.ArchiveBucket;
import com.flowmetrics.service.core.archive.ArchiveQuery;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/** Archive-tier storage. Bucket writes merge into an existing bucket with the same {@link ArchiveBucket.Key}. */
public interface ArchiveStore {

    List<ArchiveBucket> findBuckets(ArchiveQuery query);

    /**
     * Merges {@code buckets} into the archive and deletes {@code sourceRowIds} from {@code table} in a single
     * transaction. The archive write is never visible without the delete, and the delete never happens without it.
     *
     * @return number of detailed rows deleted
     */
    int commitCompaction(MetricTable table, Collection<ArchiveBucket> buckets, Collection<Long> sourceRowIds);

    /**
     * Merges {@code rolledUp} buckets and deletes the archive rows {@code replacedBucketIds} in one transaction.
     *
     * @return number of archive rows deleted
     */
    int commitRollup(Collection<ArchiveBucket> rolledUp, Collection<Long> replacedBucketIds);

    /** Deletes buckets starting before {@code cutoff}. */
    int purgeOlderThan(Instant cutoff);

    long countBuckets();
}
