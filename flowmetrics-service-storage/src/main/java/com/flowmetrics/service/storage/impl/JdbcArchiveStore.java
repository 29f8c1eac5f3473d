package com.flowmetrics.service.storage.impl;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.archive.AggregateStats;
import com.flowmetrics.service.core.archive.AggregationLevel;
import com.flowmetrics.service.core.archive.ArchiveBucket;
import com.flowmetrics.service.core.archive.ArchivePayloadCodec;
import com.flowmetrics.service.core.archive.ArchiveQuery;
import com.flowmetrics.service.core.query.SortOrder;
import com.flowmetrics.service.core.spi.ArchiveStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * SQLite-backed archive tier. Bucket writes are upsert-merges on the natural key and commit in the same transaction
 * as the delete of the rows they replace, so an interrupted pass leaves either both or neither.
 */
@Repository
@DependsOn("schemaInitializer")
@RequiredArgsConstructor
@Slf4j
public class JdbcArchiveStore implements ArchiveStore {

    private static final int DELETE_CHUNK = 500;

    private static final String SELECT_BY_KEY =
            """
            SELECT id, record_count, payload FROM metrics_archive
            WHERE metric_table = ? AND aggregation_level = ? AND bucket_start = ? AND scope_id = ? AND metric_kind = ?
            """;

    private static final String INSERT_BUCKET =
            """
            INSERT INTO metrics_archive (metric_table, aggregation_level, bucket_start, archive_date, scope_id,
                                         metric_kind, record_count, payload, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_BUCKET =
            "UPDATE metrics_archive SET record_count = ?, payload = ?, updated_at = ? WHERE id = ?";

    private static final RowMapper<ArchiveBucket> BUCKET_MAPPER = (rs, rowNum) -> new ArchiveBucket(
            rs.getLong("id"),
            MetricTable.fromString(rs.getString("metric_table")),
            AggregationLevel.fromString(rs.getString("aggregation_level")),
            Instant.ofEpochMilli(rs.getLong("bucket_start")),
            rs.getString("scope_id"),
            rs.getString("metric_kind"),
            ArchivePayloadCodec.deserialize(rs.getBytes("payload")));

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;
    private final TransactionTemplate txTemplate;
    private final TransientFailureRetry retry;
    private final StorageWriteLock writeLock;
    private final Clock clock;

    @Override
    public List<ArchiveBucket> findBuckets(ArchiveQuery query) {
        List<String> clauses = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (query.sourceTable() != null) {
            clauses.add("metric_table = :metric_table");
            params.addValue("metric_table", query.sourceTable().tableName());
        }
        if (query.level() != null) {
            clauses.add("aggregation_level = :level");
            params.addValue("level", query.level().wireValue());
        }
        if (query.scopeId() != null) {
            clauses.add("scope_id = :scope_id");
            params.addValue("scope_id", query.scopeId());
        }
        if (query.metricKind() != null) {
            clauses.add("metric_kind = :metric_kind");
            params.addValue("metric_kind", query.metricKind());
        }
        if (query.range().from() != null) {
            clauses.add("bucket_start >= :from_ms");
            params.addValue("from_ms", query.range().fromMillis());
        }
        if (query.range().to() != null) {
            clauses.add("bucket_start < :to_ms");
            params.addValue("to_ms", query.range().toMillis());
        }
        String direction = query.order() == SortOrder.DESC ? "DESC" : "ASC";
        StringBuilder sql = new StringBuilder("SELECT * FROM metrics_archive");
        if (!clauses.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", clauses));
        }
        sql.append(" ORDER BY bucket_start ").append(direction).append(", id ").append(direction);
        if (query.limit() > 0) {
            sql.append(" LIMIT :limit OFFSET :offset");
            params.addValue("limit", query.limit());
            params.addValue("offset", query.offset());
        }
        return retry.execute("read archive", () -> namedJdbc.query(sql.toString(), params, BUCKET_MAPPER));
    }

    @Override
    public int commitCompaction(MetricTable table, Collection<ArchiveBucket> buckets, Collection<Long> sourceRowIds) {
        if (buckets.isEmpty() && sourceRowIds.isEmpty()) {
            return 0;
        }
        String operation = "compact " + table.tableName();
        return writeLock.callLocked(operation, () -> retry.execute(operation, () -> txTemplate.execute(status -> {
            long now = clock.millis();
            buckets.forEach(bucket -> upsertMerge(bucket, now));
            return deleteIds(table.tableName(), sourceRowIds);
        })));
    }

    @Override
    public int commitRollup(Collection<ArchiveBucket> rolledUp, Collection<Long> replacedBucketIds) {
        if (rolledUp.isEmpty() && replacedBucketIds.isEmpty()) {
            return 0;
        }
        return writeLock.callLocked("archive rollup", () -> retry.execute("archive rollup", () ->
                txTemplate.execute(status -> {
                    long now = clock.millis();
                    rolledUp.forEach(bucket -> upsertMerge(bucket, now));
                    return deleteIds(MetricTable.METRICS_ARCHIVE.tableName(), replacedBucketIds);
                })));
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int deleted = writeLock.callLocked("purge archive", () -> retry.execute(
                "purge archive",
                () -> jdbcTemplate.update("DELETE FROM metrics_archive WHERE bucket_start < ?", cutoff.toEpochMilli())));
        if (deleted > 0) {
            log.info("Purged expired archive buckets rows={} before={}", deleted, cutoff);
        }
        return deleted;
    }

    @Override
    public long countBuckets() {
        return retry.execute("count archive", () -> {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM metrics_archive", Long.class);
            return count == null ? 0L : count;
        });
    }

    private void upsertMerge(ArchiveBucket bucket, long nowMillis) {
        List<StoredBucket> existing = jdbcTemplate.query(
                SELECT_BY_KEY,
                (rs, rowNum) -> storedBucket(rs),
                bucket.sourceTable().tableName(),
                bucket.level().wireValue(),
                bucket.bucketStart().toEpochMilli(),
                bucket.scopeId(),
                bucket.metricKind());
        if (existing.isEmpty()) {
            AggregateStats stats = bucket.stats();
            jdbcTemplate.update(
                    INSERT_BUCKET,
                    bucket.sourceTable().tableName(),
                    bucket.level().wireValue(),
                    bucket.bucketStart().toEpochMilli(),
                    bucket.archiveDate().toString(),
                    bucket.scopeId(),
                    bucket.metricKind(),
                    stats.count(),
                    ArchivePayloadCodec.serialize(stats),
                    nowMillis,
                    nowMillis);
            return;
        }
        StoredBucket stored = existing.get(0);
        AggregateStats merged = stored.stats().merge(bucket.stats());
        jdbcTemplate.update(UPDATE_BUCKET, merged.count(), ArchivePayloadCodec.serialize(merged), nowMillis, stored.id());
    }

    private int deleteIds(String tableName, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        List<Long> all = new ArrayList<>(ids);
        int deleted = 0;
        for (int from = 0; from < all.size(); from += DELETE_CHUNK) {
            List<Long> chunk = all.subList(from, Math.min(from + DELETE_CHUNK, all.size()));
            deleted += namedJdbc.update(
                    "DELETE FROM " + tableName + " WHERE id IN (:ids)", new MapSqlParameterSource("ids", chunk));
        }
        return deleted;
    }

    private static StoredBucket storedBucket(ResultSet rs) throws SQLException {
        return new StoredBucket(rs.getLong("id"), ArchivePayloadCodec.deserialize(rs.getBytes("payload")));
    }

    private record StoredBucket(long id, AggregateStats stats) {}
}
