package com.flowmetrics.service.storage.impl;

import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.service.core.archive.AggregateStats;
import com.flowmetrics.service.core.error.MetricsStoreException;
import com.flowmetrics.service.core.query.MetricFilters;
import com.flowmetrics.service.core.query.RecordQuery;
import com.flowmetrics.service.core.query.SortOrder;
import com.flowmetrics.service.core.query.TimeRange;
import com.flowmetrics.service.core.query.TimeSeriesPoint;
import com.flowmetrics.service.core.query.ValueColumn;
import com.flowmetrics.service.core.retention.CompactionCandidate;
import com.flowmetrics.service.core.spi.MetricsStore;
import com.flowmetrics.service.core.support.JsonUtil;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

@Repository
@DependsOn("schemaInitializer")
@RequiredArgsConstructor
@Slf4j
public class JdbcMetricsStore implements MetricsStore {

    private static final String INSERT_TASK =
            """
            INSERT INTO task_metrics (task_id, agent_id, timestamp, duration_ms, outcome, tokens_used, files_changed, metadata)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String INSERT_AGENT =
            """
            INSERT INTO agent_metrics (agent_id, timestamp, metric_kind, value, metadata)
            VALUES (?, ?, ?, ?, ?)
            """;
    private static final String INSERT_SWARM =
            """
            INSERT INTO swarm_metrics (swarm_id, timestamp, metric_kind, value, metadata)
            VALUES (?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;
    private final TransactionTemplate txTemplate;
    private final TransientFailureRetry retry;
    private final StorageWriteLock writeLock;
    private final Clock clock;

    @Override
    public void write(MetricRecord record) {
        writeBatch(List.of(record));
    }

    @Override
    public void writeBatch(List<? extends MetricRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        Map<MetricTable, List<MetricRecord>> byTable = new EnumMap<>(MetricTable.class);
        for (MetricRecord record : records) {
            if (!record.table().isDetailed()) {
                throw new IllegalArgumentException("Only detailed records can be written: " + record.table());
            }
            MetricRecord stamped = record.timestamp() == null ? record.withTimestamp(now) : record;
            byTable.computeIfAbsent(stamped.table(), t -> new ArrayList<>()).add(stamped);
        }
        writeLock.callLocked("write batch", () -> retry.execute("write batch", () -> {
            txTemplate.executeWithoutResult(status -> byTable.forEach(this::insertRows));
            return null;
        }));
    }

    private void insertRows(MetricTable table, List<MetricRecord> rows) {
        String sql =
                switch (table) {
                    case TASK_METRICS -> INSERT_TASK;
                    case AGENT_METRICS -> INSERT_AGENT;
                    case SWARM_METRICS -> INSERT_SWARM;
                    case METRICS_ARCHIVE -> throw new IllegalArgumentException("Not a detailed table");
                };
        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                bindInsert(ps, rows.get(i));
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
    }

    private static void bindInsert(PreparedStatement ps, MetricRecord record) throws SQLException {
        if (record instanceof TaskMetric task) {
            ps.setString(1, task.taskId());
            ps.setString(2, task.agentId());
            ps.setLong(3, task.timestamp().toEpochMilli());
            ps.setLong(4, task.durationMs());
            ps.setString(5, task.outcome().wireValue());
            ps.setLong(6, task.tokensUsed());
            ps.setLong(7, task.filesChanged());
            ps.setString(8, JsonUtil.metadataToJson(task.metadata()));
        } else if (record instanceof AgentMetric agent) {
            ps.setString(1, agent.agentId());
            ps.setLong(2, agent.timestamp().toEpochMilli());
            ps.setString(3, agent.metricKind());
            ps.setDouble(4, agent.value());
            ps.setString(5, JsonUtil.metadataToJson(agent.metadata()));
        } else if (record instanceof SwarmMetric swarm) {
            ps.setString(1, swarm.swarmId());
            ps.setLong(2, swarm.timestamp().toEpochMilli());
            ps.setString(3, swarm.metricKind());
            ps.setDouble(4, swarm.value());
            ps.setString(5, JsonUtil.metadataToJson(swarm.metadata()));
        }
    }

    @Override
    public List<MetricRecord> readRange(RecordQuery query) {
        Statement statement = select(query);
        RowMapper<MetricRecord> mapper = MetricRowMappers.forTable(query.table());
        return retry.execute(
                "read " + query.table().tableName(),
                () -> namedJdbc.query(statement.sql(), statement.params(), mapper));
    }

    @Override
    public long streamRange(RecordQuery query, Consumer<? super MetricRecord> sink) {
        Statement statement = select(query);
        RowMapper<MetricRecord> mapper = MetricRowMappers.forTable(query.table());
        long[] delivered = {0};
        // no retry: rows may already have reached the sink
        retry.once("stream " + query.table().tableName(), () -> {
            namedJdbc.query(statement.sql(), statement.params(), (RowCallbackHandler) rs -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw MetricsStoreException.cancelled(
                            "Streaming " + query.table().tableName() + " cancelled after " + delivered[0] + " rows");
                }
                sink.accept(mapper.mapRow(rs, (int) delivered[0]));
                delivered[0]++;
            });
            return null;
        });
        return delivered[0];
    }

    private Statement select(RecordQuery query) {
        MetricTable table = query.table();
        SqlFilterBuilder.Where where = SqlFilterBuilder.where(table, query.filters(), query.range());
        String direction = query.order() == SortOrder.DESC ? "DESC" : "ASC";
        StringBuilder sql = new StringBuilder("SELECT * FROM ")
                .append(table.tableName())
                .append(where.sql())
                .append(" ORDER BY timestamp ")
                .append(direction)
                .append(", id ")
                .append(direction);
        MapSqlParameterSource params = where.params();
        if (query.limit() > 0) {
            sql.append(" LIMIT :limit OFFSET :offset");
            params.addValue("limit", query.limit());
            params.addValue("offset", query.offset());
        }
        return new Statement(sql.toString(), params);
    }

    @Override
    public AggregateStats aggregateDetailed(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range) {
        SqlFilterBuilder.Where where = SqlFilterBuilder.where(table, filters, range);
        String sql = "SELECT " + statsColumns(column) + " FROM " + table.tableName() + where.sql();
        return retry.execute(
                "aggregate " + table.tableName(),
                () -> namedJdbc.queryForObject(sql, where.params(), (rs, rowNum) -> readStats(rs)));
    }

    @Override
    public Map<String, AggregateStats> aggregateDetailedByScope(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range) {
        SqlFilterBuilder.Where where = SqlFilterBuilder.where(table, filters, range);
        String scope = table.scopeColumn();
        String sql = "SELECT " + scope + " AS scope_id, " + statsColumns(column) + " FROM " + table.tableName()
                + where.sql() + " GROUP BY " + scope;
        return retry.execute("aggregate " + table.tableName() + " by scope", () -> {
            Map<String, AggregateStats> result = new HashMap<>();
            namedJdbc.query(sql, where.params(), (RowCallbackHandler)
                    rs -> result.put(rs.getString("scope_id"), readStats(rs)));
            return result;
        });
    }

    @Override
    public List<Double> readColumnSorted(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range) {
        SqlFilterBuilder.Where where = SqlFilterBuilder.where(table, filters, range);
        String sql = "SELECT " + SqlFilterBuilder.valueExpression(column) + " AS v FROM " + table.tableName()
                + where.sql() + " ORDER BY v ASC";
        return retry.execute(
                "sorted " + column.columnName() + " of " + table.tableName(),
                () -> namedJdbc.query(sql, where.params(), (rs, rowNum) -> rs.getDouble("v")));
    }

    @Override
    public List<TimeSeriesPoint> aggregateByTime(
            MetricTable table, ValueColumn column, MetricFilters filters, TimeRange range, long bucketMillis) {
        SqlFilterBuilder.Where where = SqlFilterBuilder.where(table, filters, range);
        String expression = SqlFilterBuilder.valueExpression(column);
        String sql = "SELECT (timestamp / :bucket_ms) * :bucket_ms AS bucket_start, COUNT(*) AS cnt, TOTAL("
                + expression + ") AS total, MIN(" + expression + ") AS min_v, MAX(" + expression + ") AS max_v FROM "
                + table.tableName() + where.sql() + " GROUP BY bucket_start ORDER BY bucket_start";
        MapSqlParameterSource params = where.params().addValue("bucket_ms", bucketMillis);
        return retry.execute("time series of " + table.tableName(), () -> namedJdbc.query(sql, params, (rs, n) -> {
            long count = rs.getLong("cnt");
            double total = rs.getDouble("total");
            return new TimeSeriesPoint(
                    Instant.ofEpochMilli(rs.getLong("bucket_start")),
                    count,
                    count == 0 ? null : total / count,
                    rs.getDouble("min_v"),
                    rs.getDouble("max_v"),
                    total);
        }));
    }

    @Override
    public List<TaskMetric> slowestTasks(MetricFilters filters, TimeRange range, int limit) {
        SqlFilterBuilder.Where where = SqlFilterBuilder.where(MetricTable.TASK_METRICS, filters, range);
        String sql = "SELECT * FROM task_metrics" + where.sql() + " ORDER BY duration_ms DESC, id ASC LIMIT :limit";
        MapSqlParameterSource params = where.params().addValue("limit", limit);
        return retry.execute("slowest tasks", () -> namedJdbc.query(sql, params, MetricRowMappers.TASK));
    }

    @Override
    public List<MetricRecord> latestPerKind(MetricTable table, String scopeId, TimeRange range) {
        if (table == MetricTable.TASK_METRICS || !table.isDetailed()) {
            throw MetricsStoreException.invalidQuery("Latest values are kept per kind only for agent and swarm metrics");
        }
        SqlFilterBuilder.Where where =
                SqlFilterBuilder.where(table, MetricFilters.of(table.scopeColumn(), scopeId), range);
        // SQLite takes bare columns from the row that holds MAX(timestamp)
        String sql = "SELECT *, MAX(timestamp) AS latest_ts FROM " + table.tableName() + where.sql()
                + " GROUP BY metric_kind ORDER BY metric_kind";
        RowMapper<MetricRecord> mapper = MetricRowMappers.forTable(table);
        return retry.execute("latest " + table.tableName(), () -> namedJdbc.query(sql, where.params(), mapper));
    }

    @Override
    public List<Map<String, String>> distinctSeries(MetricTable table, TimeRange range) {
        if (!table.isDetailed()) {
            throw MetricsStoreException.invalidQuery("Series are only defined for detailed tables");
        }
        List<String> columns = table == MetricTable.TASK_METRICS
                ? List.of(table.scopeColumn())
                : List.of(table.scopeColumn(), "metric_kind");
        String columnList = String.join(", ", columns);
        SqlFilterBuilder.Where where = SqlFilterBuilder.where(table, MetricFilters.none(), range);
        String sql = "SELECT DISTINCT " + columnList + " FROM " + table.tableName() + where.sql() + " ORDER BY "
                + columnList;
        return retry.execute("series of " + table.tableName(), () -> namedJdbc.query(sql, where.params(), (rs, n) -> {
            Map<String, String> series = new LinkedHashMap<>();
            for (String column : columns) {
                series.put(column, rs.getString(column));
            }
            return series;
        }));
    }

    @Override
    public List<CompactionCandidate> selectCompactionCandidates(MetricTable table, Instant olderThan, int limit) {
        String sql = "SELECT * FROM " + table.tableName() + " WHERE timestamp < ? ORDER BY id LIMIT ?";
        RowMapper<MetricRecord> mapper = MetricRowMappers.forTable(table);
        return retry.execute(
                "select compaction candidates of " + table.tableName(),
                () -> jdbcTemplate.query(
                        sql,
                        (rs, rowNum) -> new CompactionCandidate(rs.getLong("id"), mapper.mapRow(rs, rowNum)),
                        olderThan.toEpochMilli(),
                        limit));
    }

    @Override
    public int deleteOlderThan(MetricTable table, Instant cutoff) {
        String sql = "DELETE FROM " + table.tableName() + " WHERE timestamp < ?";
        int deleted = writeLock.callLocked(
                "purge " + table.tableName(),
                () -> retry.execute(
                        "purge " + table.tableName(), () -> jdbcTemplate.update(sql, cutoff.toEpochMilli())));
        if (deleted > 0) {
            log.info("Purged expired rows table={} rows={} before={}", table.tableName(), deleted, cutoff);
        }
        return deleted;
    }

    @Override
    public <T> T readConsistently(Supplier<T> action) {
        return retry.once("consistent read", () -> txTemplate.execute(status -> action.get()));
    }

    @Override
    public void vacuum() {
        long started = System.currentTimeMillis();
        writeLock.callLocked("vacuum", () -> retry.execute("vacuum", () -> {
            jdbcTemplate.execute("VACUUM");
            return null;
        }));
        log.info("Vacuum finished tookMs={}", System.currentTimeMillis() - started);
    }

    @Override
    public void analyze() {
        writeLock.callLocked("analyze", () -> retry.execute("analyze", () -> {
            jdbcTemplate.execute("ANALYZE");
            return null;
        }));
        log.info("Planner statistics refreshed");
    }

    private static String statsColumns(ValueColumn column) {
        String expression = SqlFilterBuilder.valueExpression(column);
        return "COUNT(*) AS cnt, TOTAL(" + expression + ") AS total, MIN(" + expression + ") AS min_v, MAX("
                + expression + ") AS max_v, TOTAL((" + expression + ") * (" + expression + ")) AS sum_sq";
    }

    private static AggregateStats readStats(ResultSet rs) throws SQLException {
        long count = rs.getLong("cnt");
        if (count == 0) {
            return AggregateStats.EMPTY;
        }
        return new AggregateStats(
                count, rs.getDouble("total"), rs.getDouble("min_v"), rs.getDouble("max_v"), rs.getDouble("sum_sq"));
    }

    private record Statement(String sql, MapSqlParameterSource params) {}
}
