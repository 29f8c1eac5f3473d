package com.flowmetrics.service.storage.impl;

import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.model.TaskOutcome;
import com.flowmetrics.service.core.support.JsonUtil;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import org.springframework.jdbc.core.RowMapper;

final class MetricRowMappers {

    static final RowMapper<TaskMetric> TASK = (rs, rowNum) -> new TaskMetric(
            rs.getString("task_id"),
            rs.getString("agent_id"),
            timestamp(rs),
            rs.getLong("duration_ms"),
            TaskOutcome.fromString(rs.getString("outcome")),
            rs.getLong("tokens_used"),
            rs.getLong("files_changed"),
            JsonUtil.metadataFromJson(rs.getString("metadata")));

    static final RowMapper<AgentMetric> AGENT = (rs, rowNum) -> new AgentMetric(
            rs.getString("agent_id"),
            timestamp(rs),
            rs.getString("metric_kind"),
            rs.getDouble("value"),
            JsonUtil.metadataFromJson(rs.getString("metadata")));

    static final RowMapper<SwarmMetric> SWARM = (rs, rowNum) -> new SwarmMetric(
            rs.getString("swarm_id"),
            timestamp(rs),
            rs.getString("metric_kind"),
            rs.getDouble("value"),
            JsonUtil.metadataFromJson(rs.getString("metadata")));

    private MetricRowMappers() {}

    static RowMapper<MetricRecord> forTable(MetricTable table) {
        return switch (table) {
            case TASK_METRICS -> TASK::mapRow;
            case AGENT_METRICS -> AGENT::mapRow;
            case SWARM_METRICS -> SWARM::mapRow;
            case METRICS_ARCHIVE -> throw new IllegalArgumentException("Archive rows are not metric records");
        };
    }

    private static Instant timestamp(ResultSet rs) throws SQLException {
        return Instant.ofEpochMilli(rs.getLong("timestamp"));
    }
}
