package com.flowmetrics.model;

import java.time.Instant;
import java.util.Map;

/** A derived or observed statistic about an agent at a point in time. */
public record AgentMetric(
        String agentId, Instant timestamp, String metricKind, double value, Map<String, Object> metadata)
        implements MetricRecord {

    public AgentMetric {
        RecordChecks.requireId(agentId, "agentId");
        metricKind = MetricKinds.normalize(metricKind);
        RecordChecks.requireFinite(value);
        timestamp = RecordChecks.truncate(timestamp);
        metadata = RecordChecks.copyMetadata(metadata);
    }

    @Override
    public MetricTable table() {
        return MetricTable.AGENT_METRICS;
    }

    @Override
    public String scopeId() {
        return agentId;
    }

    @Override
    public AgentMetric withTimestamp(Instant timestamp) {
        return new AgentMetric(agentId, timestamp, metricKind, value, metadata);
    }
}
