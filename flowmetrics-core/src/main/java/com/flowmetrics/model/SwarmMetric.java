package com.flowmetrics.model;

import java.time.Instant;
import java.util.Map;

/** Health, throughput, latency or resource statistic scoped to a whole swarm. */
public record SwarmMetric(
        String swarmId, Instant timestamp, String metricKind, double value, Map<String, Object> metadata)
        implements MetricRecord {

    public SwarmMetric {
        RecordChecks.requireId(swarmId, "swarmId");
        metricKind = MetricKinds.normalize(metricKind);
        RecordChecks.requireFinite(value);
        timestamp = RecordChecks.truncate(timestamp);
        metadata = RecordChecks.copyMetadata(metadata);
    }

    @Override
    public MetricTable table() {
        return MetricTable.SWARM_METRICS;
    }

    @Override
    public String scopeId() {
        return swarmId;
    }

    @Override
    public SwarmMetric withTimestamp(Instant timestamp) {
        return new SwarmMetric(swarmId, timestamp, metricKind, value, metadata);
    }
}
