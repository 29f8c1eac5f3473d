package com.flowmetrics.model;

import java.time.Instant;
import java.util.Map;

/** One completed unit of work by one agent. */
public record TaskMetric(
        String taskId,
        String agentId,
        Instant timestamp,
        long durationMs,
        TaskOutcome outcome,
        long tokensUsed,
        long filesChanged,
        Map<String, Object> metadata)
        implements MetricRecord {

    public TaskMetric {
        RecordChecks.requireId(taskId, "taskId");
        RecordChecks.requireId(agentId, "agentId");
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0");
        }
        if (tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed must be >= 0");
        }
        if (filesChanged < 0) {
            throw new IllegalArgumentException("filesChanged must be >= 0");
        }
        timestamp = RecordChecks.truncate(timestamp);
        metadata = RecordChecks.copyMetadata(metadata);
    }

    public TaskMetric(
            String taskId,
            String agentId,
            Instant timestamp,
            long durationMs,
            TaskOutcome outcome,
            long tokensUsed,
            long filesChanged) {
        this(taskId, agentId, timestamp, durationMs, outcome, tokensUsed, filesChanged, Map.of());
    }

    @Override
    public MetricTable table() {
        return MetricTable.TASK_METRICS;
    }

    @Override
    public String scopeId() {
        return agentId;
    }

    public boolean success() {
        return outcome.isSuccess();
    }

    @Override
    public TaskMetric withTimestamp(Instant timestamp) {
        return new TaskMetric(taskId, agentId, timestamp, durationMs, outcome, tokensUsed, filesChanged, metadata);
    }
}
