package com.flowmetrics.service.core.ingest;

import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.model.TaskOutcome;
import com.flowmetrics.service.core.buffer.MetricsFlushService;
import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.MetricsStoreException;
import com.flowmetrics.service.core.spi.MetricsStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Producer entry point. Calls never surface storage errors: they return {@code true} when the record was accepted
 * and {@code false} when it was rejected locally (buffer full, or a failed write-through). Invalid arguments still
 * throw {@link IllegalArgumentException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MetricsFlushService flushService;
    private final MetricsStore store;
    private final MetricsProperties properties;
    private final Clock clock;

    private final AtomicLong rejected = new AtomicLong();

    public boolean recordTask(
            String taskId, String agentId, long durationMs, TaskOutcome outcome, long tokensUsed, long filesChanged) {
        return recordTask(taskId, agentId, durationMs, outcome, tokensUsed, filesChanged, null, null);
    }

    public boolean recordTask(
            String taskId,
            String agentId,
            long durationMs,
            TaskOutcome outcome,
            long tokensUsed,
            long filesChanged,
            Map<String, Object> metadata,
            Instant timestamp) {
        return record(new TaskMetric(
                taskId, agentId, timestamp, durationMs, outcome, tokensUsed, filesChanged, metadata));
    }

    public boolean recordAgentMetric(String agentId, String metricKind, double value) {
        return recordAgentMetric(agentId, metricKind, value, null, null);
    }

    public boolean recordAgentMetric(
            String agentId, String metricKind, double value, Map<String, Object> metadata, Instant timestamp) {
        return record(new AgentMetric(agentId, timestamp, metricKind, value, metadata));
    }

    public boolean recordSwarmMetric(String swarmId, String metricKind, double value) {
        return recordSwarmMetric(swarmId, metricKind, value, null, null);
    }

    public boolean recordSwarmMetric(
            String swarmId, String metricKind, double value, Map<String, Object> metadata, Instant timestamp) {
        return record(new SwarmMetric(swarmId, timestamp, metricKind, value, metadata));
    }

    public boolean record(MetricRecord record) {
        MetricRecord stamped = record.timestamp() == null ? record.withTimestamp(clock.instant()) : record;
        if (!properties.getBuffer().isEnabled()) {
            return writeThrough(stamped);
        }
        if (!flushService.enqueue(stamped)) {
            long total = rejected.incrementAndGet();
            if (total == 1 || total % 1000 == 0) {
                log.warn(
                        "Metrics buffer full (maxPending={}); rejected {} records so far",
                        properties.getBuffer().getMaxPending(),
                        total);
            }
            return false;
        }
        return true;
    }

    public long rejectedCount() {
        return rejected.get();
    }

    private boolean writeThrough(MetricRecord record) {
        try {
            store.write(record);
            return true;
        } catch (MetricsStoreException ex) {
            rejected.incrementAndGet();
            log.error("Write-through of {} record failed kind={}", record.table().tableName(), ex.getKind(), ex);
            return false;
        }
    }
}
