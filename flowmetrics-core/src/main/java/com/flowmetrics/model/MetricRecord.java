package com.flowmetrics.model;

import java.time.Instant;
import java.util.Map;

/**
 * Common view over the three detailed record kinds. Records are immutable once written; the storage layer only
 * ever appends them.
 */
public interface MetricRecord {

    MetricTable table();

    /** The entity the record is attributed to: the agent for task and agent metrics, the swarm for swarm metrics. */
    String scopeId();

    /** May be {@code null} until the producer facade assigns the write time. */
    Instant timestamp();

    Map<String, Object> metadata();

    MetricRecord withTimestamp(Instant timestamp);
}
