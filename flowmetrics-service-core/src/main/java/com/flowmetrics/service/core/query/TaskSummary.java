package com.flowmetrics.service.core.query;

/** Headline task statistics over the detailed tier of a range. */
public record TaskSummary(
        long totalTasks,
        long successfulTasks,
        double successRate,
        Double avgDurationMs,
        Double p95DurationMs,
        Double p99DurationMs,
        long totalTokens,
        Double avgTokens,
        long uniqueAgents) {

    public static TaskSummary empty() {
        return new TaskSummary(0, 0, 0.0, null, null, null, 0, null, 0);
    }
}
