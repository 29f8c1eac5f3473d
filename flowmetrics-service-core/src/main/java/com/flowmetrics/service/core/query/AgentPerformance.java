package com.flowmetrics.service.core.query;

public record AgentPerformance(
        String agentId,
        long totalTasks,
        long successfulTasks,
        double successRate,
        double errorRate,
        Double avgDurationMs,
        long totalTokens,
        boolean includesArchive) {}
