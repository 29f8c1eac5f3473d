package com.flowmetrics.service.core.query;

public record TopNEntry(String scopeId, double value, long sampleCount) {}
