package com.flowmetrics.service.core.query;

import java.time.Instant;

public record TimeSeriesPoint(Instant bucketStart, long count, Double avg, Double min, Double max, double sum) {}
