package com.flowmetrics.service.core.query;

public record PercentileResult(double percentile, Double value, long sampleCount, Precision precision) {

    public enum Precision {
        /** Sorted detailed rows only. */
        EXACT,
        /** Interpolated from archived min, mean and max only. */
        APPROXIMATE,
        /** Exact detailed samples combined with interpolated archive points. */
        MIXED
    }

    public boolean isApproximate() {
        return precision != Precision.EXACT;
    }
}
