package com.flowmetrics.service.core.export;

import java.time.Instant;

/** Deterministic text forms shared by the flat and the line format. */
final class ExportValues {

    private static final double MAX_EXACT_LONG = 1e15;

    private ExportValues() {}

    /** Integral values print without a fraction; everything else uses {@link Double#toString}. */
    static String number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_LONG) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static String iso(Instant instant) {
        return instant == null ? "" : instant.toString();
    }

    static String millis(Instant instant) {
        return instant == null ? "" : Long.toString(instant.toEpochMilli());
    }
}
