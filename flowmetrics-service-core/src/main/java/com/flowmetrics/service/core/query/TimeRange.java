package com.flowmetrics.service.core.query;

import java.time.Duration;
import java.time.Instant;

/** Half-open range {@code [from, to)}. Either end may be {@code null} for an open bound. */
public record TimeRange(Instant from, Instant to) {

    private static final TimeRange ALL = new TimeRange(null, null);

    public static TimeRange all() {
        return ALL;
    }

    public static TimeRange between(Instant from, Instant to) {
        return new TimeRange(from, to);
    }

    public static TimeRange since(Instant from) {
        return new TimeRange(from, null);
    }

    public static TimeRange trailing(Duration window, Instant now) {
        return new TimeRange(now.minus(window), now);
    }

    /** Raises the lower bound to {@code cutoff} when the range starts earlier or is open. */
    public TimeRange clampFrom(Instant cutoff) {
        if (cutoff == null || (from != null && !from.isBefore(cutoff))) {
            return this;
        }
        return new TimeRange(cutoff, to);
    }

    public boolean isEmpty() {
        return from != null && to != null && !from.isBefore(to);
    }

    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        return (from == null || !instant.isBefore(from)) && (to == null || instant.isBefore(to));
    }

    public Long fromMillis() {
        return from == null ? null : from.toEpochMilli();
    }

    public Long toMillis() {
        return to == null ? null : to.toEpochMilli();
    }
}
