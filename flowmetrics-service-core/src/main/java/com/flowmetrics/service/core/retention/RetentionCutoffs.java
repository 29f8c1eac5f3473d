package com.flowmetrics.service.core.retention;

import com.flowmetrics.service.core.config.MetricsProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute cutoffs for one pass: rows before {@code detailed} are compacted to hourly buckets, hourly buckets before
 * {@code hourly} are rolled into daily ones, and anything before {@code daily} is deleted.
 */
public record RetentionCutoffs(Instant now, Instant detailed, Instant hourly, Instant daily) {

    public static RetentionCutoffs from(Clock clock, MetricsProperties.Retention retention) {
        validate(retention);
        Instant now = clock.instant();
        return new RetentionCutoffs(
                now,
                now.minus(Duration.ofDays(retention.getDetailedDays())),
                now.minus(Duration.ofDays(retention.getHourlyDays())),
                now.minus(Duration.ofDays(retention.getDailyDays())));
    }

    /** Oldest instant any query may return. */
    public static Instant finalCutoff(Clock clock, MetricsProperties.Retention retention) {
        return clock.instant().minus(Duration.ofDays(retention.getDailyDays()));
    }

    public static void validate(MetricsProperties.Retention retention) {
        int detailed = retention.getDetailedDays();
        int hourly = retention.getHourlyDays();
        int daily = retention.getDailyDays();
        if (detailed < 1 || hourly < detailed || daily < hourly) {
            throw new IllegalStateException(String.format(
                    "Retention windows must satisfy 1 <= detailed (%d) <= hourly (%d) <= daily (%d)",
                    detailed, hourly, daily));
        }
    }
}
