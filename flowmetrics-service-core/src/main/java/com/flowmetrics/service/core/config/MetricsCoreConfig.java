package com.flowmetrics.service.core.config;

import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared beans of the metrics services. Storage settings are checked once here so a bad value fails startup with
 * the offending key instead of surfacing later as a pool or driver error.
 */
@Configuration
@Slf4j
public class MetricsCoreConfig {

    public MetricsCoreConfig(MetricsProperties properties) {
        validateStorage(properties.getStorage());
    }

    /** Every "now" in the engine: default record timestamps, retention cutoffs and export windows. */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock metricsClock() {
        return Clock.systemUTC();
    }

    static void validateStorage(MetricsProperties.Storage storage) {
        if (storage.getPath() == null || storage.getPath().isBlank()) {
            throw new IllegalStateException("flowmetrics.storage.path is required");
        }
        if (storage.getPoolSize() < 1) {
            throw new IllegalStateException(
                    "flowmetrics.storage.pool-size must be at least 1, was " + storage.getPoolSize());
        }
        if (storage.getMaxRetries() < 0) {
            throw new IllegalStateException(
                    "flowmetrics.storage.max-retries must not be negative, was " + storage.getMaxRetries());
        }
        requirePositive("flowmetrics.storage.busy-timeout", storage.getBusyTimeout());
        requirePositive("flowmetrics.storage.query-timeout", storage.getQueryTimeout());
        requirePositive("flowmetrics.storage.lock-timeout", storage.getLockTimeout());
        log.debug("Metrics storage settings path={} poolSize={}", storage.getPath(), storage.getPoolSize());
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(key + " must be positive, was " + value);
        }
    }
}
