package com.flowmetrics.service.core.retention;

import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.MetricsStoreException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Runs retention passes on a dedicated single worker, on a fixed delay and on demand. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompactionScheduler {

    private static final Duration MAX_INITIAL_DELAY = Duration.ofMinutes(1);

    private final CompactionService compactionService;
    private final MetricsProperties properties;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    void start() {
        MetricsProperties.Retention retention = properties.getRetention();
        RetentionCutoffs.validate(retention);
        init(retention.isAutoCompaction() ? retention.getCompactionInterval() : null);
    }

    void init(Duration interval) {
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "flowmetrics-compaction");
            thread.setDaemon(true);
            return thread;
        });
        if (interval == null) {
            log.info("Automatic compaction disabled; passes run only when triggered");
            return;
        }
        long periodMillis = interval.toMillis();
        long initialDelayMillis = Math.min(periodMillis, MAX_INITIAL_DELAY.toMillis());
        scheduler.scheduleWithFixedDelay(
                this::runScheduled, initialDelayMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Compaction scheduler started interval={} initialDelayMs={}", interval, initialDelayMillis);
    }

    /** Queues a pass on the compaction worker. */
    public Future<CompactionReport> triggerNow() {
        if (scheduler == null || scheduler.isShutdown()) {
            throw new IllegalStateException("Compaction scheduler is not running");
        }
        return scheduler.submit(compactionService::runCompaction);
    }

    void runScheduled() {
        try {
            compactionService.runCompaction();
        } catch (MetricsStoreException ex) {
            log.error("Scheduled retention pass failed kind={}", ex.getKind(), ex);
        } catch (RuntimeException ex) {
            log.error("Scheduled retention pass failed", ex);
        }
    }

    @PreDestroy
    void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(
                    properties.getStorage().getLockTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Compaction worker did not stop in time");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
