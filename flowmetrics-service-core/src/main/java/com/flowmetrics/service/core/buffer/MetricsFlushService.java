package com.flowmetrics.service.core.buffer;

import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.ErrorKind;
import com.flowmetrics.service.core.error.MetricsStoreException;
import com.flowmetrics.service.core.spi.MetricsStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Moves buffered records into the store. Flushes happen when the buffer reaches {@code max-size}, every
 * {@code flush-interval}, on an explicit {@link #flush()} and once more on shutdown. A process killed without
 * shutdown loses at most what was enqueued since the last timed flush, roughly one flush interval of traffic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsFlushService {

    private final MetricsWriteBuffer buffer;
    private final MetricsStore store;
    private final MetricsProperties properties;
    private final FlushFailureListener failureListener;

    private final Object flushLock = new Object();
    private final AtomicBoolean flushQueued = new AtomicBoolean();
    private final AtomicLong flushedRecords = new AtomicLong();
    private final AtomicLong droppedRecords = new AtomicLong();

    private volatile ScheduledExecutorService worker;

    @PostConstruct
    void start() {
        init(properties.getBuffer().getFlushInterval());
    }

    void init(Duration flushInterval) {
        validate(flushInterval, properties.getBuffer());
        worker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "flowmetrics-flush");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMillis = flushInterval.toMillis();
        worker.scheduleWithFixedDelay(this::flushInBackground, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info(
                "Metrics flush worker started maxSize={} interval={} maxPending={}",
                properties.getBuffer().getMaxSize(),
                flushInterval,
                properties.getBuffer().getMaxPending());
    }

    static void validate(Duration flushInterval, MetricsProperties.Buffer buffer) {
        if (flushInterval == null || flushInterval.toMillis() < 1) {
            throw new IllegalStateException(
                    "flowmetrics.buffer.flush-interval must be at least 1ms, was " + flushInterval);
        }
        if (buffer.getMaxSize() < 1 || buffer.getMaxPending() < 1) {
            throw new IllegalStateException(String.format(
                    "flowmetrics.buffer.max-size (%d) and max-pending (%d) must be at least 1",
                    buffer.getMaxSize(), buffer.getMaxPending()));
        }
    }

    /**
     * Appends without waiting for I/O. Crossing the size threshold schedules an asynchronous flush.
     *
     * @return false when the buffer is at {@code max-pending}
     */
    public boolean enqueue(MetricRecord record) {
        int size = buffer.append(record);
        if (size == MetricsWriteBuffer.REJECTED) {
            return false;
        }
        if (size >= properties.getBuffer().getMaxSize() && flushQueued.compareAndSet(false, true)) {
            scheduleFlush();
        }
        return true;
    }

    private void scheduleFlush() {
        ScheduledExecutorService current = worker;
        if (current == null || current.isShutdown()) {
            // the shutdown flush or the next explicit flush picks the records up
            flushQueued.set(false);
            return;
        }
        try {
            current.execute(this::flushInBackground);
        } catch (RejectedExecutionException ex) {
            flushQueued.set(false);
        }
    }

    /**
     * Synchronously writes the current buffer contents in one batch. On failure the drained records are handed to
     * the {@link FlushFailureListener} and not re-queued.
     *
     * @return number of records persisted
     * @throws MetricsStoreException when the store rejected the batch
     */
    public int flush() {
        synchronized (flushLock) {
            flushQueued.set(false);
            List<MetricRecord> batch = buffer.drain();
            if (batch.isEmpty()) {
                return 0;
            }
            long started = System.nanoTime();
            try {
                store.writeBatch(batch);
            } catch (RuntimeException ex) {
                droppedRecords.addAndGet(batch.size());
                failureListener.onFlushFailure(batch, ex);
                if (ex instanceof MetricsStoreException mse) {
                    throw mse;
                }
                throw new MetricsStoreException(ErrorKind.STORAGE_UNAVAILABLE, "Metrics flush failed", ex);
            }
            flushedRecords.addAndGet(batch.size());
            if (log.isDebugEnabled()) {
                log.debug(
                        "Flushed metrics records={} tookMs={}",
                        batch.size(),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            }
            return batch.size();
        }
    }

    void flushInBackground() {
        try {
            flush();
        } catch (MetricsStoreException ex) {
            // already reported to the failure listener
            log.debug("Background flush failed kind={}", ex.getKind());
        } catch (RuntimeException ex) {
            log.error("Background flush failed", ex);
        }
    }

    public int pendingCount() {
        return buffer.pendingCount();
    }

    public long flushedCount() {
        return flushedRecords.get();
    }

    public long droppedCount() {
        return droppedRecords.get();
    }

    @PreDestroy
    void stop() {
        haltWorker();
        if (properties.getBuffer().isFlushOnShutdown()) {
            try {
                int flushed = flush();
                log.info("Final metrics flush on shutdown records={}", flushed);
            } catch (MetricsStoreException ex) {
                log.error("Final metrics flush failed kind={}", ex.getKind(), ex);
            }
        }
    }

    /** Stops the worker without a final flush, leaving the buffered tail unpersisted. */
    void haltWorker() {
        if (worker == null) {
            return;
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(
                    properties.getStorage().getLockTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Metrics flush worker did not stop in time");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
