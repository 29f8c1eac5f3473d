package com.flowmetrics.service.storage.impl;

import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.MetricsStoreException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serializes batch writes, deletes, archive commits and vacuum on the single SQLite writer. Reads never take it.
 * Waiting past {@code flowmetrics.storage.lock-timeout} fails with {@code TIMEOUT}.
 */
@Component
public class StorageWriteLock {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration timeout;

    public StorageWriteLock(MetricsProperties properties) {
        this.timeout = properties.getStorage().getLockTimeout();
    }

    public <T> T callLocked(String operation, Supplier<T> action) {
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw MetricsStoreException.timeout(
                        "Timed out after " + timeout + " waiting for the storage write lock (" + operation + ")",
                        null);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw MetricsStoreException.cancelled("Interrupted waiting for the storage write lock (" + operation + ")");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
