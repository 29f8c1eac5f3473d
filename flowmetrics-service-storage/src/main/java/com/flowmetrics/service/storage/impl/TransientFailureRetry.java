package com.flowmetrics.service.storage.impl;

import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.MetricsStoreException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Runs storage calls, retrying SQLite busy/locked failures with capped exponential back-off and jitter, and
 * translates whatever escapes into {@link MetricsStoreException}.
 */
@Component
@Slf4j
public class TransientFailureRetry {

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final long MAX_BACKOFF_MS = 2_000L;

    private final int maxRetries;

    public TransientFailureRetry(MetricsProperties properties) {
        this.maxRetries = Math.max(0, properties.getStorage().getMaxRetries());
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return action.get();
            } catch (DataAccessException | TransactionException ex) {
                if (attempts > maxRetries || !isTransient(ex)) {
                    throw translate(operation, ex, attempts);
                }
                long base = 25L << Math.min(attempts, 6); // capped exponential
                long backoffMs = Math.min(ThreadLocalRandom.current().nextLong(base, base * 2), MAX_BACKOFF_MS);
                log.warn(
                        "Storage busy during {}. Retrying attempt {}/{} after {} ms",
                        operation,
                        attempts + 1,
                        maxRetries + 1,
                        backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw MetricsStoreException.cancelled("Interrupted while retrying " + operation);
                }
            }
        }
    }

    /** Translation without retries, for calls that already delivered rows to a caller. */
    public <T> T once(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException ex) {
            throw translate(operation, ex, 1);
        }
    }

    static boolean isTransient(Throwable ex) {
        if (ex instanceof PessimisticLockingFailureException) {
            return true;
        }
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof SQLException sqlEx) {
                int primary = sqlEx.getErrorCode() & 0xFF;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
                    return true;
                }
            }
            cause = cause.getCause();
        }
        return false;
    }

    static MetricsStoreException translate(String operation, RuntimeException ex, int attempts) {
        if (ex instanceof QueryTimeoutException || hasCause(ex, SQLTimeoutException.class)) {
            return MetricsStoreException.timeout(operation + " timed out", ex);
        }
        if (hasCause(ex, SQLTransientConnectionException.class)) {
            return MetricsStoreException.timeout(operation + " could not obtain a storage connection in time", ex);
        }
        if (isTransient(ex)) {
            return MetricsStoreException.storageUnavailable(
                    operation + " failed: storage still busy after " + attempts + " attempts", ex);
        }
        return MetricsStoreException.storageUnavailable(operation + " failed", ex);
    }

    private static boolean hasCause(Throwable ex, Class<? extends Throwable> type) {
        Throwable cause = ex;
        while (cause != null) {
            if (type.isInstance(cause)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
