package com.flowmetrics.service.core.error;

public enum ErrorKind {
    /** Transient storage contention exhausted its retries, or the medium failed. */
    STORAGE_UNAVAILABLE,
    /** Malformed filter, unknown table, column or aggregation. */
    INVALID_QUERY,
    /** Purge or compaction failed for at least one table. */
    RETENTION_FAILURE,
    TIMEOUT,
    CANCELLED,
    EXPORT_FAILED
}
