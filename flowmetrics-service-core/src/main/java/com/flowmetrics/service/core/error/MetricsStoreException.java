package com.flowmetrics.service.core.error;

public class MetricsStoreException extends RuntimeException {

    private final ErrorKind kind;

    public MetricsStoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MetricsStoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static MetricsStoreException storageUnavailable(String message, Throwable cause) {
        return new MetricsStoreException(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
    }

    public static MetricsStoreException invalidQuery(String message) {
        return new MetricsStoreException(ErrorKind.INVALID_QUERY, message);
    }

    public static MetricsStoreException retentionFailure(String message, Throwable cause) {
        return new MetricsStoreException(ErrorKind.RETENTION_FAILURE, message, cause);
    }

    public static MetricsStoreException timeout(String message, Throwable cause) {
        return new MetricsStoreException(ErrorKind.TIMEOUT, message, cause);
    }

    public static MetricsStoreException cancelled(String message) {
        return new MetricsStoreException(ErrorKind.CANCELLED, message);
    }

    public static MetricsStoreException exportFailed(String message, Throwable cause) {
        return new MetricsStoreException(ErrorKind.EXPORT_FAILED, message, cause);
    }
}
