package com.flowmetrics.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "flowmetrics")
public class MetricsProperties {
    private Storage storage = new Storage();
    private Buffer buffer = new Buffer();
    private Retention retention = new Retention();
    private Export export = new Export();

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Buffer getBuffer() {
        return buffer;
    }

    public void setBuffer(Buffer buffer) {
        this.buffer = buffer;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public static class Storage {
        private String path = ".swarm/metrics_persistent.db";
        private int poolSize = 4;
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private Duration busyTimeout = Duration.ofSeconds(5);
        private Duration queryTimeout = Duration.ofSeconds(30);
        private Duration lockTimeout = Duration.ofSeconds(30);
        private int maxRetries = 3;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public Duration getConnectionTimeout() {
            return connectionTimeout;
        }

        public void setConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
        }

        public Duration getBusyTimeout() {
            return busyTimeout;
        }

        public void setBusyTimeout(Duration busyTimeout) {
            this.busyTimeout = busyTimeout;
        }

        public Duration getQueryTimeout() {
            return queryTimeout;
        }

        public void setQueryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }
    }

    public static class Buffer {
        private boolean enabled = true;
        private int maxSize = 100;
        private Duration flushInterval = Duration.ofSeconds(5);
        private int maxPending = 10_000;
        private boolean flushOnShutdown = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public int getMaxPending() {
            return maxPending;
        }

        public void setMaxPending(int maxPending) {
            this.maxPending = maxPending;
        }

        public boolean isFlushOnShutdown() {
            return flushOnShutdown;
        }

        public void setFlushOnShutdown(boolean flushOnShutdown) {
            this.flushOnShutdown = flushOnShutdown;
        }
    }

    public static class Retention {
        private int detailedDays = 7;
        private int hourlyDays = 30;
        private int dailyDays = 90;
        private boolean autoCompaction = true;
        private Duration compactionInterval = Duration.ofHours(24);
        private int batchSize = 1000;
        private boolean vacuumAfterCompaction = false;

        public int getDetailedDays() {
            return detailedDays;
        }

        public void setDetailedDays(int detailedDays) {
            this.detailedDays = detailedDays;
        }

        public int getHourlyDays() {
            return hourlyDays;
        }

        public void setHourlyDays(int hourlyDays) {
            this.hourlyDays = hourlyDays;
        }

        public int getDailyDays() {
            return dailyDays;
        }

        public void setDailyDays(int dailyDays) {
            this.dailyDays = dailyDays;
        }

        public boolean isAutoCompaction() {
            return autoCompaction;
        }

        public void setAutoCompaction(boolean autoCompaction) {
            this.autoCompaction = autoCompaction;
        }

        public Duration getCompactionInterval() {
            return compactionInterval;
        }

        public void setCompactionInterval(Duration compactionInterval) {
            this.compactionInterval = compactionInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isVacuumAfterCompaction() {
            return vacuumAfterCompaction;
        }

        public void setVacuumAfterCompaction(boolean vacuumAfterCompaction) {
            this.vacuumAfterCompaction = vacuumAfterCompaction;
        }
    }

    public static class Export {
        private String format = "json";
        private Duration window = Duration.ofHours(24);
        private boolean pretty = true;
        private boolean includeMetadata = true;

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public boolean isPretty() {
            return pretty;
        }

        public void setPretty(boolean pretty) {
            this.pretty = pretty;
        }

        public boolean isIncludeMetadata() {
            return includeMetadata;
        }

        public void setIncludeMetadata(boolean includeMetadata) {
            this.includeMetadata = includeMetadata;
        }
    }
}
