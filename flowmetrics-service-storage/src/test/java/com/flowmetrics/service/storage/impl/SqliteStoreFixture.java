package com.flowmetrics.service.storage.impl;

import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.export.MetricsExportService;
import com.flowmetrics.service.core.query.MetricsQueryService;
import com.flowmetrics.service.core.retention.CompactionService;
import com.flowmetrics.service.storage.config.JdbcConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Path;
import java.time.Instant;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/** Wires the SQLite store and the services on top of it the same way the application context does. */
final class SqliteStoreFixture implements AutoCloseable {

    final MetricsProperties properties;
    final MutableClock clock;
    final HikariDataSource dataSource;
    final JdbcTemplate jdbcTemplate;
    final SchemaInitializer schemaInitializer;
    final JdbcMetricsStore metricsStore;
    final JdbcArchiveStore archiveStore;
    final MetricsQueryService queryService;
    final CompactionService compactionService;
    final MetricsExportService exportService;

    SqliteStoreFixture(Path dir, Instant now) {
        this(dir, now, new MetricsProperties());
    }

    SqliteStoreFixture(Path dir, Instant now, MetricsProperties properties) {
        this.properties = properties;
        properties.getStorage().setPath(dir.resolve("metrics.db").toString());
        this.clock = new MutableClock(now);
        this.dataSource = JdbcConfig.createDataSource(properties.getStorage());
        JdbcConfig config = new JdbcConfig();
        this.jdbcTemplate = config.jdbcTemplate(dataSource, properties);
        NamedParameterJdbcTemplate namedJdbc = config.namedParameterJdbcTemplate(jdbcTemplate);
        TransactionTemplate txTemplate = config.transactionTemplate(new DataSourceTransactionManager(dataSource));
        TransientFailureRetry retry = new TransientFailureRetry(properties);
        StorageWriteLock writeLock = new StorageWriteLock(properties);

        this.schemaInitializer = new SchemaInitializer(dataSource, jdbcTemplate, clock);
        schemaInitializer.initialize();
        this.metricsStore = new JdbcMetricsStore(jdbcTemplate, namedJdbc, txTemplate, retry, writeLock, clock);
        this.archiveStore = new JdbcArchiveStore(jdbcTemplate, namedJdbc, txTemplate, retry, writeLock, clock);
        this.queryService = new MetricsQueryService(metricsStore, archiveStore, properties, clock);
        this.compactionService = new CompactionService(metricsStore, archiveStore, properties, clock);
        this.exportService = new MetricsExportService(queryService, properties, clock);
    }

    long count(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
