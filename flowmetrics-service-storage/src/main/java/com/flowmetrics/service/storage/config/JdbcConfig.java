package com.flowmetrics.service.storage.config;

import com.flowmetrics.service.core.config.MetricsProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
@ConditionalOnClass(NamedParameterJdbcTemplate.class)
@Slf4j
public class JdbcConfig {

    private static final long MIN_CONNECTION_TIMEOUT_MS = 250;

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(DataSource.class)
    public HikariDataSource metricsDataSource(MetricsProperties properties) {
        return createDataSource(properties.getStorage());
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcTemplate jdbcTemplate(DataSource dataSource, MetricsProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(
                (int) Math.max(1, properties.getStorage().getQueryTimeout().toSeconds()));
        return jdbcTemplate;
    }

    @Bean
    @ConditionalOnMissingBean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(JdbcTemplate jdbcTemplate) {
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    /**
     * Pooled handles onto one SQLite file in WAL mode, so readers proceed while the single writer commits. The
     * pragmas are passed as driver properties and applied to every pooled connection.
     */
    public static HikariDataSource createDataSource(MetricsProperties.Storage storage) {
        Path dbPath = Path.of(storage.getPath()).toAbsolutePath();
        try {
            if (dbPath.getParent() != null) {
                Files.createDirectories(dbPath.getParent());
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot create metrics database directory " + dbPath.getParent(), ex);
        }

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl("jdbc:sqlite:" + dbPath);
        hikariConfig.setDriverClassName("org.sqlite.JDBC");
        hikariConfig.setMaximumPoolSize(Math.max(1, storage.getPoolSize()));
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(
                Math.max(MIN_CONNECTION_TIMEOUT_MS, storage.getConnectionTimeout().toMillis()));
        hikariConfig.setPoolName("flowmetrics-sqlite");
        hikariConfig.addDataSourceProperty("journal_mode", "WAL");
        hikariConfig.addDataSourceProperty("synchronous", "NORMAL");
        hikariConfig.addDataSourceProperty(
                "busy_timeout", String.valueOf(storage.getBusyTimeout().toMillis()));

        log.info("Opening metrics store path={} poolSize={}", dbPath, hikariConfig.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }
}
