package com.flowmetrics.service.storage.impl;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.List;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

/** Creates tables and indices if missing and records the schema version. Safe to run on every start. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {

    public static final String SCHEMA_VERSION = "1";
    static final String SCHEMA_SCRIPT = "db/flowmetrics-schema.sql";

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @PostConstruct
    public void initialize() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
        populator.execute(dataSource);
        jdbcTemplate.update(
                """
                INSERT INTO storage_schema_info (key, value, updated_at)
                VALUES ('version', ?, ?)
                ON CONFLICT (key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at
                """,
                SCHEMA_VERSION,
                clock.millis());
        log.info("Metrics schema ready version={}", SCHEMA_VERSION);
    }

    public String schemaVersion() {
        List<String> versions = jdbcTemplate.query(
                "SELECT value FROM storage_schema_info WHERE key = 'version'", (rs, rowNum) -> rs.getString(1));
        return versions.isEmpty() ? null : versions.get(0);
    }
}
