package com.flowmetrics.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.model.TaskOutcome;
import com.flowmetrics.service.core.export.ExportConfig;
import com.flowmetrics.service.core.export.ExportFormat;
import com.flowmetrics.service.core.export.ExportResult;
import com.flowmetrics.service.core.support.JsonUtil;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetricsExportIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");
    private static final Pattern SAMPLE =
            Pattern.compile("^flowmetrics_swarm_metric\\{swarm_id=\"([^\"]+)\",metric_kind=\"([^\"]+)\"} (\\S+) (\\d+)$");

    @TempDir
    Path tempDir;

    private SqliteStoreFixture fixture;
    private final Map<Long, Double> written = new HashMap<>();

    @BeforeEach
    void setUp() {
        fixture = new SqliteStoreFixture(tempDir.resolve("db"), NOW);
        List<MetricRecord> records = new ArrayList<>();
        for (int hour = 1; hour <= 24; hour++) {
            Instant at = NOW.minus(Duration.ofHours(hour));
            double health = 0.5 + hour / 100.0;
            records.add(new SwarmMetric("swarm-7", at, "health", health, null));
            written.put(at.toEpochMilli(), health);
        }
        records.add(new SwarmMetric("swarm-7", NOW.minus(Duration.ofHours(30)), "health", 0.01, null));
        records.add(new TaskMetric("task-1", "agent-1", NOW.minusSeconds(5), 250, TaskOutcome.SUCCESS, 12, 1));
        fixture.metricsStore.writeBatch(records);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void prometheusExportParsesBackToStoredValues() throws Exception {
        Path target = tempDir.resolve("out/swarm.prom");

        ExportResult result = fixture.exportService.export(fixture.exportService
                .defaults()
                .format(ExportFormat.PROMETHEUS)
                .outputPath(target)
                .build());

        Map<Long, Double> parsed = new HashMap<>();
        for (String line : Files.readAllLines(target, StandardCharsets.UTF_8)) {
            Matcher matcher = SAMPLE.matcher(line);
            if (matcher.matches()) {
                assertThat(matcher.group(1)).isEqualTo("swarm-7");
                assertThat(matcher.group(2)).isEqualTo("health");
                parsed.put(Long.parseLong(matcher.group(4)), Double.parseDouble(matcher.group(3)));
            }
        }
        assertThat(parsed).isEqualTo(written);
        assertThat(result.recordCounts()).containsEntry(MetricTable.SWARM_METRICS, 24L);
        assertThat(result.recordCounts()).containsEntry(MetricTable.TASK_METRICS, 1L);
    }

    @Test
    void grafanaExportGroupsInterleavedRowsIntoOneSeriesPerTarget() throws Exception {
        fixture.metricsStore.writeBatch(List.of(
                new TaskMetric("task-2", "agent-2", NOW.minusSeconds(50), 700, TaskOutcome.SUCCESS, 0, 0),
                new TaskMetric("task-3", "agent-1", NOW.minusSeconds(40), 300, TaskOutcome.FAILURE, 0, 0),
                new TaskMetric("task-4", "agent-2", NOW.minusSeconds(30), 900, TaskOutcome.SUCCESS, 0, 0)));
        Path target = tempDir.resolve("grafana.json");

        ExportResult result = fixture.exportService.export(ExportConfig.builder()
                .format(ExportFormat.GRAFANA)
                .outputPath(target)
                .build());

        JsonNode root = JsonUtil.mapper().readTree(target.toFile());
        assertThat(root).extracting(node -> node.path("target").asText())
                .containsExactly("agent-1.duration_ms", "agent-2.duration_ms", "swarm-7.health");
        JsonNode agentOne = root.get(0).path("datapoints");
        assertThat(agentOne).hasSize(2);
        assertThat(agentOne.get(0).get(0).asLong()).isEqualTo(300);
        assertThat(agentOne.get(0).get(1).asLong()).isEqualTo(NOW.minusSeconds(40).toEpochMilli());
        assertThat(agentOne.get(1).get(0).asLong()).isEqualTo(250);
        assertThat(root.get(1).path("datapoints")).hasSize(2);
        assertThat(root.get(2).path("datapoints")).hasSize(24);
        assertThat(result.recordCounts()).containsEntry(MetricTable.TASK_METRICS, 4L);
    }

    @Test
    void jsonExportSummarizesTheWindow() throws Exception {
        Path target = tempDir.resolve("metrics.json");

        fixture.exportService.export(ExportConfig.builder().outputPath(target).build());

        JsonNode root = JsonUtil.mapper().readTree(target.toFile());
        assertThat(root.path("swarm_metrics")).hasSize(24);
        assertThat(root.path("summary").path("total_tasks").asLong()).isEqualTo(1);
        assertThat(root.path("summary").path("avg_duration_ms").asDouble()).isEqualTo(250.0);
        assertThat(root.path("summary").path("record_counts").path("agent_metrics").asLong()).isZero();
    }
}
