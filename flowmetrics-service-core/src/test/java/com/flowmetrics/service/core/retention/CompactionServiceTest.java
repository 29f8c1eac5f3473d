package com.flowmetrics.service.core.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricKinds;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.model.TaskOutcome;
import com.flowmetrics.service.core.archive.AggregationLevel;
import com.flowmetrics.service.core.archive.ArchiveBucket;
import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.ErrorKind;
import com.flowmetrics.service.core.error.MetricsStoreException;
import com.flowmetrics.service.core.support.InMemoryArchiveStore;
import com.flowmetrics.service.core.support.InMemoryMetricsStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CompactionServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private final MetricsProperties properties = new MetricsProperties();
    private final InMemoryMetricsStore store = new InMemoryMetricsStore();
    private final InMemoryArchiveStore archive = new InMemoryArchiveStore(store);
    private CompactionService service;

    @BeforeEach
    void setUp() {
        properties.getRetention().setBatchSize(2);
        service = new CompactionService(store, archive, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        store.writeBatch(List.of(
                task("t-1", NOW.minus(Duration.ofDays(10)), 100, TaskOutcome.SUCCESS),
                task("t-2", NOW.minus(Duration.ofDays(10)).plusSeconds(1200), 300, TaskOutcome.FAILURE),
                task("t-3", NOW.minus(Duration.ofDays(1)), 50, TaskOutcome.SUCCESS),
                agent(NOW.minus(Duration.ofDays(40)), 0.75),
                agent(NOW.minus(Duration.ofDays(100)), 0.10)));
    }

    @Test
    void passPurgesCompactsAndRollsUp() {
        CompactionReport report = service.runCompaction();

        assertThat(report.hasFailures()).isFalse();
        assertThat(report.purgedRows()).containsEntry(MetricTable.AGENT_METRICS, 1);
        assertThat(report.compactedRows())
                .containsEntry(MetricTable.TASK_METRICS, 2)
                .containsEntry(MetricTable.AGENT_METRICS, 1);
        assertThat(report.hourlyBucketsRolledUp()).containsEntry(MetricTable.AGENT_METRICS, 1);
        assertThat(service.lastReport()).isEqualTo(report);

        assertThat(store.all()).singleElement().satisfies(record -> assertThat(((TaskMetric) record).taskId())
                .isEqualTo("t-3"));

        List<ArchiveBucket> buckets = archive.all();
        assertThat(buckets)
                .filteredOn(b -> b.sourceTable() == MetricTable.TASK_METRICS)
                .extracting(ArchiveBucket::metricKind)
                .containsExactlyInAnyOrderElementsOf(MetricKinds.taskKinds());
        ArchiveBucket duration = bucket(MetricTable.TASK_METRICS, MetricKinds.TASK_DURATION_MS);
        assertThat(duration.level()).isEqualTo(AggregationLevel.HOURLY);
        assertThat(duration.bucketStart()).isEqualTo(Instant.parse("2024-06-05T12:00:00Z"));
        assertThat(duration.stats().count()).isEqualTo(2);
        assertThat(duration.stats().sum()).isEqualTo(400.0);
        assertThat(bucket(MetricTable.TASK_METRICS, MetricKinds.TASK_SUCCESS).stats().mean()).isEqualTo(0.5);

        ArchiveBucket health = bucket(MetricTable.AGENT_METRICS, "health");
        assertThat(health.level()).isEqualTo(AggregationLevel.DAILY);
        assertThat(health.bucketStart()).isEqualTo(Instant.parse("2024-05-06T00:00:00Z"));
        assertThat(health.stats().max()).isEqualTo(0.75);
    }

    @Test
    void secondPassChangesNothing() {
        service.runCompaction();
        List<ArchiveBucket> before = archive.all();

        CompactionReport second = service.runCompaction();

        assertThat(second.totalCompactedRows()).isZero();
        assertThat(archive.all()).isEqualTo(before);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void failingTableIsReportedAfterOtherTablesCompact() {
        archive.failCompactionOf(MetricTable.AGENT_METRICS, InMemoryMetricsStore.unavailable());

        assertThatThrownBy(() -> service.runCompaction())
                .isInstanceOf(MetricsStoreException.class)
                .satisfies(ex -> assertThat(((MetricsStoreException) ex).getKind())
                        .isEqualTo(ErrorKind.RETENTION_FAILURE));

        CompactionReport report = service.lastReport();
        assertThat(report.failures()).containsOnlyKeys(MetricTable.AGENT_METRICS);
        assertThat(report.compactedRows()).containsEntry(MetricTable.TASK_METRICS, 2);
        assertThat(store.all()).hasSize(2);
    }

    @Test
    void taskRowsContributeOneSamplePerDerivedKind() {
        Map<String, Double> samples =
                CompactionService.samples(task("t-9", NOW, 1200, TaskOutcome.TIMEOUT));

        assertThat(samples)
                .containsEntry(MetricKinds.TASK_DURATION_MS, 1200.0)
                .containsEntry(MetricKinds.TASK_TOKENS_USED, 42.0)
                .containsEntry(MetricKinds.TASK_FILES_CHANGED, 3.0)
                .containsEntry(MetricKinds.TASK_SUCCESS, 0.0);
    }

    @Test
    void invalidRetentionWindowsAreRejected() {
        properties.getRetention().setDetailedDays(40);

        assertThatThrownBy(() -> RetentionCutoffs.validate(properties.getRetention()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void schedulerRunsPassOnDemand() throws Exception {
        CompactionScheduler scheduler = new CompactionScheduler(service, properties);
        scheduler.init(null);
        try {
            CompactionReport report = scheduler.triggerNow().get(5, TimeUnit.SECONDS);

            assertThat(report.totalCompactedRows()).isEqualTo(3);
        } finally {
            scheduler.stop();
        }
    }

    private ArchiveBucket bucket(MetricTable table, String kind) {
        return archive.all().stream()
                .filter(b -> b.sourceTable() == table && b.metricKind().equals(kind))
                .findFirst()
                .orElseThrow();
    }

    private static TaskMetric task(String id, Instant at, long durationMs, TaskOutcome outcome) {
        return new TaskMetric(id, "agent-1", at, durationMs, outcome, 42, 3);
    }

    private static AgentMetric agent(Instant at, double value) {
        return new AgentMetric("agent-1", at, "health", value, null);
    }
}
