package com.flowmetrics.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.error.ErrorKind;
import com.flowmetrics.service.core.error.MetricsStoreException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricFiltersTest {

    @Test
    void resolvesAndNormalizesKnownKeys() {
        MetricFilters filters = MetricFilters.of("agent_id", "agent-7", "outcome", "SUCCESS");

        List<MetricFilters.Term> terms = filters.resolve(MetricTable.TASK_METRICS);

        assertThat(terms)
                .containsExactly(
                        new MetricFilters.Term("agent_id", "agent-7", false),
                        new MetricFilters.Term("outcome", "success", false));
    }

    @Test
    void rejectsKeysOutsideTheTableWhitelist() {
        MetricFilters filters = MetricFilters.of("swarm_id", "s-1");

        assertThatThrownBy(() -> filters.resolve(MetricTable.TASK_METRICS))
                .isInstanceOf(MetricsStoreException.class)
                .satisfies(ex -> assertThat(((MetricsStoreException) ex).getKind()).isEqualTo(ErrorKind.INVALID_QUERY))
                .hasMessageContaining("swarm_id");
    }

    @Test
    void rejectsInjectionAttemptsInKeys() {
        MetricFilters column = MetricFilters.of("agent_id = agent_id OR 1", "x");
        MetricFilters metadata = MetricFilters.of("metadata.a'b", "x");

        assertThatThrownBy(() -> column.resolve(MetricTable.AGENT_METRICS))
                .isInstanceOf(MetricsStoreException.class);
        assertThatThrownBy(() -> metadata.resolve(MetricTable.AGENT_METRICS))
                .isInstanceOf(MetricsStoreException.class);
    }

    @Test
    void metadataKeysAreAllowedOnDetailedTablesOnly() {
        MetricFilters filters = MetricFilters.of("metadata.branch", "main");

        assertThat(filters.resolve(MetricTable.SWARM_METRICS))
                .containsExactly(new MetricFilters.Term("branch", "main", true));
        assertThatThrownBy(() -> filters.resolve(MetricTable.METRICS_ARCHIVE))
                .isInstanceOf(MetricsStoreException.class);
    }

    @Test
    void invalidValuesAreQueryErrors() {
        assertThatThrownBy(() -> MetricFilters.of("outcome", "exploded").resolve(MetricTable.TASK_METRICS))
                .isInstanceOf(MetricsStoreException.class);
        assertThatThrownBy(() -> MetricFilters.of("metric_kind", null)).isInstanceOf(MetricsStoreException.class);
    }

    @Test
    void onlyScopeAndKindFiltersHaveAnArchivedForm() {
        assertThat(MetricFilters.of("agent_id", "a").archiveCompatible(MetricTable.TASK_METRICS)).isTrue();
        assertThat(MetricFilters.of("outcome", "success").archiveCompatible(MetricTable.TASK_METRICS)).isFalse();
        assertThat(MetricFilters.of("metric_kind", "health").archiveCompatible(MetricTable.AGENT_METRICS))
                .isTrue();
        assertThat(MetricFilters.of("metadata.branch", "main").archiveCompatible(MetricTable.SWARM_METRICS))
                .isFalse();
    }

    @Test
    void timeRangeIsHalfOpenAndClampsOpenStarts() {
        Instant from = Instant.parse("2024-01-01T00:00:00Z");
        Instant to = Instant.parse("2024-01-02T00:00:00Z");
        TimeRange range = TimeRange.between(from, to);

        assertThat(range.contains(from)).isTrue();
        assertThat(range.contains(to)).isFalse();
        assertThat(TimeRange.all().clampFrom(from).from()).isEqualTo(from);
        assertThat(TimeRange.between(to, from).isEmpty()).isTrue();
    }
}
