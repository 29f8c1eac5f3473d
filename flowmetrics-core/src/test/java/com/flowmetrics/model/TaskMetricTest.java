package com.flowmetrics.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TaskMetricTest {

    @Test
    void truncatesTimestampToMillis() {
        Instant precise = Instant.parse("2024-03-01T10:15:30.123456789Z");

        TaskMetric metric = new TaskMetric("t-1", "agent-1", precise, 1200, TaskOutcome.SUCCESS, 10, 2);

        assertThat(metric.timestamp()).isEqualTo(Instant.parse("2024-03-01T10:15:30.123Z"));
        assertThat(metric.scopeId()).isEqualTo("agent-1");
        assertThat(metric.table()).isEqualTo(MetricTable.TASK_METRICS);
        assertThat(metric.success()).isTrue();
    }

    @Test
    void dropsNullMetadataEntriesAndKeepsOrder() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("branch", "main");
        metadata.put("retries", null);

        TaskMetric metric = new TaskMetric("t-1", "agent-1", null, 5, TaskOutcome.FAILURE, 0, 0, metadata);

        assertThat(metric.metadata()).containsExactly(Map.entry("branch", "main"));
        assertThat(metric.timestamp()).isNull();
        assertThatThrownBy(() -> metric.metadata().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void metadataIsDeepCopiedInStoredForm() {
        List<Object> files = new ArrayList<>(List.of("a.txt"));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("retries", 5L);
        metadata.put("ratio", 0.5f);
        metadata.put("files", files);
        metadata.put("started", Instant.parse("2024-03-01T10:15:30Z"));

        TaskMetric metric = new TaskMetric("t-1", "agent-1", null, 5, TaskOutcome.SUCCESS, 0, 0, metadata);
        files.add("b.txt");

        assertThat(metric.metadata())
                .containsEntry("retries", 5)
                .containsEntry("ratio", 0.5)
                .containsEntry("files", List.of("a.txt"))
                .containsEntry("started", "2024-03-01T10:15:30Z");
        @SuppressWarnings("unchecked")
        List<Object> copied = (List<Object>) metric.metadata().get("files");
        assertThatThrownBy(() -> copied.add("c.txt")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(new TaskMetric("t-1", "agent-1", null, 5, TaskOutcome.SUCCESS, 0, 0, metric.metadata()))
                .isEqualTo(metric);
    }

    @Test
    void rejectsInvalidFields() {
        Instant now = Instant.now();
        assertThatThrownBy(() -> new TaskMetric(" ", "a", now, 1, TaskOutcome.SUCCESS, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("taskId");
        assertThatThrownBy(() -> new TaskMetric("t", "a", now, -1, TaskOutcome.SUCCESS, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskMetric("t", "a", now, 1, null, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskMetric("t", "a", now, 1, TaskOutcome.SUCCESS, -3, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withTimestampKeepsOtherFields() {
        TaskMetric metric = new TaskMetric("t-9", "agent-2", null, 40, TaskOutcome.TIMEOUT, 7, 1);
        Instant at = Instant.parse("2024-01-01T00:00:00Z");

        TaskMetric stamped = metric.withTimestamp(at);

        assertThat(stamped.timestamp()).isEqualTo(at);
        assertThat(stamped.outcome()).isEqualTo(TaskOutcome.TIMEOUT);
        assertThat(stamped.success()).isFalse();
        assertThat(stamped.tokensUsed()).isEqualTo(7);
    }

    @Test
    void outcomeUsesLowercaseWireValues() {
        assertThat(TaskOutcome.fromString("Cancelled")).isEqualTo(TaskOutcome.CANCELLED);
        assertThat(TaskOutcome.SUCCESS.wireValue()).isEqualTo("success");
        assertThatThrownBy(() -> TaskOutcome.fromString("exploded")).isInstanceOf(IllegalArgumentException.class);
    }
}
