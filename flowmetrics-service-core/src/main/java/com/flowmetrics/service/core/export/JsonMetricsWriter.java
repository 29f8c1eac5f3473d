package com.flowmetrics.service.core.export;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.service.core.query.TaskSummary;
import com.flowmetrics.service.core.support.JsonUtil;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/** Structured document: {@code export_info}, one array per table, then {@code summary}. */
class JsonMetricsWriter implements MetricsWriter {

    private final JsonGenerator generator;
    private final boolean includeMetadata;

    JsonMetricsWriter(OutputStream out, boolean pretty, boolean includeMetadata) throws IOException {
        this.generator = JsonUtil.mapper().getFactory().createGenerator(out, JsonEncoding.UTF8);
        this.generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (pretty) {
            this.generator.useDefaultPrettyPrinter();
        }
        this.includeMetadata = includeMetadata;
    }

    @Override
    public void begin(Header header) throws IOException {
        generator.writeStartObject();
        generator.writeObjectFieldStart("export_info");
        generator.writeStringField("format", header.format().wireValue());
        generator.writeStringField("exported_at", header.exportedAt().toString());
        generator.writeStringField("from", ExportValues.iso(header.range().from()));
        generator.writeStringField("to", ExportValues.iso(header.range().to()));
        generator.writeEndObject();
    }

    @Override
    public void beginSection(MetricTable table, int pass) throws IOException {
        generator.writeArrayFieldStart(table.tableName());
    }

    @Override
    public void write(MetricRecord record, int pass) throws IOException {
        generator.writeStartObject();
        if (record instanceof TaskMetric task) {
            generator.writeStringField("task_id", task.taskId());
            generator.writeStringField("agent_id", task.agentId());
            generator.writeStringField("timestamp", ExportValues.iso(task.timestamp()));
            generator.writeNumberField("duration_ms", task.durationMs());
            generator.writeStringField("outcome", task.outcome().wireValue());
            generator.writeBooleanField("success", task.success());
            generator.writeNumberField("tokens_used", task.tokensUsed());
            generator.writeNumberField("files_changed", task.filesChanged());
        } else if (record instanceof AgentMetric agent) {
            generator.writeStringField("agent_id", agent.agentId());
            generator.writeStringField("timestamp", ExportValues.iso(agent.timestamp()));
            generator.writeStringField("metric_kind", agent.metricKind());
            generator.writeNumberField("value", agent.value());
        } else if (record instanceof SwarmMetric swarm) {
            generator.writeStringField("swarm_id", swarm.swarmId());
            generator.writeStringField("timestamp", ExportValues.iso(swarm.timestamp()));
            generator.writeStringField("metric_kind", swarm.metricKind());
            generator.writeNumberField("value", swarm.value());
        }
        if (includeMetadata && !record.metadata().isEmpty()) {
            generator.writeObjectField("metadata", record.metadata());
        }
        generator.writeEndObject();
    }

    @Override
    public void endSection(MetricTable table, int pass) throws IOException {
        generator.writeEndArray();
    }

    @Override
    public boolean wantsSummary() {
        return true;
    }

    @Override
    public void finish(TaskSummary summary, Map<MetricTable, Long> recordCounts) throws IOException {
        generator.writeObjectFieldStart("summary");
        if (summary != null) {
            generator.writeNumberField("total_tasks", summary.totalTasks());
            generator.writeNumberField("successful_tasks", summary.successfulTasks());
            generator.writeNumberField("success_rate", summary.successRate());
            writeNullableNumber("avg_duration_ms", summary.avgDurationMs());
            writeNullableNumber("p95_duration_ms", summary.p95DurationMs());
            writeNullableNumber("p99_duration_ms", summary.p99DurationMs());
            generator.writeNumberField("total_tokens", summary.totalTokens());
            writeNullableNumber("avg_tokens", summary.avgTokens());
            generator.writeNumberField("unique_agents", summary.uniqueAgents());
        }
        generator.writeObjectFieldStart("record_counts");
        for (Map.Entry<MetricTable, Long> entry : recordCounts.entrySet()) {
            generator.writeNumberField(entry.getKey().tableName(), entry.getValue());
        }
        generator.writeEndObject();
        generator.writeEndObject();
        generator.writeEndObject();
        generator.close();
    }

    private void writeNullableNumber(String field, Double value) throws IOException {
        if (value == null) {
            generator.writeNullField(field);
        } else {
            generator.writeNumberField(field, value);
        }
    }
}
