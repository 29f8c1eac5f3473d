package com.flowmetrics.service.core.export;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricKinds;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.service.core.query.TaskSummary;
import com.flowmetrics.service.core.support.JsonUtil;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * Grafana JSON datasource response: {@code [{"target": "agent-1.duration_ms", "datapoints": [[value, ms], ...]}]}.
 * Tasks give one {@code <agent>.duration_ms} series per agent; agent and swarm rows give {@code <scope>.<kind>}.
 * Rows must arrive grouped by series, so a series object is closed as soon as the target changes.
 */
class GrafanaMetricsWriter implements MetricsWriter {

    private final JsonGenerator generator;
    private String openTarget;

    GrafanaMetricsWriter(OutputStream out, boolean pretty) throws IOException {
        this.generator = JsonUtil.mapper().getFactory().createGenerator(out, JsonEncoding.UTF8);
        this.generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (pretty) {
            this.generator.useDefaultPrettyPrinter();
        }
    }

    @Override
    public boolean groupsBySeries() {
        return true;
    }

    @Override
    public void begin(Header header) throws IOException {
        generator.writeStartArray();
    }

    @Override
    public void beginSection(MetricTable table, int pass) {
        openTarget = null;
    }

    @Override
    public void write(MetricRecord record, int pass) throws IOException {
        String target;
        Double value = null;
        if (record instanceof TaskMetric task) {
            target = task.agentId() + "." + MetricKinds.TASK_DURATION_MS;
        } else if (record instanceof AgentMetric agent) {
            target = agent.agentId() + "." + agent.metricKind();
            value = agent.value();
        } else if (record instanceof SwarmMetric swarm) {
            target = swarm.swarmId() + "." + swarm.metricKind();
            value = swarm.value();
        } else {
            return;
        }
        if (!target.equals(openTarget)) {
            closeSeries();
            generator.writeStartObject();
            generator.writeStringField("target", target);
            generator.writeArrayFieldStart("datapoints");
            openTarget = target;
        }
        generator.writeStartArray();
        if (value == null) {
            generator.writeNumber(((TaskMetric) record).durationMs());
        } else {
            generator.writeNumber(value);
        }
        generator.writeNumber(record.timestamp().toEpochMilli());
        generator.writeEndArray();
    }

    @Override
    public void endSection(MetricTable table, int pass) throws IOException {
        closeSeries();
        generator.flush();
    }

    @Override
    public void finish(TaskSummary summary, Map<MetricTable, Long> recordCounts) throws IOException {
        generator.writeEndArray();
        generator.flush();
    }

    private void closeSeries() throws IOException {
        if (openTarget != null) {
            generator.writeEndArray();
            generator.writeEndObject();
            openTarget = null;
        }
    }
}
