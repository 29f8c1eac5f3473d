package com.flowmetrics.service.core.export;

import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.service.core.query.TaskSummary;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Line-oriented exposition text: {@code name{label="value",...} value timestamp_ms}, grouped per family under
 * {@code # HELP} and {@code # TYPE} headers. Task rows are swept once per task family.
 */
class PrometheusMetricsWriter implements MetricsWriter {

    static final String TASK_DURATION = "flowmetrics_task_duration_ms";
    static final String TASK_TOKENS = "flowmetrics_task_tokens_used";
    static final String TASK_FILES = "flowmetrics_task_files_changed";
    static final String AGENT_METRIC = "flowmetrics_agent_metric";
    static final String SWARM_METRIC = "flowmetrics_swarm_metric";

    private static final String[] TASK_FAMILIES = {TASK_DURATION, TASK_TOKENS, TASK_FILES};
    private static final String[] TASK_HELP = {
        "Task execution duration in milliseconds", "Tokens consumed by the task", "Files changed by the task"
    };

    private final Writer writer;

    PrometheusMetricsWriter(OutputStream out) {
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    @Override
    public void begin(Header header) {
        // no document header in this format
    }

    @Override
    public int passes(MetricTable table) {
        return table == MetricTable.TASK_METRICS ? TASK_FAMILIES.length : 1;
    }

    @Override
    public void beginSection(MetricTable table, int pass) throws IOException {
        switch (table) {
            case TASK_METRICS -> family(TASK_FAMILIES[pass], TASK_HELP[pass]);
            case AGENT_METRICS -> family(AGENT_METRIC, "Agent level metric value by kind");
            case SWARM_METRICS -> family(SWARM_METRIC, "Swarm level metric value by kind");
            default -> throw new IllegalArgumentException("Not exportable: " + table);
        }
    }

    private void family(String name, String help) throws IOException {
        writer.write("# HELP " + name + " " + help + "\n");
        writer.write("# TYPE " + name + " gauge\n");
    }

    @Override
    public void write(MetricRecord record, int pass) throws IOException {
        StringBuilder line = new StringBuilder(128);
        if (record instanceof TaskMetric task) {
            line.append(TASK_FAMILIES[pass]);
            line.append('{');
            label(line, "agent_id", task.agentId()).append(',');
            label(line, "task_id", task.taskId()).append(',');
            label(line, "outcome", task.outcome().wireValue());
            line.append("} ");
            long value =
                    switch (pass) {
                        case 0 -> task.durationMs();
                        case 1 -> task.tokensUsed();
                        default -> task.filesChanged();
                    };
            line.append(value);
        } else if (record instanceof AgentMetric agent) {
            line.append(AGENT_METRIC).append('{');
            label(line, "agent_id", agent.agentId()).append(',');
            label(line, "metric_kind", agent.metricKind());
            line.append("} ").append(ExportValues.number(agent.value()));
        } else if (record instanceof SwarmMetric swarm) {
            line.append(SWARM_METRIC).append('{');
            label(line, "swarm_id", swarm.swarmId()).append(',');
            label(line, "metric_kind", swarm.metricKind());
            line.append("} ").append(ExportValues.number(swarm.value()));
        } else {
            return;
        }
        line.append(' ').append(ExportValues.millis(record.timestamp())).append('\n');
        writer.write(line.toString());
    }

    @Override
    public void endSection(MetricTable table, int pass) throws IOException {
        writer.flush();
    }

    @Override
    public void finish(TaskSummary summary, Map<MetricTable, Long> recordCounts) throws IOException {
        writer.flush();
    }

    private static StringBuilder label(StringBuilder line, String name, String value) {
        return line.append(name).append("=\"").append(escape(value)).append('"');
    }

    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
