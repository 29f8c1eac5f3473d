package com.flowmetrics.service.core.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flowmetrics.model.AgentMetric;
import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.SwarmMetric;
import com.flowmetrics.model.TaskMetric;
import com.flowmetrics.service.core.query.TaskSummary;
import com.flowmetrics.service.core.support.JsonUtil;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** One header row, then one row per record of any table. Cells that do not apply to a row are empty. */
class CsvMetricsWriter implements MetricsWriter {

    static final List<String> COLUMNS = List.of(
            "metric_type",
            "timestamp",
            "timestamp_iso",
            "agent_id",
            "task_id",
            "swarm_id",
            "duration_ms",
            "tokens_used",
            "files_changed",
            "outcome",
            "success",
            "metric_kind",
            "value");

    private static final CsvMapper CSV = new CsvMapper();

    static {
        CSV.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    private final Writer writer;
    private final SequenceWriter rows;
    private final boolean includeMetadata;

    CsvMetricsWriter(OutputStream out, boolean includeMetadata) throws IOException {
        this.writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        this.rows = CSV.writerFor(String[].class).with(CsvSchema.emptySchema()).writeValues(writer);
        this.includeMetadata = includeMetadata;
    }

    @Override
    public void begin(Header header) throws IOException {
        List<String> columns = new ArrayList<>(COLUMNS);
        if (includeMetadata) {
            columns.add("metadata");
        }
        rows.write(columns.toArray(new String[0]));
    }

    @Override
    public void beginSection(MetricTable table, int pass) {
        // flat output has no section markers
    }

    @Override
    public void write(MetricRecord record, int pass) throws IOException {
        String[] row = new String[COLUMNS.size() + (includeMetadata ? 1 : 0)];
        Arrays.fill(row, "");
        row[1] = ExportValues.millis(record.timestamp());
        row[2] = ExportValues.iso(record.timestamp());
        if (record instanceof TaskMetric task) {
            row[0] = "task";
            row[3] = task.agentId();
            row[4] = task.taskId();
            row[6] = Long.toString(task.durationMs());
            row[7] = Long.toString(task.tokensUsed());
            row[8] = Long.toString(task.filesChanged());
            row[9] = task.outcome().wireValue();
            row[10] = Boolean.toString(task.success());
        } else if (record instanceof AgentMetric agent) {
            row[0] = "agent";
            row[3] = agent.agentId();
            row[11] = agent.metricKind();
            row[12] = ExportValues.number(agent.value());
        } else if (record instanceof SwarmMetric swarm) {
            row[0] = "swarm";
            row[5] = swarm.swarmId();
            row[11] = swarm.metricKind();
            row[12] = ExportValues.number(swarm.value());
        }
        if (includeMetadata && !record.metadata().isEmpty()) {
            row[COLUMNS.size()] = JsonUtil.toJson(record.metadata());
        }
        rows.write(row);
    }

    @Override
    public void endSection(MetricTable table, int pass) throws IOException {
        rows.flush();
    }

    @Override
    public void finish(TaskSummary summary, Map<MetricTable, Long> recordCounts) throws IOException {
        rows.close();
        writer.flush();
    }
}
