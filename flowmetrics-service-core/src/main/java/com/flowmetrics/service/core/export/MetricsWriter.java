package com.flowmetrics.service.core.export;

import com.flowmetrics.model.MetricRecord;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.query.TaskSummary;
import com.flowmetrics.service.core.query.TimeRange;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Streaming renderer for one export. Rows arrive one at a time, section by section, in
 * task, agent, swarm order. A format that needs several sweeps over a table (one per metric family) asks for them
 * through {@link #passes(MetricTable)}.
 */
interface MetricsWriter {

    void begin(Header header) throws IOException;

    default int passes(MetricTable table) {
        return 1;
    }

    void beginSection(MetricTable table, int pass) throws IOException;

    void write(MetricRecord record, int pass) throws IOException;

    void endSection(MetricTable table, int pass) throws IOException;

    /** {@code summary} is only computed for formats that render it, otherwise {@code null}. */
    void finish(TaskSummary summary, Map<MetricTable, Long> recordCounts) throws IOException;

    /** When true, rows of each section arrive one series at a time (see {@code MetricsQueryService#series}). */
    default boolean groupsBySeries() {
        return false;
    }

    default boolean wantsSummary() {
        return false;
    }

    record Header(ExportFormat format, Instant exportedAt, TimeRange range) {}
}
