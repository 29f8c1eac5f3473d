package com.flowmetrics.service.core.export;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.config.MetricsProperties;
import com.flowmetrics.service.core.error.MetricsStoreException;
import com.flowmetrics.service.core.query.MetricFilters;
import com.flowmetrics.service.core.query.MetricsQueryService;
import com.flowmetrics.service.core.query.RecordQuery;
import com.flowmetrics.service.core.query.TaskSummary;
import com.flowmetrics.service.core.query.TimeRange;
import java.io.BufferedOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPOutputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Renders stored metrics to JSON, CSV, exposition text or Grafana JSON datasource series. Rows are streamed from the store straight into the
 * writer, so memory use does not grow with the export window.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricsExportService {

    private final MetricsQueryService queryService;
    private final MetricsProperties properties;
    private final Clock clock;

    /** Builder pre-filled with {@code flowmetrics.export.*}. */
    public ExportConfig.ExportConfigBuilder defaults() {
        MetricsProperties.Export export = properties.getExport();
        return ExportConfig.builder()
                .format(ExportFormat.fromString(export.getFormat()))
                .window(export.getWindow())
                .pretty(export.isPretty())
                .includeMetadata(export.isIncludeMetadata());
    }

    public ExportResult export(ExportConfig config) {
        MetricsProperties.Export defaults = properties.getExport();
        ExportFormat format =
                config.getFormat() != null ? config.getFormat() : ExportFormat.fromString(defaults.getFormat());
        boolean pretty = config.getPretty() != null ? config.getPretty() : defaults.isPretty();
        boolean includeMetadata =
                config.getIncludeMetadata() != null ? config.getIncludeMetadata() : defaults.isIncludeMetadata();
        Set<MetricTable> tables = config.getTables();
        validate(config, tables);
        Instant now = clock.instant();
        TimeRange range = resolveRange(config, defaults, now);

        Path path = config.getOutputPath();
        boolean completed = false;
        try (OutputStream target = openTarget(config)) {
            OutputStream out = config.isCompress() ? new GZIPOutputStream(target, 8192) : target;
            MetricsWriter writer = createWriter(format, out, pretty, includeMetadata);
            writer.begin(new MetricsWriter.Header(format, now, range));
            Map<MetricTable, Long> counts = writeSections(writer, tables, range);
            TaskSummary summary = writer.wantsSummary() ? queryService.summaryStats(range) : null;
            writer.finish(summary, counts);
            if (out instanceof GZIPOutputStream gzip) {
                gzip.finish();
            }
            out.flush();
            completed = true;
            ExportResult result = new ExportResult(format, config.describeTarget(), counts, config.isCompress(), range);
            log.info(
                    "Metrics export finished format={} target={} records={} compressed={}",
                    format.wireValue(),
                    result.target(),
                    result.totalRecords(),
                    result.compressed());
            return result;
        } catch (IOException ex) {
            throw MetricsStoreException.exportFailed("Export to " + config.describeTarget() + " failed", ex);
        } catch (UncheckedIOException ex) {
            throw MetricsStoreException.exportFailed("Export to " + config.describeTarget() + " failed", ex.getCause());
        } finally {
            if (!completed && path != null) {
                deletePartial(path);
            }
        }
    }

    private Map<MetricTable, Long> writeSections(MetricsWriter writer, Set<MetricTable> tables, TimeRange range)
            throws IOException {
        Map<MetricTable, Long> counts = new EnumMap<>(MetricTable.class);
        for (MetricTable table : MetricTable.detailedTables()) {
            if (!tables.contains(table)) {
                continue;
            }
            if (writer.groupsBySeries()) {
                counts.put(table, writeSeries(writer, table, range));
                continue;
            }
            for (int pass = 0; pass < writer.passes(table); pass++) {
                int current = pass;
                writer.beginSection(table, pass);
                long written = queryService.streamRecords(
                        RecordQuery.stream(table, MetricFilters.none(), range), record -> {
                            try {
                                writer.write(record, current);
                            } catch (IOException ex) {
                                throw new UncheckedIOException(ex);
                            }
                        });
                writer.endSection(table, pass);
                if (pass == 0) {
                    counts.put(table, written);
                }
            }
        }
        return counts;
    }

    private long writeSeries(MetricsWriter writer, MetricTable table, TimeRange range) throws IOException {
        long written = 0;
        writer.beginSection(table, 0);
        for (MetricFilters series : queryService.series(table, range)) {
            written += queryService.streamRecords(RecordQuery.stream(table, series, range), record -> {
                try {
                    writer.write(record, 0);
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            });
        }
        writer.endSection(table, 0);
        return written;
    }

    private static void validate(ExportConfig config, Set<MetricTable> tables) {
        if ((config.getOutputPath() == null) == (config.getOutputStream() == null)) {
            throw MetricsStoreException.invalidQuery("Exactly one of outputPath and outputStream is required");
        }
        if (tables == null || tables.isEmpty()) {
            throw MetricsStoreException.invalidQuery("At least one table must be exported");
        }
        for (MetricTable table : tables) {
            if (!table.isDetailed()) {
                throw MetricsStoreException.invalidQuery("Table cannot be exported: " + table.tableName());
            }
        }
        if (config.getWindow() != null && (config.getWindow().isNegative() || config.getWindow().isZero())) {
            throw MetricsStoreException.invalidQuery("Export window must be positive");
        }
    }

    private static TimeRange resolveRange(ExportConfig config, MetricsProperties.Export defaults, Instant now) {
        if (config.getTimeRange() != null) {
            return config.getTimeRange();
        }
        Duration window = config.getWindow() != null ? config.getWindow() : defaults.getWindow();
        return TimeRange.trailing(window, now);
    }

    private static OutputStream openTarget(ExportConfig config) throws IOException {
        if (config.getOutputStream() != null) {
            return new NonClosingOutputStream(config.getOutputStream());
        }
        Path path = config.getOutputPath();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new BufferedOutputStream(Files.newOutputStream(path));
    }

    private static MetricsWriter createWriter(
            ExportFormat format, OutputStream out, boolean pretty, boolean includeMetadata) throws IOException {
        return switch (format) {
            case JSON -> new JsonMetricsWriter(out, pretty, includeMetadata);
            case CSV -> new CsvMetricsWriter(out, includeMetadata);
            case PROMETHEUS -> new PrometheusMetricsWriter(out);
            case GRAFANA -> new GrafanaMetricsWriter(out, pretty);
        };
    }

    private static void deletePartial(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Could not remove partial export {}", path, ex);
        }
    }

    /** Caller-owned streams are flushed, never closed. */
    private static final class NonClosingOutputStream extends FilterOutputStream {

        NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
