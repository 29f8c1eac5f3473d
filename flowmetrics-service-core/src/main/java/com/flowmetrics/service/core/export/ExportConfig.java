package com.flowmetrics.service.core.export;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.query.TimeRange;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * One export request. Exactly one of {@code outputPath} and {@code outputStream} must be set; a caller-supplied
 * stream is flushed but left open. Unset format, window, pretty and include-metadata fall back to
 * {@code flowmetrics.export.*}. An explicit {@code timeRange} wins over {@code window}.
 */
@Getter
@Builder(toBuilder = true)
public class ExportConfig {

    private final ExportFormat format;
    private final Path outputPath;
    private final OutputStream outputStream;
    private final TimeRange timeRange;
    private final Duration window;
    private final Boolean pretty;
    private final boolean compress;
    private final Boolean includeMetadata;

    @Builder.Default
    private final Set<MetricTable> tables = EnumSet.copyOf(MetricTable.detailedTables());

    public String describeTarget() {
        if (outputPath != null) {
            return outputPath.toString();
        }
        return outputStream != null ? "stream" : "none";
    }
}
