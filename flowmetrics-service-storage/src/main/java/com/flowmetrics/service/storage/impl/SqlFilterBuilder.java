package com.flowmetrics.service.storage.impl;

import com.flowmetrics.model.MetricTable;
import com.flowmetrics.service.core.query.MetricFilters;
import com.flowmetrics.service.core.query.TimeRange;
import com.flowmetrics.service.core.query.ValueColumn;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Builds WHERE clauses for detailed tables. Column names come from the validated filter whitelist; every value is
 * a bound parameter. Metadata filters compare the text form of a top-level JSON entry, so a numeric {@code 2}
 * matches {@code "2"} and booleans match {@code "true"} or {@code "false"}, the same text the exports write.
 */
final class SqlFilterBuilder {

    private SqlFilterBuilder() {}

    static Where where(MetricTable table, MetricFilters filters, TimeRange range) {
        return where(table, filters, range, "timestamp");
    }

    static Where where(MetricTable table, MetricFilters filters, TimeRange range, String timeColumn) {
        List<String> clauses = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource();
        int index = 0;
        for (MetricFilters.Term term : filters.resolve(table)) {
            String name = "f" + index++;
            if (term.metadata()) {
                clauses.add(metadataText(":" + name + "_path") + " = :" + name);
                params.addValue(name + "_path", "$.\"" + term.key() + "\"");
            } else {
                clauses.add(term.key() + " = :" + name);
            }
            params.addValue(name, term.value());
        }
        if (range.from() != null) {
            clauses.add(timeColumn + " >= :from_ms");
            params.addValue("from_ms", range.fromMillis());
        }
        if (range.to() != null) {
            clauses.add(timeColumn + " < :to_ms");
            params.addValue("to_ms", range.toMillis());
        }
        String sql = clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        return new Where(sql, params);
    }

    // json_extract yields 1/0 for JSON booleans
    private static String metadataText(String path) {
        return "(CASE json_type(metadata, " + path + ")"
                + " WHEN 'true' THEN 'true' WHEN 'false' THEN 'false'"
                + " ELSE CAST(json_extract(metadata, " + path + ") AS TEXT) END)";
    }

    static String valueExpression(ValueColumn column) {
        return switch (column) {
            case DURATION_MS -> "duration_ms";
            case TOKENS_USED -> "tokens_used";
            case FILES_CHANGED -> "files_changed";
            case SUCCESS -> "(CASE WHEN outcome = 'success' THEN 1.0 ELSE 0.0 END)";
            case VALUE -> "value";
        };
    }

    record Where(String sql, MapSqlParameterSource params) {}
}
