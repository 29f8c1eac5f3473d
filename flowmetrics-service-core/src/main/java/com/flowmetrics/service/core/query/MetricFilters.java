package com.flowmetrics.service.core.query;

import com.flowmetrics.model.MetricKinds;
import com.flowmetrics.model.MetricTable;
import com.flowmetrics.model.TaskOutcome;
import com.flowmetrics.service.core.archive.AggregationLevel;
import com.flowmetrics.service.core.error.MetricsStoreException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Exact-match conjunction of column filters. Keys are validated per table by {@link #resolve(MetricTable)}; any key
 * outside the documented set is rejected rather than ignored.
 */
public final class MetricFilters {

    public static final String METADATA_PREFIX = "metadata.";

    private static final Pattern METADATA_KEY_RE = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private static final Map<MetricTable, Set<String>> ALLOWED_KEYS = Map.of(
            MetricTable.TASK_METRICS, Set.of("task_id", "agent_id", "outcome"),
            MetricTable.AGENT_METRICS, Set.of("agent_id", "metric_kind"),
            MetricTable.SWARM_METRICS, Set.of("swarm_id", "metric_kind"),
            MetricTable.METRICS_ARCHIVE, Set.of("source_table", "aggregation_level", "scope_id", "metric_kind"));

    private static final MetricFilters NONE = new MetricFilters(Map.of());

    private final Map<String, String> values;

    private MetricFilters(Map<String, String> values) {
        this.values = values;
    }

    public static MetricFilters none() {
        return NONE;
    }

    public static MetricFilters of(String key, String value) {
        return none().and(key, value);
    }

    public static MetricFilters of(String k1, String v1, String k2, String v2) {
        return none().and(k1, v1).and(k2, v2);
    }

    public static MetricFilters from(Map<String, String> filters) {
        MetricFilters result = none();
        if (filters != null) {
            for (Map.Entry<String, String> entry : filters.entrySet()) {
                result = result.and(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    public MetricFilters and(String key, String value) {
        if (key == null || key.isBlank()) {
            throw MetricsStoreException.invalidQuery("Filter key is required");
        }
        if (value == null) {
            throw MetricsStoreException.invalidQuery("Filter " + key + " has no value");
        }
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(key.trim(), value);
        return new MetricFilters(Collections.unmodifiableMap(copy));
    }

    public String get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, String> asMap() {
        return values;
    }

    /**
     * Validates the filters against {@code table} and normalizes their values.
     *
     * @throws MetricsStoreException with {@code INVALID_QUERY} for unknown keys or malformed values
     */
    public List<Term> resolve(MetricTable table) {
        Set<String> allowed = ALLOWED_KEYS.get(table);
        List<Term> terms = new ArrayList<>(values.size());
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (key.startsWith(METADATA_PREFIX) && table.isDetailed()) {
                String metadataKey = key.substring(METADATA_PREFIX.length());
                if (!METADATA_KEY_RE.matcher(metadataKey).matches()) {
                    throw MetricsStoreException.invalidQuery("Invalid metadata filter key: " + key);
                }
                terms.add(new Term(metadataKey, value, true));
                continue;
            }
            if (!allowed.contains(key)) {
                throw MetricsStoreException.invalidQuery(
                        "Unsupported filter " + key + " for table " + table.tableName());
            }
            terms.add(new Term(key, normalizeValue(key, value), false));
        }
        return terms;
    }

    /** True when every filter can also be answered from archived buckets of {@code table}. */
    public boolean archiveCompatible(MetricTable table) {
        for (String key : values.keySet()) {
            boolean scopeKey = key.equals(table.scopeColumn());
            boolean kindKey = key.equals("metric_kind") && table != MetricTable.TASK_METRICS;
            if (!scopeKey && !kindKey) {
                return false;
            }
        }
        return true;
    }

    private static String normalizeValue(String key, String value) {
        try {
            return switch (key) {
                case "outcome" -> TaskOutcome.fromString(value).wireValue();
                case "metric_kind" -> MetricKinds.normalize(value);
                case "source_table" -> MetricTable.fromString(value).tableName();
                case "aggregation_level" -> AggregationLevel.fromString(value).wireValue();
                default -> value;
            };
        } catch (IllegalArgumentException ex) {
            throw MetricsStoreException.invalidQuery(ex.getMessage());
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetricFilters other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /** A validated filter: a column match, or a match on a top-level metadata entry. */
    public record Term(String key, String value, boolean metadata) {}
}
