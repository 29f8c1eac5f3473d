package com.flowmetrics.model;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Registry of well-known metric kinds. Kinds are an open set: any normalized string is accepted and persisted as-is,
 * so producers can introduce new kinds without a schema change.
 */
public final class MetricKinds {

    public static final String DURATION = "duration";
    public static final String SUCCESS_RATE = "success_rate";
    public static final String ERROR_COUNT = "error_count";
    public static final String THROUGHPUT = "throughput";
    public static final String HEALTH = "health";
    public static final String LATENCY = "latency";
    public static final String RESOURCE_UTILIZATION = "resource_utilization";

    // Kinds derived from task rows during compaction.
    public static final String TASK_DURATION_MS = "duration_ms";
    public static final String TASK_TOKENS_USED = "tokens_used";
    public static final String TASK_FILES_CHANGED = "files_changed";
    public static final String TASK_SUCCESS = "success";

    private static final Pattern KIND_RE = Pattern.compile("^[a-z0-9_.:-]{1,64}$");

    private static final Set<String> WELL_KNOWN = Set.of(
            DURATION,
            SUCCESS_RATE,
            ERROR_COUNT,
            THROUGHPUT,
            HEALTH,
            LATENCY,
            RESOURCE_UTILIZATION,
            TASK_DURATION_MS,
            TASK_TOKENS_USED,
            TASK_FILES_CHANGED,
            TASK_SUCCESS);

    private static final Set<String> TASK_KINDS =
            Set.of(TASK_DURATION_MS, TASK_TOKENS_USED, TASK_FILES_CHANGED, TASK_SUCCESS);

    private MetricKinds() {}

    public static String normalize(String kind) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("metric kind is required");
        }
        String normalized = kind.trim().toLowerCase(Locale.ROOT);
        if (!KIND_RE.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid metric kind: " + kind);
        }
        return normalized;
    }

    public static boolean isWellKnown(String kind) {
        return kind != null && WELL_KNOWN.contains(kind);
    }

    public static Set<String> taskKinds() {
        return TASK_KINDS;
    }
}
