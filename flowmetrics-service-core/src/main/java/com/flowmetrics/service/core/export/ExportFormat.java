package com.flowmetrics.service.core.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flowmetrics.service.core.error.MetricsStoreException;
import java.util.Locale;

public enum ExportFormat {
    JSON("json", "json"),
    CSV("csv", "csv"),
    PROMETHEUS("prometheus", "prom"),
    GRAFANA("grafana", "json");

    private final String wireValue;
    private final String fileExtension;

    ExportFormat(String wireValue, String fileExtension) {
        this.wireValue = wireValue;
        this.fileExtension = fileExtension;
    }

    @JsonCreator
    public static ExportFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.wireValue.equals(normalized)) {
                return format;
            }
        }
        throw MetricsStoreException.invalidQuery("Unsupported export format: " + value);
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public String fileExtension() {
        return fileExtension;
    }
}
