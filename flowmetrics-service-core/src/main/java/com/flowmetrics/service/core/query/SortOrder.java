package com.flowmetrics.service.core.query;

import com.flowmetrics.service.core.error.MetricsStoreException;
import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromString(String value) {
        if (value == null || value.isBlank()) {
            return ASC;
        }
        try {
            return SortOrder.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw MetricsStoreException.invalidQuery("Unsupported sort order: " + value);
        }
    }
}
