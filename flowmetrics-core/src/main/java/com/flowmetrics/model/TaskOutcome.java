package com.flowmetrics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Terminal state of one unit of work executed by an agent. */
public enum TaskOutcome {
    SUCCESS("success"),
    FAILURE("failure"),
    TIMEOUT("timeout"),
    CANCELLED("cancelled");

    private final String wireValue;

    TaskOutcome(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonCreator
    public static TaskOutcome fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task outcome is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TaskOutcome outcome : values()) {
            if (outcome.wireValue.equals(normalized)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unsupported task outcome: " + value);
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
