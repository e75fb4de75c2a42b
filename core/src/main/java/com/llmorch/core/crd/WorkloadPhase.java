package com.llmorch.core.crd;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle phase reported in {@code status.phase}.
 */
public enum WorkloadPhase {
    PENDING("Pending"),
    PROGRESSING("Progressing"),
    RUNNING("Running"),
    FAILED("Failed"),
    TERMINATING("Terminating");

    private final String value;

    WorkloadPhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static WorkloadPhase fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (WorkloadPhase phase : values()) {
            if (phase.value.equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown workload phase: " + value);
    }
}
