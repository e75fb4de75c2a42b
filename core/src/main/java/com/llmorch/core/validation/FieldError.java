package com.llmorch.core.validation;

/**
 * One rejected field of a workload document, e.g. {@code spec.scaling.maxReplicas}.
 */
public record FieldError(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
