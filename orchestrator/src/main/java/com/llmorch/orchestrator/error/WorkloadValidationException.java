package com.llmorch.orchestrator.error;

import com.llmorch.core.validation.FieldError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The workload spec is malformed. Not retryable until the spec changes.
 */
public class WorkloadValidationException extends OrchestratorException {
    public static final String REASON = "InvalidSpec";

    private final List<FieldError> errors;

    public WorkloadValidationException(List<FieldError> errors) {
        super(REASON, false, errors.stream().map(FieldError::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> getErrors() {
        return errors;
    }
}
