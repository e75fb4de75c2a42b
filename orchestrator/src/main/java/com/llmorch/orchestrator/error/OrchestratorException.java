package com.llmorch.orchestrator.error;

/**
 * Base of the typed failures raised by orchestrator components.
 * <p>
 * {@code reason} is the machine-readable cause written into workload
 * conditions and the {@code reason} tag of failure metrics.
 * </p>
 */
public class OrchestratorException extends RuntimeException {
    private final String reason;
    private final boolean retryable;

    public OrchestratorException(String reason, boolean retryable, String message) {
        super(message);
        this.reason = reason;
        this.retryable = retryable;
    }

    public OrchestratorException(String reason, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.retryable = retryable;
    }

    public String getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
