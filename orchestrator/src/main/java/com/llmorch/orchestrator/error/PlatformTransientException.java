package com.llmorch.orchestrator.error;

/**
 * Transient failure of the container platform or metrics source: timeouts,
 * write conflicts, throttling and server errors.
 */
public class PlatformTransientException extends OrchestratorException {
    public static final String REASON = "PlatformTransient";

    public PlatformTransientException(String message) {
        super(REASON, true, message);
    }

    public PlatformTransientException(String message, Throwable cause) {
        super(REASON, true, message, cause);
    }
}
