package com.llmorch.orchestrator.error;

/**
 * The model registry could not be reached or answered with a server error.
 */
public class RegistryUnavailableException extends OrchestratorException {
    public static final String REASON = "RegistryUnavailable";

    public RegistryUnavailableException(String message) {
        super(REASON, true, message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(REASON, true, message, cause);
    }
}
