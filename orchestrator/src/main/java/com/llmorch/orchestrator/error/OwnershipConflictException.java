package com.llmorch.orchestrator.error;

/**
 * A child object exists but is not owned by the workload. Needs operator intervention.
 */
public class OwnershipConflictException extends OrchestratorException {
    public static final String REASON = "OwnedByOther";

    public OwnershipConflictException(String kind, String namespace, String name) {
        super(REASON, false, kind + " " + namespace + "/" + name + " exists and is not owned by this workload");
    }
}
