package com.llmorch.orchestrator.error;

public class ModelNotFoundException extends OrchestratorException {
    public static final String REASON = "ModelNotFound";

    public ModelNotFoundException(String modelName, String version) {
        super(REASON, false, "Model " + modelName + ":" + version + " not found in registry");
    }
}
