package com.llmorch.orchestrator.reconcile;

import com.llmorch.core.model.ResourceRequirements;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs resolved during a reconcile that shape the desired child objects.
 */
@Value
@Builder
public class WorkloadPlan {
    String image;

    /**
     * Version the registry resolved, never {@code latest}.
     */
    String modelVersion;

    ResourceRequirements requirements;
    String nodeName;
    int replicas;
}
