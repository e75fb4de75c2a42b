package com.llmorch.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A placement decision: workload W runs on node N with the given envelope.
 * <p>
 * Emitted by the resource manager, recorded in the capacity cache and
 * consumed by the reconciler. A workload holds at most one live allocation;
 * every replica shares it.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ResourceAllocation {
    String workloadName;
    String namespace;
    String nodeName;

    /**
     * Model the workload serves; used for model-locality scoring.
     */
    String modelName;

    ResourceCapacity envelope;
    QualityClass qosClass;
    Instant allocatedAt;

    public WorkloadKey key() {
        return WorkloadKey.of(namespace, workloadName);
    }
}
