package com.llmorch.orchestrator.placement;

import com.llmorch.core.crd.PlacementSpec;
import com.llmorch.core.model.QualityClass;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import lombok.Builder;
import lombok.Value;

/**
 * What the placement engine needs to know about one workload.
 */
@Value
@Builder
public class PlacementRequest {
    WorkloadKey workload;
    String modelName;
    ResourceCapacity requested;
    QualityClass qualityClass;

    /**
     * Hard constraints and soft preferences; may be null.
     */
    PlacementSpec placement;

    boolean localityPreference;
}
