package com.llmorch.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Sized resource envelope of one workload replica.
 */
@Value
@Builder(toBuilder = true)
public class ResourceRequirements {
    ResourceCapacity requested;
    ResourceCapacity limits;
    QualityClass qualityClass;
}
