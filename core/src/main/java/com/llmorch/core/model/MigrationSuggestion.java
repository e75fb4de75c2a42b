package com.llmorch.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Recommendation from the rebalancing loop to move a workload off an
 * overutilised node. Never executed automatically.
 */
@Value
@Builder
public class MigrationSuggestion {
    String namespace;
    String workloadName;
    String fromNode;
    String toNode;
    ResourceCapacity envelope;
    String reason;
    Instant suggestedAt;
}
