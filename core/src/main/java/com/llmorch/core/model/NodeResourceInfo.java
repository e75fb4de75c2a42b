package com.llmorch.core.model;

import com.llmorch.core.crd.WorkloadLabels;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable per-node view handed out by the capacity cache.
 * <p>
 * {@code available} and {@code utilization} are derived from {@code used} and
 * {@code allocatable} at construction; use {@link #of} rather than the builder
 * when those inputs change.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class NodeResourceInfo {
    String name;

    @Singular
    Map<String, String> labels;

    @Singular
    List<NodeTaint> taints;

    boolean ready;
    boolean unschedulable;

    ResourceCapacity capacity;
    ResourceCapacity allocatable;
    ResourceCapacity used;
    ResourceCapacity available;
    ResourceUtilization utilization;

    int workloadCount;
    NodePerformanceMetrics performance;
    Instant lastUpdated;

    /**
     * Builds a node view, deriving {@code available = allocatable - used} and the
     * utilisation ratios.
     */
    public static NodeResourceInfo of(String name,
                                      Map<String, String> labels,
                                      List<NodeTaint> taints,
                                      boolean ready,
                                      boolean unschedulable,
                                      ResourceCapacity capacity,
                                      ResourceCapacity allocatable,
                                      ResourceCapacity used,
                                      int workloadCount,
                                      NodePerformanceMetrics performance,
                                      Instant lastUpdated) {
        return NodeResourceInfo.builder()
                .name(name)
                .labels(labels)
                .taints(taints)
                .ready(ready)
                .unschedulable(unschedulable)
                .capacity(capacity)
                .allocatable(allocatable)
                .used(used)
                .available(allocatable.minus(used))
                .utilization(ResourceUtilization.of(used, allocatable))
                .workloadCount(workloadCount)
                .performance(performance)
                .lastUpdated(lastUpdated)
                .build();
    }

    public String zone() {
        return labels.get(WorkloadLabels.ZONE);
    }

    /**
     * @return false for nodes that are not ready or are cordoned
     */
    public boolean isSchedulable() {
        return ready && !unschedulable;
    }
}
