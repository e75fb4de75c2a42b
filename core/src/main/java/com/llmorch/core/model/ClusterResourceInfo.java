package com.llmorch.core.model;

import lombok.Value;

import java.time.Instant;
import java.util.Collection;

/**
 * Cluster-wide roll-up of every {@link NodeResourceInfo}.
 */
@Value
public class ClusterResourceInfo {
    ResourceCapacity totalCapacity;
    ResourceCapacity totalAllocatable;
    ResourceCapacity totalUsed;
    ResourceCapacity totalAvailable;
    ResourceUtilization utilization;
    int nodeCount;
    int workloadCount;
    Instant lastUpdated;

    public static ClusterResourceInfo rollUp(Collection<NodeResourceInfo> nodes, Instant now) {
        ResourceCapacity capacity = ResourceCapacity.ZERO;
        ResourceCapacity allocatable = ResourceCapacity.ZERO;
        ResourceCapacity used = ResourceCapacity.ZERO;
        int workloads = 0;
        for (NodeResourceInfo node : nodes) {
            capacity = capacity.plus(node.getCapacity());
            allocatable = allocatable.plus(node.getAllocatable());
            used = used.plus(node.getUsed());
            workloads += node.getWorkloadCount();
        }
        return new ClusterResourceInfo(
                capacity,
                allocatable,
                used,
                allocatable.minus(used),
                ResourceUtilization.of(used, allocatable),
                nodes.size(),
                workloads,
                now);
    }
}
