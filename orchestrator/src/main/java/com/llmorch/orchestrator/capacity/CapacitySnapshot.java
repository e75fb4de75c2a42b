package com.llmorch.orchestrator.capacity;

import com.llmorch.core.model.ClusterResourceInfo;
import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.core.model.WorkloadKey;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable point-in-time view of the capacity cache. Either reflects an
 * allocation entirely or not at all.
 */
@Value
public class CapacitySnapshot {
    /**
     * Nodes sorted by name.
     */
    List<NodeResourceInfo> nodes;
    ClusterResourceInfo cluster;
    Map<WorkloadKey, ResourceAllocation> allocations;
    Instant takenAt;

    public Optional<NodeResourceInfo> node(String name) {
        return nodes.stream().filter(n -> n.getName().equals(name)).findFirst();
    }

    public Optional<ResourceAllocation> allocation(WorkloadKey key) {
        return Optional.ofNullable(allocations.get(key));
    }

    public List<ResourceAllocation> allocationsOn(String nodeName) {
        return allocations.values().stream()
                .filter(a -> a.getNodeName().equals(nodeName))
                .collect(Collectors.toList());
    }
}
