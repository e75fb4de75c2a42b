package com.llmorch.orchestrator.capacity;

import com.llmorch.core.model.NodePerformanceMetrics;
import com.llmorch.core.model.NodeTaint;
import com.llmorch.core.model.ResourceCapacity;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Platform-reported state of one node, as held inside the cache.
 * Usage from orchestrator allocations is kept separately and added on snapshot.
 */
@Value
@Builder
class NodeState {
    String name;
    Map<String, String> labels;
    List<NodeTaint> taints;
    boolean ready;
    boolean unschedulable;
    ResourceCapacity capacity;
    ResourceCapacity allocatable;

    /**
     * Usage not attributable to orchestrator allocations.
     */
    ResourceCapacity externalUsed;
    NodePerformanceMetrics performance;
}
