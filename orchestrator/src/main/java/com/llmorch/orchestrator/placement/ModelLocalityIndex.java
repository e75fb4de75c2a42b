package com.llmorch.orchestrator.placement;

import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.orchestrator.capacity.CapacitySnapshot;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Which nodes and zones already serve a model. A node "has the model cached"
 * when it hosts a live allocation for the same model name.
 */
public class ModelLocalityIndex {
    public static final ModelLocalityIndex EMPTY = new ModelLocalityIndex(Map.of(), Map.of());

    private final Map<String, Set<String>> nodesByModel;
    private final Map<String, Set<String>> zonesByModel;

    private ModelLocalityIndex(Map<String, Set<String>> nodesByModel, Map<String, Set<String>> zonesByModel) {
        this.nodesByModel = nodesByModel;
        this.zonesByModel = zonesByModel;
    }

    public static ModelLocalityIndex from(CapacitySnapshot snapshot) {
        return from(snapshot.getNodes(), snapshot.getAllocations().values());
    }

    public static ModelLocalityIndex from(Collection<NodeResourceInfo> nodes, Collection<ResourceAllocation> allocations) {
        Map<String, String> zoneByNode = new HashMap<>();
        for (NodeResourceInfo node : nodes) {
            if (node.zone() != null) {
                zoneByNode.put(node.getName(), node.zone());
            }
        }
        Map<String, Set<String>> nodesByModel = new HashMap<>();
        Map<String, Set<String>> zonesByModel = new HashMap<>();
        for (ResourceAllocation allocation : allocations) {
            if (allocation.getModelName() == null) {
                continue;
            }
            nodesByModel.computeIfAbsent(allocation.getModelName(), m -> new HashSet<>()).add(allocation.getNodeName());
            String zone = zoneByNode.get(allocation.getNodeName());
            if (zone != null) {
                zonesByModel.computeIfAbsent(allocation.getModelName(), m -> new HashSet<>()).add(zone);
            }
        }
        return new ModelLocalityIndex(nodesByModel, zonesByModel);
    }

    public boolean isCachedOn(String modelName, String nodeName) {
        return nodesByModel.getOrDefault(modelName, Set.of()).contains(nodeName);
    }

    public boolean isCachedInZone(String modelName, String zone) {
        return zone != null && zonesByModel.getOrDefault(modelName, Set.of()).contains(zone);
    }
}
