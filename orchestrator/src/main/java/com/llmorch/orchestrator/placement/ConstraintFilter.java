package com.llmorch.orchestrator.placement;

import com.llmorch.core.crd.PlacementSpec;
import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.NodeTaint;
import com.llmorch.core.model.ResourceCapacity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hard constraints applied before scoring. A node failing any of them is
 * dropped with the first failing reason.
 */
public class ConstraintFilter {

    /**
     * @return why the node is excluded, or empty when it passes every constraint
     */
    public Optional<String> rejectionReason(NodeResourceInfo node, PlacementRequest request) {
        if (!node.isReady()) {
            return Optional.of("node not ready");
        }
        if (node.isUnschedulable()) {
            return Optional.of("node cordoned");
        }

        PlacementSpec placement = request.getPlacement();
        Map<String, String> labels = node.getLabels();

        if (placement != null && placement.getNodeSelector() != null) {
            for (Map.Entry<String, String> selector : placement.getNodeSelector().entrySet()) {
                if (!selector.getValue().equals(labels.get(selector.getKey()))) {
                    return Optional.of("nodeSelector " + selector.getKey() + "=" + selector.getValue() + " not matched");
                }
            }
        }

        if (placement != null && placement.getAntiAffinity() != null) {
            for (PlacementSpec.LabelTerm term : placement.getAntiAffinity()) {
                if (term.getKey() == null || !labels.containsKey(term.getKey())) {
                    continue;
                }
                if (term.getValue() == null || term.getValue().equals(labels.get(term.getKey()))) {
                    return Optional.of("anti-affinity " + term.getKey()
                            + (term.getValue() == null ? "" : "=" + term.getValue()));
                }
            }
        }

        List<String> tolerations = placement != null && placement.getTolerations() != null
                ? placement.getTolerations() : List.of();
        for (NodeTaint taint : node.getTaints()) {
            if (!taint.blocksScheduling()) {
                continue;
            }
            boolean gpuTaint = WorkloadLabels.GPU_RESOURCE.equals(taint.key()) && request.getRequested().getGpu() > 0;
            if (!gpuTaint && !tolerations.contains(taint.key())) {
                return Optional.of("untolerated taint " + taint.key() + ":" + taint.effect());
            }
        }

        if (placement != null && placement.getMaxNodeUtilization() != null) {
            double max = placement.getMaxNodeUtilization();
            ResourceCapacity projected = node.getUsed().plus(request.getRequested());
            ResourceCapacity allocatable = node.getAllocatable();
            if (ratio(projected.getCpuMillis(), allocatable.getCpuMillis()) > max
                    || ratio(projected.getMemoryBytes(), allocatable.getMemoryBytes()) > max) {
                return Optional.of("would exceed maxNodeUtilization " + max);
            }
        }
        return Optional.empty();
    }

    private static double ratio(double used, double total) {
        return total <= 0 ? Double.POSITIVE_INFINITY : used / total;
    }
}
