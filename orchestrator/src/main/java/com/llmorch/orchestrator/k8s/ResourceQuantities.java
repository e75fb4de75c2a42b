package com.llmorch.orchestrator.k8s;

import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.util.Quantities;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts platform resource maps ({@code cpu}, {@code memory},
 * {@code nvidia.com/gpu}, {@code ephemeral-storage}) to {@link ResourceCapacity}.
 */
public final class ResourceQuantities {
    private ResourceQuantities() {
    }

    public static ResourceCapacity fromResourceMap(Map<String, Quantity> resources) {
        if (resources == null || resources.isEmpty()) {
            return ResourceCapacity.ZERO;
        }
        return new ResourceCapacity(
                amount(resources.get("cpu")).movePointRight(3).longValue(),
                amount(resources.get("memory")).longValue(),
                amount(resources.get(WorkloadLabels.GPU_RESOURCE)).intValue(),
                amount(resources.get("ephemeral-storage")).longValue());
    }

    /**
     * Inverse of {@link #fromResourceMap}. GPU and storage are only present when non-zero.
     */
    public static Map<String, Quantity> toResourceMap(ResourceCapacity capacity) {
        Map<String, Quantity> resources = new LinkedHashMap<>();
        resources.put("cpu", new Quantity(Quantities.formatCpu(capacity.getCpuMillis())));
        resources.put("memory", new Quantity(Quantities.formatBytes(capacity.getMemoryBytes())));
        if (capacity.getGpu() > 0) {
            resources.put(WorkloadLabels.GPU_RESOURCE, new Quantity(String.valueOf(capacity.getGpu())));
        }
        if (capacity.getStorageBytes() > 0) {
            resources.put("ephemeral-storage", new Quantity(Quantities.formatBytes(capacity.getStorageBytes())));
        }
        return resources;
    }

    /**
     * Sum of the container requests of a pod.
     */
    public static ResourceCapacity podRequests(Pod pod) {
        ResourceCapacity total = ResourceCapacity.ZERO;
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return total;
        }
        for (Container container : pod.getSpec().getContainers()) {
            if (container.getResources() != null) {
                total = total.plus(fromResourceMap(container.getResources().getRequests()));
            }
        }
        return total;
    }

    private static BigDecimal amount(Quantity quantity) {
        return quantity == null ? BigDecimal.ZERO : quantity.getNumericalAmount();
    }
}
