package com.llmorch.orchestrator.metrics;

import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;

import java.util.List;
import java.util.Map;

/**
 * Combines sources: node usage from the first source that reports any, workload
 * metrics merged field by field with earlier sources taking precedence.
 */
public class CompositeMetricsSource implements IMetricsSource {
    private final List<IMetricsSource> sources;

    public CompositeMetricsSource(List<IMetricsSource> sources) {
        this.sources = List.copyOf(sources);
    }

    @Override
    public Map<String, ResourceCapacity> nodeUsage() {
        for (IMetricsSource source : sources) {
            Map<String, ResourceCapacity> usage = source.nodeUsage();
            if (!usage.isEmpty()) {
                return usage;
            }
        }
        return Map.of();
    }

    @Override
    public WorkloadMetrics workloadMetrics(WorkloadKey key, ResourceCapacity perReplicaRequest) {
        WorkloadMetrics merged = WorkloadMetrics.EMPTY;
        for (IMetricsSource source : sources) {
            merged = merged.orElse(source.workloadMetrics(key, perReplicaRequest));
        }
        return merged;
    }
}
