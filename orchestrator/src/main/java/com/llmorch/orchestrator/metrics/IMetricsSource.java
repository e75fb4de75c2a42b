package com.llmorch.orchestrator.metrics;

import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.error.PlatformTransientException;

import java.util.Map;

/**
 * Source of observed node and workload load.
 */
public interface IMetricsSource {

    /**
     * @return actual usage by node name; empty when this source does not measure nodes
     * @throws PlatformTransientException when the source is unavailable
     */
    Map<String, ResourceCapacity> nodeUsage();

    /**
     * @param key               workload
     * @param perReplicaRequest requested envelope of one replica, used to turn usage into ratios
     * @return what could be measured; never null
     */
    WorkloadMetrics workloadMetrics(WorkloadKey key, ResourceCapacity perReplicaRequest);
}
