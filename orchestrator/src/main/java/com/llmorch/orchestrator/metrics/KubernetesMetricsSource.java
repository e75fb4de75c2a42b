package com.llmorch.orchestrator.metrics;

import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.error.PlatformTransientException;
import com.llmorch.orchestrator.k8s.ResourceQuantities;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.ContainerMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.NodeMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads node and pod usage from the metrics API ({@code metrics.k8s.io}).
 */
public class KubernetesMetricsSource implements IMetricsSource {
    private static final Logger log = LoggerFactory.getLogger(KubernetesMetricsSource.class);

    private final KubernetesClient client;
    private final Duration timeout;

    public KubernetesMetricsSource(KubernetesClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
        log.info("Kubernetes metrics source initialized (timeout={})", timeout);
    }

    @Override
    public Map<String, ResourceCapacity> nodeUsage() {
        List<NodeMetrics> items = Mono.fromCallable(() -> client.top().nodes().metrics().getItems())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorMap(e -> new PlatformTransientException("Node metrics unavailable: " + e.getMessage(), e))
                .block();

        Map<String, ResourceCapacity> usage = new HashMap<>();
        if (items != null) {
            for (NodeMetrics metrics : items) {
                usage.put(metrics.getMetadata().getName(), ResourceQuantities.fromResourceMap(metrics.getUsage()));
            }
        }
        log.debug("Fetched usage for {} nodes", usage.size());
        return usage;
    }

    @Override
    public WorkloadMetrics workloadMetrics(WorkloadKey key, ResourceCapacity perReplicaRequest) {
        List<PodMetrics> pods = Mono.fromCallable(() -> client.top().pods()
                        .inNamespace(key.namespace())
                        .withLabels(Map.of(WorkloadLabels.WORKLOAD, key.name()))
                        .metrics()
                        .getItems())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .doOnError(e -> log.warn("Pod metrics for {} unavailable: {}", key, e.getMessage()))
                .onErrorReturn(List.of())
                .block();
        if (pods == null || pods.isEmpty()) {
            return WorkloadMetrics.EMPTY;
        }

        ResourceCapacity total = ResourceCapacity.ZERO;
        for (PodMetrics pod : pods) {
            for (ContainerMetrics container : pod.getContainers()) {
                total = total.plus(ResourceQuantities.fromResourceMap(container.getUsage()));
            }
        }
        long replicas = pods.size();
        return WorkloadMetrics.builder()
                .cpuUtilization(ratio(total.getCpuMillis(), perReplicaRequest.getCpuMillis() * replicas))
                .memoryUtilization(ratio(total.getMemoryBytes(), perReplicaRequest.getMemoryBytes() * replicas))
                .build();
    }

    private static Double ratio(long used, long requested) {
        return requested <= 0 ? null : (double) used / requested;
    }
}
