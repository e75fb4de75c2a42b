package com.llmorch.orchestrator.metrics;

import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Traffic metrics (rps, latency, queue length) from Prometheus. Does not measure nodes.
 */
public class PrometheusMetricsSource implements IMetricsSource {
    private final PrometheusQueryService queryService;
    private final Duration timeout;

    public PrometheusMetricsSource(PrometheusQueryService queryService, Duration timeout) {
        this.queryService = queryService;
        this.timeout = timeout;
    }

    @Override
    public Map<String, ResourceCapacity> nodeUsage() {
        return Map.of();
    }

    @Override
    public WorkloadMetrics workloadMetrics(WorkloadKey key, ResourceCapacity perReplicaRequest) {
        Mono<Optional<Double>> rps = queryService.getRequestsPerReplica(key.namespace(), key.name())
                .map(Optional::of).defaultIfEmpty(Optional.empty());
        Mono<Optional<Double>> latency = queryService.getP95LatencyMs(key.namespace(), key.name())
                .map(Optional::of).defaultIfEmpty(Optional.empty());
        Mono<Optional<Double>> queue = queryService.getQueueLengthPerReplica(key.namespace(), key.name())
                .map(Optional::of).defaultIfEmpty(Optional.empty());

        return Mono.zip(rps, latency, queue)
                .map(t -> WorkloadMetrics.builder()
                        .requestsPerSecond(t.getT1().orElse(null))
                        .latencyMs(t.getT2().orElse(null))
                        .queueLength(t.getT3().orElse(null))
                        .build())
                .timeout(timeout)
                .onErrorReturn(WorkloadMetrics.EMPTY)
                .blockOptional()
                .orElse(WorkloadMetrics.EMPTY);
    }
}
