package com.llmorch.orchestrator.metrics;

import com.llmorch.core.crd.TargetMetric;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Observed load of one workload. A null field means the source could not measure it.
 * <p>
 * CPU and memory are utilisation ratios of the summed replica requests;
 * rps and queue length are per-replica averages; latency is p95 in milliseconds.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class WorkloadMetrics {
    public static final WorkloadMetrics EMPTY = WorkloadMetrics.builder().build();

    Double cpuUtilization;
    Double memoryUtilization;
    Double requestsPerSecond;
    Double queueLength;
    Double latencyMs;

    public Optional<Double> get(String metricType) {
        return Optional.ofNullable(asMap().get(metricType));
    }

    /**
     * @return measured values keyed by target-metric type
     */
    public Map<String, Double> asMap() {
        Map<String, Double> values = new TreeMap<>();
        putIfPresent(values, TargetMetric.CPU, cpuUtilization);
        putIfPresent(values, TargetMetric.MEMORY, memoryUtilization);
        putIfPresent(values, TargetMetric.RPS, requestsPerSecond);
        putIfPresent(values, TargetMetric.QUEUE_LENGTH, queueLength);
        putIfPresent(values, TargetMetric.LATENCY, latencyMs);
        return values;
    }

    /**
     * Fills the gaps of this instance with values from {@code other}.
     */
    public WorkloadMetrics orElse(WorkloadMetrics other) {
        return new WorkloadMetrics(
                cpuUtilization != null ? cpuUtilization : other.cpuUtilization,
                memoryUtilization != null ? memoryUtilization : other.memoryUtilization,
                requestsPerSecond != null ? requestsPerSecond : other.requestsPerSecond,
                queueLength != null ? queueLength : other.queueLength,
                latencyMs != null ? latencyMs : other.latencyMs);
    }

    private static void putIfPresent(Map<String, Double> values, String key, Double value) {
        if (value != null && !value.isNaN()) {
            values.put(key, value);
        }
    }
}
