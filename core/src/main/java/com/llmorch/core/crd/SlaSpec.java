package com.llmorch.core.crd;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Performance SLA of a workload. Latencies are milliseconds, availability is
 * a percentage (99.9), error rate is a fraction (0.01).
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SlaSpec {
    private Double maxLatencyMs;
    private Double minThroughput;
    private Integer concurrentUsers;
    private Double p95ResponseTimeMs;
    private Double p99ResponseTimeMs;
    private Double maxErrorRate;
    private Double availability;
}
