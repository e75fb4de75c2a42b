package com.llmorch.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Static and sampled performance characteristics of a node.
 */
@Value
@Builder(toBuilder = true)
public class NodePerformanceMetrics {
    public static final NodePerformanceMetrics UNKNOWN = NodePerformanceMetrics.builder().build();

    String instanceType;
    boolean ssd;
    double cpuFrequencyGhz;
    double memoryBandwidthGbps;
    double networkBandwidthGbps;
    long storageIops;
    double temperatureCelsius;
}
