package com.llmorch.core.model;

import lombok.Value;

/**
 * Utilisation ratios (0.0 - 1.0) of used against allocatable, per dimension.
 */
@Value
public class ResourceUtilization {
    public static final ResourceUtilization IDLE = new ResourceUtilization(0, 0, 0, 0);

    double cpu;
    double memory;
    double gpu;
    double storage;

    public static ResourceUtilization of(ResourceCapacity used, ResourceCapacity allocatable) {
        return new ResourceUtilization(
                ratio(used.getCpuMillis(), allocatable.getCpuMillis()),
                ratio(used.getMemoryBytes(), allocatable.getMemoryBytes()),
                ratio(used.getGpu(), allocatable.getGpu()),
                ratio(used.getStorageBytes(), allocatable.getStorageBytes()));
    }

    /**
     * @return mean of CPU and memory utilisation
     */
    public double cpuMemoryAverage() {
        return (cpu + memory) / 2.0;
    }

    private static double ratio(double used, double total) {
        return total <= 0 ? 0.0 : used / total;
    }
}
