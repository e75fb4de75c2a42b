package com.llmorch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;
import lombok.With;

/**
 * Value type for an amount of node resources.
 * <p>
 * CPU is held in millicores so that sums and differences of allocations are
 * exact; {@link #getCpu()} exposes fractional cores. Memory and storage are bytes.
 * </p>
 */
@Value
@With
public class ResourceCapacity {
    public static final ResourceCapacity ZERO = new ResourceCapacity(0, 0, 0, 0);

    long cpuMillis;
    long memoryBytes;
    int gpu;
    long storageBytes;

    public static ResourceCapacity of(double cpuCores, long memoryBytes, int gpu) {
        return new ResourceCapacity(Math.round(cpuCores * 1000), memoryBytes, gpu, 0);
    }

    public static ResourceCapacity of(double cpuCores, long memoryBytes, int gpu, long storageBytes) {
        return new ResourceCapacity(Math.round(cpuCores * 1000), memoryBytes, gpu, storageBytes);
    }

    /**
     * @return CPU in fractional cores
     */
    @JsonIgnore
    public double getCpu() {
        return cpuMillis / 1000.0;
    }

    public ResourceCapacity plus(ResourceCapacity other) {
        return new ResourceCapacity(
                cpuMillis + other.cpuMillis,
                memoryBytes + other.memoryBytes,
                gpu + other.gpu,
                storageBytes + other.storageBytes);
    }

    public ResourceCapacity minus(ResourceCapacity other) {
        return new ResourceCapacity(
                cpuMillis - other.cpuMillis,
                memoryBytes - other.memoryBytes,
                gpu - other.gpu,
                storageBytes - other.storageBytes);
    }

    /**
     * Component-wise minimum.
     */
    public ResourceCapacity min(ResourceCapacity other) {
        return new ResourceCapacity(
                Math.min(cpuMillis, other.cpuMillis),
                Math.min(memoryBytes, other.memoryBytes),
                Math.min(gpu, other.gpu),
                Math.min(storageBytes, other.storageBytes));
    }

    public ResourceCapacity clampAtZero() {
        return new ResourceCapacity(
                Math.max(0, cpuMillis),
                Math.max(0, memoryBytes),
                Math.max(0, gpu),
                Math.max(0, storageBytes));
    }

    /**
     * Whether {@code envelope} fits in this amount along CPU, memory and GPU.
     * Storage is not a placement dimension.
     */
    public boolean covers(ResourceCapacity envelope) {
        return cpuMillis >= envelope.cpuMillis
                && memoryBytes >= envelope.memoryBytes
                && gpu >= envelope.gpu;
    }

    /**
     * Whether every dimension, storage included, is at most the other's.
     */
    public boolean isWithin(ResourceCapacity other) {
        return cpuMillis <= other.cpuMillis
                && memoryBytes <= other.memoryBytes
                && gpu <= other.gpu
                && storageBytes <= other.storageBytes;
    }

    @Override
    public String toString() {
        return String.format("cpu=%dm memory=%d gpu=%d storage=%d", cpuMillis, memoryBytes, gpu, storageBytes);
    }
}
