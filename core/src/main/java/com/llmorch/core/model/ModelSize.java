package com.llmorch.core.model;

import java.util.Optional;

/**
 * Model size classes with their CPU, memory and GPU multipliers.
 * The GPU factor stops at 2.0 for {@code xlarge}.
 */
public enum ModelSize {
    SMALL("small", 0.5, 0.5, 0.5),
    MEDIUM("medium", 1.0, 1.0, 1.0),
    LARGE("large", 2.0, 2.0, 1.5),
    XLARGE("xlarge", 4.0, 4.0, 2.0);

    private final String label;
    private final double cpuFactor;
    private final double memoryFactor;
    private final double gpuFactor;

    ModelSize(String label, double cpuFactor, double memoryFactor, double gpuFactor) {
        this.label = label;
        this.cpuFactor = cpuFactor;
        this.memoryFactor = memoryFactor;
        this.gpuFactor = gpuFactor;
    }

    public String label() {
        return label;
    }

    public double cpuFactor() {
        return cpuFactor;
    }

    public double memoryFactor() {
        return memoryFactor;
    }

    public double gpuFactor() {
        return gpuFactor;
    }

    public static Optional<ModelSize> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (ModelSize size : values()) {
            if (size.label.equalsIgnoreCase(label.trim())) {
                return Optional.of(size);
            }
        }
        return Optional.empty();
    }
}
