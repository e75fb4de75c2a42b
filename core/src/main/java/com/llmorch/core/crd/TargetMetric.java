package com.llmorch.core.crd;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * One scaling target. For {@code cpu} and {@code memory} the target is a
 * utilisation ratio of the requests (0.7 = 70%); for {@code rps},
 * {@code queue_length} and {@code latency} it is the per-replica value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TargetMetric {
    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";
    public static final String RPS = "rps";
    public static final String QUEUE_LENGTH = "queue_length";
    public static final String LATENCY = "latency";

    public static final Set<String> TYPES = Set.of(CPU, MEMORY, RPS, QUEUE_LENGTH, LATENCY);

    private String type;
    private Double target;
}
