package com.llmorch.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node name.
     */
    public static final String NODE = "node";

    /**
     * Tag key for resource dimension (cpu/memory/gpu).
     */
    public static final String DIMENSION = "dimension";

    /**
     * Tag key for failure reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for reconcile outcome.
     */
    public static final String RESULT = "result";

    public static final String PHASE = "phase";

    /**
     * Common tag identifying the orchestrator replica.
     */
    public static final String INSTANCE_ID = "instance_id";

    /**
     * Tag key for scaling action.
     */
    public static final String ACTION = "action";
}
