package com.llmorch.core.metrics;

/**
 * Micrometer metric names used across the orchestrator.
 * <p>
 * <b>Naming convention:</b> dotted Micrometer names; the Prometheus registry
 * renders them with underscores and unit suffixes ({@code reconciles} becomes
 * {@code reconciles_total}, the {@code reconcile.duration} timer becomes
 * {@code reconcile_duration_seconds}).
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Completed reconcile passes.
     * <p>
     * Tags: result (success/requeue/failed/cancelled)
     * </p>
     */
    public static final String RECONCILES = "reconciles";

    /**
     * Counter: Reconcile failures.
     * <p>
     * Tags: reason (InvalidSpec/ModelNotFound/Unschedulable/PlatformTransient/OwnedByOther/Internal/...)
     * </p>
     */
    public static final String RECONCILE_FAILURES = "reconcile.failures";

    /**
     * Timer with histogram buckets: Wall time of one reconcile pass.
     */
    public static final String RECONCILE_DURATION = "reconcile.duration";

    /**
     * Counter: Allocations recorded in the capacity cache.
     */
    public static final String ALLOCATIONS = "allocations";

    /**
     * Distribution Summary with histogram buckets: Final score of the selected node.
     */
    public static final String PLACEMENT_SCORE = "placement.score";

    /**
     * Gauge: Number of known workloads per phase.
     * <p>
     * Tags: phase
     * </p>
     */
    public static final String WORKLOADS_BY_PHASE = "workloads.by.phase";

    /**
     * Gauge: Node utilisation ratio.
     * <p>
     * Tags: node, dimension (cpu/memory/gpu)
     * </p>
     */
    public static final String NODE_UTILIZATION_RATIO = "node.utilization.ratio";

    /**
     * Counter: Migration suggestions emitted by the rebalancing loop.
     */
    public static final String MIGRATION_SUGGESTIONS = "migration.suggestions";

    /**
     * Counter: Replica scaling decisions.
     * <p>
     * Tags: action (scale_out/scale_in/none)
     * </p>
     */
    public static final String SCALING_DECISIONS = "scaling.decisions";

    /**
     * Gauge: 1 when this instance holds the leader lease.
     */
    public static final String LEADER_STATUS = "leader.status";

    /**
     * Counter: Capacity cache refreshes.
     * <p>
     * Tags: result (success/failure)
     * </p>
     */
    public static final String CACHE_REFRESHES = "capacity.cache.refreshes";

    /**
     * Gauge: Reconciles currently queued or running.
     */
    public static final String RECONCILE_QUEUE_DEPTH = "reconcile.queue.depth";
}
