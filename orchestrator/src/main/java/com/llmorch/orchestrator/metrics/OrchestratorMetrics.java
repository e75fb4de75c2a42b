package com.llmorch.orchestrator.metrics;

import com.llmorch.core.crd.WorkloadPhase;
import com.llmorch.core.metrics.MetricsNames;
import com.llmorch.core.metrics.MetricsTags;
import com.llmorch.core.model.NodeResourceInfo;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Orchestrator meters. Names come from {@link MetricsNames}.
 * <p>
 * Built with {@link #withPrometheus}, the meters are also exposed in the
 * Prometheus text format through {@link #scrape()}.
 * </p>
 */
public class OrchestratorMetrics {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorMetrics.class);

    private final MeterRegistry registry;
    // null unless built with withPrometheus
    private final PrometheusMeterRegistry prometheus;

    private final Timer reconcileDuration;
    private final DistributionSummary placementScore;
    private final Counter migrationSuggestions;
    private final Map<WorkloadPhase, AtomicLong> phaseCounts = new EnumMap<>(WorkloadPhase.class);
    private final MultiGauge nodeUtilization;
    private final AtomicInteger leader = new AtomicInteger();

    public OrchestratorMetrics(MeterRegistry registry) {
        this(registry, null);
    }

    private OrchestratorMetrics(MeterRegistry registry, PrometheusMeterRegistry prometheus) {
        this.registry = registry;
        this.prometheus = prometheus;

        this.reconcileDuration = Timer.builder(MetricsNames.RECONCILE_DURATION)
                .description("Wall time of one reconcile pass")
                .publishPercentileHistogram()
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(60))
                .register(registry);

        this.placementScore = DistributionSummary.builder(MetricsNames.PLACEMENT_SCORE)
                .description("Final score of the selected node")
                .serviceLevelObjectives(25, 50, 60, 70, 80, 90, 100)
                .register(registry);

        this.migrationSuggestions = Counter.builder(MetricsNames.MIGRATION_SUGGESTIONS)
                .description("Migration suggestions emitted by rebalancing")
                .register(registry);

        for (WorkloadPhase phase : WorkloadPhase.values()) {
            AtomicLong count = new AtomicLong();
            phaseCounts.put(phase, count);
            Gauge.builder(MetricsNames.WORKLOADS_BY_PHASE, count, AtomicLong::get)
                    .description("Known workloads per phase")
                    .tag(MetricsTags.PHASE, phase.getValue())
                    .register(registry);
        }

        this.nodeUtilization = MultiGauge.builder(MetricsNames.NODE_UTILIZATION_RATIO)
                .description("Used over allocatable per node and dimension")
                .register(registry);

        Gauge.builder(MetricsNames.LEADER_STATUS, leader, AtomicInteger::get)
                .description("1 when this instance holds the leader lease")
                .register(registry);
    }

    /**
     * Adds a Prometheus registry to {@code composite} and tags every meter with
     * the instance id. Passing the global registry also exposes the reactor-netty
     * server and client meters.
     */
    public static OrchestratorMetrics withPrometheus(CompositeMeterRegistry composite, String instanceId) {
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        composite.add(prometheus);
        composite.config().commonTags(MetricsTags.INSTANCE_ID, instanceId);
        log.info("Orchestrator metrics initialized for {} with Prometheus registry", instanceId);
        return new OrchestratorMetrics(composite, prometheus);
    }

    /**
     * @return Prometheus text exposition of every meter
     * @throws IllegalStateException when no Prometheus registry is attached
     */
    public String scrape() {
        if (prometheus == null) {
            throw new IllegalStateException("No Prometheus registry attached");
        }
        return prometheus.scrape();
    }

    public void recordReconcile(Duration elapsed, String result) {
        reconcileDuration.record(elapsed);
        Counter.builder(MetricsNames.RECONCILES)
                .description("Completed reconcile passes")
                .tag(MetricsTags.RESULT, result)
                .register(registry)
                .increment();
    }

    public void recordReconcileFailure(String reason) {
        Counter.builder(MetricsNames.RECONCILE_FAILURES)
                .description("Reconcile failures by reason")
                .tag(MetricsTags.REASON, reason)
                .register(registry)
                .increment();
    }

    /**
     * @param action {@code allocate} or {@code release}
     */
    public void recordAllocation(String action) {
        Counter.builder(MetricsNames.ALLOCATIONS)
                .description("Allocations recorded in the capacity cache")
                .tag(MetricsTags.ACTION, action)
                .register(registry)
                .increment();
    }

    public void recordPlacementScore(double score) {
        placementScore.record(score);
    }

    public void recordMigrationSuggestions(int count) {
        migrationSuggestions.increment(count);
    }

    public void recordScalingDecision(String action) {
        Counter.builder(MetricsNames.SCALING_DECISIONS)
                .tag(MetricsTags.ACTION, action)
                .register(registry)
                .increment();
    }

    public void recordCacheRefresh(boolean success) {
        Counter.builder(MetricsNames.CACHE_REFRESHES)
                .tag(MetricsTags.RESULT, success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void updatePhaseCounts(Map<WorkloadPhase, Long> counts) {
        phaseCounts.forEach((phase, gauge) -> gauge.set(counts.getOrDefault(phase, 0L)));
    }

    public void updateNodeUtilization(Collection<NodeResourceInfo> nodes) {
        List<MultiGauge.Row<?>> rows = new ArrayList<>();
        for (NodeResourceInfo node : nodes) {
            rows.add(MultiGauge.Row.of(Tags.of(MetricsTags.NODE, node.getName(), MetricsTags.DIMENSION, "cpu"),
                    node.getUtilization().getCpu()));
            rows.add(MultiGauge.Row.of(Tags.of(MetricsTags.NODE, node.getName(), MetricsTags.DIMENSION, "memory"),
                    node.getUtilization().getMemory()));
            rows.add(MultiGauge.Row.of(Tags.of(MetricsTags.NODE, node.getName(), MetricsTags.DIMENSION, "gpu"),
                    node.getUtilization().getGpu()));
        }
        nodeUtilization.register(rows, true);
    }

    public void setLeader(boolean isLeader) {
        leader.set(isLeader ? 1 : 0);
    }

    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder(MetricsNames.RECONCILE_QUEUE_DEPTH, depth)
                .description("Reconciles queued or running")
                .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
