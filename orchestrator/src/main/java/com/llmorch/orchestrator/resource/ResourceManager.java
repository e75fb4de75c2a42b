package com.llmorch.orchestrator.resource;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.crd.LlmWorkloadSpec;
import com.llmorch.core.crd.PlacementSpec;
import com.llmorch.core.model.MigrationSuggestion;
import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.NodeScore;
import com.llmorch.core.model.PlacementResult;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.ResourceRequirements;
import com.llmorch.core.model.ResourceUtilization;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.capacity.CapacityCache;
import com.llmorch.orchestrator.capacity.CapacitySnapshot;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.error.NoFeasibleNodeException;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import com.llmorch.orchestrator.placement.ModelLocalityIndex;
import com.llmorch.orchestrator.placement.PlacementEngine;
import com.llmorch.orchestrator.placement.PlacementRequest;
import com.llmorch.orchestrator.registry.ModelHints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Sizes workloads, picks a node for them and records the allocation in the
 * capacity cache. Also runs the rebalancing scan.
 * <p>
 * A workload holds at most one allocation. Re-allocating with an unchanged
 * envelope on a node that still passes every constraint returns the existing
 * allocation; otherwise the workload stays on its current node when that node
 * is still a candidate, and moves to the best-ranked node when it is not.
 * </p>
 */
public class ResourceManager {
    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private final ResourceSizer sizer;
    private final CapacityCache cache;
    private final PlacementEngine placement;
    private final OrchestratorMetrics metrics;
    private final OrchestratorConfig config;
    private final Clock clock;

    private final AtomicReference<List<MigrationSuggestion>> latestSuggestions = new AtomicReference<>(List.of());
    private Disposable rebalanceTask;

    public ResourceManager(ResourceSizer sizer,
                           CapacityCache cache,
                           PlacementEngine placement,
                           OrchestratorMetrics metrics,
                           OrchestratorConfig config,
                           Clock clock) {
        this.sizer = sizer;
        this.cache = cache;
        this.placement = placement;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;

        log.info("Resource manager initialized (utilization target {}, scale-up {}, scale-down {})",
                config.getUtilizationTarget(), config.getScaleUpThreshold(), config.getScaleDownThreshold());
    }

    /**
     * Starts the periodic rebalancing scan.
     */
    public void start() {
        rebalanceTask = Flux.interval(config.getRebalanceInterval(), config.getRebalanceInterval())
                .onBackpressureDrop()
                .concatMap(tick -> Mono.fromRunnable(this::rebalance)
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            log.warn("✗ Rebalancing scan failed: {}", e.getMessage());
                            return Mono.empty();
                        }))
                .subscribe();
    }

    public void stop() {
        if (rebalanceTask != null) {
            rebalanceTask.dispose();
        }
        log.info("Resource manager stopped");
    }

    public ResourceRequirements size(LlmWorkloadSpec spec, ModelHints hints) {
        return sizer.size(spec, hints);
    }

    /**
     * Places the workload and records its allocation.
     *
     * @throws NoFeasibleNodeException when no node has room, with the reason per node
     */
    public ResourceAllocation allocate(LlmWorkload workload, ResourceRequirements requirements) {
        WorkloadKey key = workload.key();
        LlmWorkloadSpec spec = workload.getSpec();
        ResourceCapacity requested = requirements.getRequested();
        PlacementRequest request = PlacementRequest.builder()
                .workload(key)
                .modelName(spec.getModelName())
                .requested(requested)
                .qualityClass(requirements.getQualityClass())
                .placement(spec.getPlacement())
                .localityPreference(localityPreference(spec.getPlacement()))
                .build();

        CapacitySnapshot snapshot = cache.snapshot();
        Optional<ResourceAllocation> current = snapshot.allocation(key);

        Map<String, String> rejections = new TreeMap<>();
        List<NodeResourceInfo> feasible = new ArrayList<>();
        for (NodeResourceInfo node : snapshot.getNodes()) {
            NodeResourceInfo view = current
                    .filter(a -> a.getNodeName().equals(node.getName()))
                    .map(a -> creditBack(node, a.getEnvelope()))
                    .orElse(node);
            Optional<String> reason = infeasibility(view, requested);
            if (reason.isPresent()) {
                rejections.put(node.getName(), reason.get());
            } else {
                feasible.add(view);
            }
        }

        // The locality index must not count the workload itself
        List<ResourceAllocation> others = snapshot.getAllocations().values().stream()
                .filter(a -> !a.key().equals(key))
                .collect(Collectors.toList());
        PlacementResult result = placement.score(request, feasible, ModelLocalityIndex.from(snapshot.getNodes(), others));
        rejections.putAll(result.getRejected());

        if (result.getRanking().isEmpty()) {
            throw new NoFeasibleNodeException("No feasible node for " + key + " (" + requested + ")", rejections);
        }

        if (current.isPresent()
                && current.get().getEnvelope().equals(requested)
                && current.get().getQosClass() == requirements.getQualityClass()
                && isRanked(result, current.get().getNodeName())) {
            return current.get();
        }

        String stickyNode = current.map(ResourceAllocation::getNodeName)
                .orElseGet(() -> workload.getStatus() != null ? workload.getStatus().getNodeName() : null);
        NodeScore selected = result.getRanking().stream()
                .filter(s -> s.getNodeName().equals(stickyNode))
                .findFirst()
                .orElse(result.getRanking().get(0));

        ResourceAllocation allocation = cache.applyAllocation(ResourceAllocation.builder()
                .workloadName(key.name())
                .namespace(key.namespace())
                .nodeName(selected.getNodeName())
                .modelName(spec.getModelName())
                .envelope(requested)
                .qosClass(requirements.getQualityClass())
                .allocatedAt(clock.instant())
                .build());

        metrics.recordAllocation("allocate");
        metrics.recordPlacementScore(selected.getScore());
        log.info("✓ Allocated {} on {} (score {}, {})", key, selected.getNodeName(),
                String.format("%.2f", selected.getScore()), requested);
        return allocation;
    }

    /**
     * Releases the workload's allocation, if any.
     */
    public Optional<ResourceAllocation> release(WorkloadKey key) {
        Optional<ResourceAllocation> released = cache.releaseAllocation(key);
        released.ifPresent(a -> {
            metrics.recordAllocation("release");
            log.info("Released allocation of {} on {}", key, a.getNodeName());
        });
        return released;
    }

    /**
     * Scans for overutilised nodes and suggests moving their workloads to
     * underutilised nodes. Suggestions are only reported, never executed.
     * <p>
     * Each suggestion is applied to a projected copy of the node usage so that
     * one scan does not move more than is needed to bring a node back under the
     * scale-up threshold, and does not overload a target.
     * </p>
     */
    public List<MigrationSuggestion> rebalance() {
        CapacitySnapshot snapshot = cache.snapshot();
        double up = config.getScaleUpThreshold();
        double down = config.getScaleDownThreshold();
        Instant now = clock.instant();

        Map<String, ResourceCapacity> projectedUsed = new TreeMap<>();
        Map<String, NodeResourceInfo> byName = new TreeMap<>();
        for (NodeResourceInfo node : snapshot.getNodes()) {
            projectedUsed.put(node.getName(), node.getUsed());
            byName.put(node.getName(), node);
        }

        List<NodeResourceInfo> overutilised = snapshot.getNodes().stream()
                .filter(n -> isOverutilised(n.getUtilization(), up))
                .collect(Collectors.toList());
        List<String> underutilised = snapshot.getNodes().stream()
                .filter(NodeResourceInfo::isSchedulable)
                .filter(n -> n.getUtilization().cpuMemoryAverage() < down)
                .map(NodeResourceInfo::getName)
                .collect(Collectors.toList());

        List<MigrationSuggestion> suggestions = new ArrayList<>();
        if (!overutilised.isEmpty() && !underutilised.isEmpty()) {
            for (NodeResourceInfo source : overutilised) {
                for (ResourceAllocation allocation : snapshot.allocationsOn(source.getName())) {
                    if (!isOverutilised(utilization(source, projectedUsed), up)) {
                        break;
                    }
                    Optional<String> target = underutilised.stream()
                            .sorted(Comparator.comparingDouble((String n) ->
                                            utilization(byName.get(n), projectedUsed).cpuMemoryAverage())
                                    .thenComparing(Comparator.naturalOrder()))
                            .filter(n -> fitsWithinThreshold(byName.get(n), projectedUsed, allocation.getEnvelope(), up))
                            .findFirst();
                    if (target.isEmpty()) {
                        continue;
                    }
                    String to = target.get();
                    projectedUsed.merge(source.getName(), allocation.getEnvelope(), ResourceCapacity::minus);
                    projectedUsed.merge(to, allocation.getEnvelope(), ResourceCapacity::plus);
                    suggestions.add(MigrationSuggestion.builder()
                            .namespace(allocation.getNamespace())
                            .workloadName(allocation.getWorkloadName())
                            .fromNode(source.getName())
                            .toNode(to)
                            .envelope(allocation.getEnvelope())
                            .reason(String.format("node %s over %.0f%% (cpu %.0f%%, memory %.0f%%)",
                                    source.getName(), up * 100,
                                    source.getUtilization().getCpu() * 100,
                                    source.getUtilization().getMemory() * 100))
                            .suggestedAt(now)
                            .build());
                }
            }
        }

        latestSuggestions.set(List.copyOf(suggestions));
        metrics.recordMigrationSuggestions(suggestions.size());
        for (MigrationSuggestion suggestion : suggestions) {
            log.info("Migration suggestion: {}/{} {} -> {} ({})", suggestion.getNamespace(),
                    suggestion.getWorkloadName(), suggestion.getFromNode(), suggestion.getToNode(),
                    suggestion.getReason());
        }
        log.debug("Rebalancing scan: {} overutilised, {} underutilised, {} suggestions",
                overutilised.size(), underutilised.size(), suggestions.size());
        return suggestions;
    }

    /**
     * @return suggestions of the most recent rebalancing scan
     */
    public List<MigrationSuggestion> getLatestSuggestions() {
        return latestSuggestions.get();
    }

    private Optional<String> infeasibility(NodeResourceInfo node, ResourceCapacity requested) {
        ResourceCapacity available = node.getAvailable();
        if (available.getCpuMillis() < requested.getCpuMillis()) {
            return Optional.of("insufficient cpu");
        }
        if (available.getMemoryBytes() < requested.getMemoryBytes()) {
            return Optional.of("insufficient memory");
        }
        if (available.getGpu() < requested.getGpu()) {
            return Optional.of("insufficient gpu");
        }
        double target = config.getUtilizationTarget();
        ResourceUtilization utilization = node.getUtilization();
        if (utilization.getCpu() > target || utilization.getMemory() > target
                || (requested.getGpu() > 0 && utilization.getGpu() > target)) {
            return Optional.of(String.format("utilization above target %.0f%%", target * 100));
        }
        return Optional.empty();
    }

    private boolean localityPreference(PlacementSpec placementSpec) {
        if (!config.isLocalityPreference()) {
            return false;
        }
        return placementSpec == null || placementSpec.getLocalityPreference() == null
                || placementSpec.getLocalityPreference();
    }

    private static boolean isRanked(PlacementResult result, String nodeName) {
        return result.getRanking().stream().anyMatch(s -> s.getNodeName().equals(nodeName));
    }

    private static boolean isOverutilised(ResourceUtilization utilization, double threshold) {
        return utilization.getCpu() > threshold || utilization.getMemory() > threshold;
    }

    private static ResourceUtilization utilization(NodeResourceInfo node, Map<String, ResourceCapacity> projectedUsed) {
        return ResourceUtilization.of(projectedUsed.get(node.getName()), node.getAllocatable());
    }

    private static boolean fitsWithinThreshold(NodeResourceInfo target,
                                               Map<String, ResourceCapacity> projectedUsed,
                                               ResourceCapacity envelope,
                                               double threshold) {
        ResourceCapacity after = projectedUsed.get(target.getName()).plus(envelope);
        if (!target.getAllocatable().covers(after)) {
            return false;
        }
        return !isOverutilised(ResourceUtilization.of(after, target.getAllocatable()), threshold);
    }

    /**
     * The node as it would look without the workload's own allocation.
     */
    static NodeResourceInfo creditBack(NodeResourceInfo node, ResourceCapacity envelope) {
        return NodeResourceInfo.of(node.getName(), node.getLabels(), node.getTaints(), node.isReady(),
                node.isUnschedulable(), node.getCapacity(), node.getAllocatable(),
                node.getUsed().minus(envelope).clampAtZero(), Math.max(0, node.getWorkloadCount() - 1),
                node.getPerformance(), node.getLastUpdated());
    }
}
