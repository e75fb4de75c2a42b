package com.llmorch.orchestrator.capacity;

import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.model.ClusterResourceInfo;
import com.llmorch.core.model.NodePerformanceMetrics;
import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.NodeTaint;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.core.util.Quantities;
import com.llmorch.orchestrator.error.NoFeasibleNodeException;
import com.llmorch.orchestrator.error.OrchestratorException;
import com.llmorch.orchestrator.k8s.IPlatformClient;
import com.llmorch.orchestrator.k8s.ResourceQuantities;
import com.llmorch.orchestrator.metrics.IMetricsSource;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Taint;
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
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Self-consistent view of node resources and orchestrator allocations.
 * <p>
 * For every node {@code used = externalUsed + sum(allocations on node)} and
 * {@code available = allocatable - used}; both are derived on each
 * {@link #snapshot()} and never stored. Readers take the read lock, the three
 * mutations take the write lock. {@link #refresh()} performs its platform calls
 * before taking the lock.
 * </p>
 */
public class CapacityCache {
    private static final Logger log = LoggerFactory.getLogger(CapacityCache.class);

    private final IPlatformClient platform;
    private final IMetricsSource metricsSource;
    private final OrchestratorMetrics metrics;
    private final Duration refreshInterval;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    // guarded by lock
    private final Map<String, NodeState> nodes = new TreeMap<>();
    private final Map<WorkloadKey, ResourceAllocation> allocations = new TreeMap<>();

    private volatile Instant lastRefresh;
    private Disposable refreshTask;

    public CapacityCache(IPlatformClient platform,
                         IMetricsSource metricsSource,
                         OrchestratorMetrics metrics,
                         Duration refreshInterval,
                         Clock clock) {
        this.platform = platform;
        this.metricsSource = metricsSource;
        this.metrics = metrics;
        this.refreshInterval = refreshInterval;
        this.clock = clock;

        log.info("Capacity cache initialized (refresh every {})", refreshInterval);
    }

    /**
     * Starts the periodic refresh. The first refresh runs immediately.
     */
    public void start() {
        refreshTask = Flux.interval(Duration.ZERO, refreshInterval)
                .onBackpressureDrop()
                .concatMap(tick -> Mono.fromRunnable(this::refresh)
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            log.warn("✗ Capacity refresh failed: {}", e.getMessage());
                            return Mono.empty();
                        }))
                .subscribe();
    }

    public void stop() {
        if (refreshTask != null) {
            refreshTask.dispose();
        }
        log.info("Capacity cache stopped");
    }

    /**
     * @return immutable view of all nodes, allocations and cluster totals
     */
    public CapacitySnapshot snapshot() {
        lock.readLock().lock();
        try {
            return buildSnapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records {@code allocation}, replacing any allocation the workload already holds.
     * The envelope must fit into the node's available resources, counting the
     * workload's previous allocation on that node as free.
     *
     * @throws NoFeasibleNodeException when the node is unknown or too small
     */
    public ResourceAllocation applyAllocation(ResourceAllocation allocation) {
        lock.writeLock().lock();
        try {
            NodeState node = nodes.get(allocation.getNodeName());
            if (node == null) {
                throw new NoFeasibleNodeException("Node " + allocation.getNodeName() + " is not known",
                        Map.of(allocation.getNodeName(), "unknown node"));
            }
            WorkloadKey key = allocation.key();
            ResourceAllocation previous = allocations.get(key);
            ResourceCapacity available = node.getAllocatable().minus(usedOn(node));
            if (previous != null && previous.getNodeName().equals(node.getName())) {
                available = available.plus(previous.getEnvelope());
            }
            if (!available.covers(allocation.getEnvelope())) {
                throw new NoFeasibleNodeException("Allocation for " + key + " no longer fits on " + node.getName(),
                        Map.of(node.getName(), "insufficient available resources"));
            }
            allocations.put(key, allocation);
            log.info("Allocated {} on {} ({})", key, allocation.getNodeName(), allocation.getEnvelope());
            return allocation;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the workload's allocation, if any.
     */
    public Optional<ResourceAllocation> releaseAllocation(WorkloadKey key) {
        lock.writeLock().lock();
        try {
            ResourceAllocation removed = allocations.remove(key);
            if (removed != null) {
                log.info("Released allocation of {} on {}", key, removed.getNodeName());
            }
            return Optional.ofNullable(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ResourceAllocation> releaseAllocation(ResourceAllocation allocation) {
        return releaseAllocation(allocation.key());
    }

    public Optional<ResourceAllocation> allocationOf(WorkloadKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(allocations.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Pulls nodes, pods and node usage from the platform and replaces the node
     * table. Allocations survive a refresh unless their node has disappeared.
     *
     * @throws OrchestratorException when the node list cannot be fetched
     */
    public void refresh() {
        try {
            List<Node> platformNodes = platform.listNodes();
            List<Pod> pods = platform.listPods();
            Map<String, ResourceCapacity> measured = measuredUsage();

            Map<String, ResourceCapacity> unmanagedRequests = new HashMap<>();
            Map<String, ResourceCapacity> managedRequests = new HashMap<>();
            for (Pod pod : pods) {
                String nodeName = pod.getSpec() == null ? null : pod.getSpec().getNodeName();
                if (nodeName == null || isFinished(pod)) {
                    continue;
                }
                Map<String, ResourceCapacity> target = isManaged(pod) ? managedRequests : unmanagedRequests;
                target.merge(nodeName, ResourceQuantities.podRequests(pod), ResourceCapacity::plus);
            }

            Map<String, NodeState> refreshed = new TreeMap<>();
            for (Node node : platformNodes) {
                String name = node.getMetadata().getName();
                ResourceCapacity external;
                if (measured.containsKey(name)) {
                    // Measured usage includes managed pods; subtract what they requested
                    external = measured.get(name)
                            .minus(managedRequests.getOrDefault(name, ResourceCapacity.ZERO))
                            .clampAtZero();
                } else {
                    external = unmanagedRequests.getOrDefault(name, ResourceCapacity.ZERO);
                }
                refreshed.put(name, toNodeState(node, external));
            }

            lock.writeLock().lock();
            try {
                nodes.clear();
                nodes.putAll(refreshed);
                Iterator<ResourceAllocation> it = allocations.values().iterator();
                while (it.hasNext()) {
                    ResourceAllocation allocation = it.next();
                    if (!nodes.containsKey(allocation.getNodeName())) {
                        log.warn("Node {} disappeared; dropping allocation of {}",
                                allocation.getNodeName(), allocation.key());
                        it.remove();
                    }
                }
            } finally {
                lock.writeLock().unlock();
            }

            lastRefresh = clock.instant();
            CapacitySnapshot snapshot = snapshot();
            metrics.updateNodeUtilization(snapshot.getNodes());
            metrics.recordCacheRefresh(true);
            log.debug("Capacity refreshed: {} nodes, {} allocations", snapshot.getNodes().size(),
                    snapshot.getAllocations().size());
        } catch (OrchestratorException e) {
            metrics.recordCacheRefresh(false);
            throw e;
        }
    }

    /**
     * @return time of the last successful refresh
     */
    public Optional<Instant> lastRefresh() {
        return Optional.ofNullable(lastRefresh);
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    private Map<String, ResourceCapacity> measuredUsage() {
        try {
            return metricsSource.nodeUsage();
        } catch (OrchestratorException e) {
            log.warn("Node usage unavailable, falling back to pod requests: {}", e.getMessage());
            return Map.of();
        }
    }

    private CapacitySnapshot buildSnapshot() {
        Instant now = clock.instant();
        List<NodeResourceInfo> views = new ArrayList<>(nodes.size());
        for (NodeState node : nodes.values()) {
            int workloadCount = 0;
            for (ResourceAllocation allocation : allocations.values()) {
                if (allocation.getNodeName().equals(node.getName())) {
                    workloadCount++;
                }
            }
            views.add(NodeResourceInfo.of(
                    node.getName(),
                    node.getLabels(),
                    node.getTaints(),
                    node.isReady(),
                    node.isUnschedulable(),
                    node.getCapacity(),
                    node.getAllocatable(),
                    usedOn(node),
                    workloadCount,
                    node.getPerformance(),
                    lastRefresh != null ? lastRefresh : now));
        }
        return new CapacitySnapshot(
                Collections.unmodifiableList(views),
                ClusterResourceInfo.rollUp(views, now),
                Collections.unmodifiableMap(new TreeMap<>(allocations)),
                now);
    }

    private ResourceCapacity usedOn(NodeState node) {
        ResourceCapacity used = node.getExternalUsed();
        for (ResourceAllocation allocation : allocations.values()) {
            if (allocation.getNodeName().equals(node.getName())) {
                used = used.plus(allocation.getEnvelope());
            }
        }
        return used;
    }

    private static boolean isManaged(Pod pod) {
        Map<String, String> labels = pod.getMetadata().getLabels();
        return labels != null && WorkloadLabels.MANAGED_BY_VALUE.equals(labels.get(WorkloadLabels.MANAGED_BY));
    }

    private static boolean isFinished(Pod pod) {
        String phase = pod.getStatus() == null ? null : pod.getStatus().getPhase();
        return "Succeeded".equals(phase) || "Failed".equals(phase);
    }

    static NodeState toNodeState(Node node, ResourceCapacity externalUsed) {
        Map<String, String> labels = node.getMetadata().getLabels() == null
                ? Map.of() : Map.copyOf(node.getMetadata().getLabels());

        List<NodeTaint> taints = new ArrayList<>();
        if (node.getSpec() != null && node.getSpec().getTaints() != null) {
            for (Taint taint : node.getSpec().getTaints()) {
                taints.add(new NodeTaint(taint.getKey(), taint.getValue(), taint.getEffect()));
            }
        }

        boolean ready = node.getStatus() != null && node.getStatus().getConditions() != null
                && node.getStatus().getConditions().stream()
                .anyMatch(c -> "Ready".equals(c.getType()) && "True".equals(c.getStatus()));
        boolean unschedulable = node.getSpec() != null && Boolean.TRUE.equals(node.getSpec().getUnschedulable());

        ResourceCapacity capacity = node.getStatus() == null
                ? ResourceCapacity.ZERO : ResourceQuantities.fromResourceMap(node.getStatus().getCapacity());
        ResourceCapacity allocatable = node.getStatus() == null
                ? ResourceCapacity.ZERO : ResourceQuantities.fromResourceMap(node.getStatus().getAllocatable());
        if (allocatable.equals(ResourceCapacity.ZERO)) {
            allocatable = capacity;
        }

        NodePerformanceMetrics performance = NodePerformanceMetrics.builder()
                .instanceType(labels.get(WorkloadLabels.INSTANCE_TYPE))
                .ssd(labels.containsKey(WorkloadLabels.SSD) && !"false".equalsIgnoreCase(labels.get(WorkloadLabels.SSD)))
                .networkBandwidthGbps(Quantities.bandwidthGbps(labels.get(WorkloadLabels.BANDWIDTH)).orElse(0.0))
                .build();

        return NodeState.builder()
                .name(node.getMetadata().getName())
                .labels(labels)
                .taints(List.copyOf(taints))
                .ready(ready)
                .unschedulable(unschedulable)
                .capacity(capacity)
                .allocatable(allocatable)
                .externalUsed(externalUsed)
                .performance(performance)
                .build();
    }
}
