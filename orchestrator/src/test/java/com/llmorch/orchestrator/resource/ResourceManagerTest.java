package com.llmorch.orchestrator.resource;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.crd.PlacementSpec;
import com.llmorch.core.metrics.MetricsNames;
import com.llmorch.core.metrics.MetricsTags;
import com.llmorch.core.model.MigrationSuggestion;
import com.llmorch.core.model.QualityClass;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.ResourceRequirements;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.capacity.CapacityCache;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.error.NoFeasibleNodeException;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import com.llmorch.orchestrator.placement.PlacementEngine;
import com.llmorch.orchestrator.support.InMemoryPlatformClient;
import com.llmorch.orchestrator.support.MutableClock;
import com.llmorch.orchestrator.support.StubMetricsSource;
import com.llmorch.orchestrator.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.llmorch.orchestrator.support.TestFixtures.GI;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceManagerTest {

    private InMemoryPlatformClient platform;
    private StubMetricsSource metricsSource;
    private SimpleMeterRegistry registry;
    private CapacityCache cache;
    private ResourceManager manager;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = TestFixtures.config();
        MutableClock clock = new MutableClock(TestFixtures.T0);
        platform = new InMemoryPlatformClient();
        platform.addNode(TestFixtures.node("node-a", "8", "64Gi", 2, Map.of("pool", "a")));
        platform.addNode(TestFixtures.node("node-b", "8", "64Gi", 2, Map.of("pool", "b")));
        metricsSource = new StubMetricsSource();
        registry = new SimpleMeterRegistry();
        OrchestratorMetrics metrics = new OrchestratorMetrics(registry);
        cache = new CapacityCache(platform, metricsSource, metrics, Duration.ofSeconds(30), clock);
        manager = new ResourceManager(new ResourceSizer(config), cache, new PlacementEngine(), metrics, config, clock);
    }

    @Test
    void testAllocate_RecordsAllocationOnRankedNode() {
        cache.refresh();
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");
        ResourceRequirements requirements = manager.size(workload.getSpec(), null);

        ResourceAllocation allocation = manager.allocate(workload, requirements);

        assertEquals(requirements.getRequested(), allocation.getEnvelope());
        assertEquals(QualityClass.STANDARD, allocation.getQosClass());
        // Identical nodes tie on every key but the name
        assertEquals("node-a", allocation.getNodeName());
        assertEquals(allocation, cache.allocationOf(workload.key()).orElseThrow());
        assertEquals(1.0, registry.get(MetricsNames.ALLOCATIONS).tag(MetricsTags.ACTION, "allocate").counter().count());
    }

    @Test
    @DisplayName("A busy cluster rejects the workload until a node drops below the utilisation target")
    void testNoFeasibleNode_UntilCapacityFreesUp() {
        // Given
        metricsSource.setNodeUsage("node-a", new ResourceCapacity(7200, 0, 0, 0));
        metricsSource.setNodeUsage("node-b", new ResourceCapacity(7200, 0, 0, 0));
        cache.refresh();
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "busy");
        ResourceRequirements requirements = requirements(2000, 4 * GI, 0);

        // When
        NoFeasibleNodeException e = assertThrows(NoFeasibleNodeException.class,
                () -> manager.allocate(workload, requirements));

        // Then
        assertTrue(e.isRetryable());
        assertEquals("insufficient cpu", e.getRejections().get("node-a"));
        assertEquals("insufficient cpu", e.getRejections().get("node-b"));
        assertTrue(cache.snapshot().getAllocations().isEmpty());

        // When
        metricsSource.setNodeUsage("node-b", new ResourceCapacity(4000, 0, 0, 0));
        cache.refresh();

        // Then
        assertEquals("node-b", manager.allocate(workload, requirements).getNodeName());
    }

    @Test
    void testNodeAboveUtilizationTarget_IsInfeasibleEvenWithRoom() {
        metricsSource.setNodeUsage("node-a", new ResourceCapacity(6800, 0, 0, 0));
        metricsSource.setNodeUsage("node-b", new ResourceCapacity(6800, 0, 0, 0));
        cache.refresh();

        NoFeasibleNodeException e = assertThrows(NoFeasibleNodeException.class,
                () -> manager.allocate(TestFixtures.llamaWorkload("ml", "w"), requirements(500, GI, 0)));

        assertEquals("utilization above target 80%", e.getRejections().get("node-a"));
    }

    @Test
    void testAllocate_UnchangedRequestReturnsExistingAllocation() {
        cache.refresh();
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");
        ResourceRequirements requirements = requirements(2000, 8 * GI, 1);

        ResourceAllocation first = manager.allocate(workload, requirements);
        ResourceAllocation second = manager.allocate(workload, requirements);

        assertSame(first, second);
        assertEquals(1.0, registry.get(MetricsNames.ALLOCATIONS).tag(MetricsTags.ACTION, "allocate").counter().count());
    }

    @Test
    void testAllocate_ResizedWorkloadStaysOnItsNode() {
        cache.refresh();
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");
        manager.allocate(workload, requirements(2000, 8 * GI, 0));
        // Make node-a the less attractive node
        cache.applyAllocation(ResourceAllocation.builder()
                .namespace("ml").workloadName("other").nodeName("node-a").modelName("bert-base")
                .envelope(new ResourceCapacity(3000, 16 * GI, 1, 0))
                .qosClass(QualityClass.BASIC).allocatedAt(TestFixtures.T0)
                .build());

        ResourceAllocation resized = manager.allocate(workload, requirements(3000, 8 * GI, 0));

        assertEquals("node-a", resized.getNodeName());
        assertEquals(3000, resized.getEnvelope().getCpuMillis());
        assertEquals(2, cache.snapshot().allocationsOn("node-a").size());
    }

    @Test
    void testAllocate_MovesWhenCurrentNodeNoLongerMatches() {
        cache.refresh();
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");
        ResourceRequirements requirements = requirements(2000, 8 * GI, 0);
        assertEquals("node-a", manager.allocate(workload, requirements).getNodeName());

        PlacementSpec placement = new PlacementSpec();
        placement.getNodeSelector().put("pool", "b");
        workload.getSpec().setPlacement(placement);
        ResourceAllocation moved = manager.allocate(workload, requirements);

        assertEquals("node-b", moved.getNodeName());
        assertTrue(cache.snapshot().allocationsOn("node-a").isEmpty());
        assertEquals(1, cache.snapshot().getAllocations().size());
    }

    @Test
    void testRelease_ReturnsCapacity() {
        cache.refresh();
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");
        manager.allocate(workload, requirements(2000, 8 * GI, 1));

        assertTrue(manager.release(workload.key()).isPresent());
        assertFalse(manager.release(workload.key()).isPresent());
        assertEquals(8000, cache.snapshot().node("node-a").orElseThrow().getAvailable().getCpuMillis());
        assertEquals(1.0, registry.get(MetricsNames.ALLOCATIONS).tag(MetricsTags.ACTION, "release").counter().count());
    }

    @Test
    @DisplayName("An overutilised node yields one suggestion towards the idle node")
    void testRebalance_SuggestsMoveOffHotNode() {
        // Given: A at 85% CPU with X and Y, B at 20% with nothing
        metricsSource.setNodeUsage("node-a", new ResourceCapacity(1200, 0, 0, 0));
        metricsSource.setNodeUsage("node-b", new ResourceCapacity(1600, 0, 0, 0));
        cache.refresh();
        cache.applyAllocation(allocation("x", "node-a", new ResourceCapacity(2800, 4 * GI, 0, 0)));
        cache.applyAllocation(allocation("y", "node-a", new ResourceCapacity(2800, 4 * GI, 0, 0)));

        // When
        List<MigrationSuggestion> suggestions = manager.rebalance();

        // Then
        assertEquals(1, suggestions.size());
        MigrationSuggestion suggestion = suggestions.get(0);
        assertEquals("node-a", suggestion.getFromNode());
        assertEquals("node-b", suggestion.getToNode());
        assertTrue(List.of("x", "y").contains(suggestion.getWorkloadName()));
        assertEquals(suggestions, manager.getLatestSuggestions());
        // Suggestions are never executed
        assertEquals(2, cache.snapshot().allocationsOn("node-a").size());
    }

    @Test
    void testRebalance_BalancedClusterSuggestsNothing() {
        cache.refresh();
        cache.applyAllocation(allocation("x", "node-a", new ResourceCapacity(2000, 4 * GI, 0, 0)));

        assertTrue(manager.rebalance().isEmpty());
        assertTrue(manager.getLatestSuggestions().isEmpty());
    }

    private static ResourceRequirements requirements(long cpuMillis, long memoryBytes, int gpu) {
        ResourceCapacity requested = new ResourceCapacity(cpuMillis, memoryBytes, gpu, 0);
        return ResourceRequirements.builder()
                .requested(requested)
                .limits(requested)
                .qualityClass(QualityClass.STANDARD)
                .build();
    }

    private static ResourceAllocation allocation(String name, String node, ResourceCapacity envelope) {
        return ResourceAllocation.builder()
                .namespace("ml")
                .workloadName(name)
                .nodeName(node)
                .modelName("llama-7b")
                .envelope(envelope)
                .qosClass(QualityClass.STANDARD)
                .allocatedAt(TestFixtures.T0)
                .build();
    }
}
