package com.llmorch.orchestrator.capacity;

import com.llmorch.core.metrics.MetricsNames;
import com.llmorch.core.metrics.MetricsTags;
import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.QualityClass;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.error.NoFeasibleNodeException;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import com.llmorch.orchestrator.support.InMemoryPlatformClient;
import com.llmorch.orchestrator.support.MutableClock;
import com.llmorch.orchestrator.support.StubMetricsSource;
import com.llmorch.orchestrator.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static com.llmorch.orchestrator.support.TestFixtures.GI;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapacityCacheTest {

    private InMemoryPlatformClient platform;
    private StubMetricsSource metricsSource;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private CapacityCache cache;

    @BeforeEach
    void setUp() {
        platform = new InMemoryPlatformClient();
        platform.addNode(TestFixtures.node("node-a", "8", "64Gi", 2));
        platform.addNode(TestFixtures.node("node-b", "8", "64Gi", 2));
        metricsSource = new StubMetricsSource();
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(TestFixtures.T0);
        cache = new CapacityCache(platform, metricsSource, new OrchestratorMetrics(registry),
                Duration.ofSeconds(30), clock);
    }

    @Test
    void testRefresh_ExternalPodRequestsCountAsUsed() {
        platform.addPod(TestFixtures.externalPod("dns", "node-a", "2", "4Gi"));

        cache.refresh();

        NodeResourceInfo nodeA = cache.snapshot().node("node-a").orElseThrow();
        assertEquals(8000, nodeA.getAllocatable().getCpuMillis());
        assertEquals(2000, nodeA.getUsed().getCpuMillis());
        assertEquals(6000, nodeA.getAvailable().getCpuMillis());
        assertEquals(60 * GI, nodeA.getAvailable().getMemoryBytes());
        assertEquals(2, nodeA.getAvailable().getGpu());
        assertEquals(TestFixtures.T0, cache.lastRefresh().orElseThrow());
        assertEquals(1.0, registry.get(MetricsNames.CACHE_REFRESHES).tag(MetricsTags.RESULT, "success").counter().count());
    }

    @Test
    void testRefresh_MeasuredUsageWinsOverPodRequests() {
        platform.addPod(TestFixtures.externalPod("batch", "node-b", "1", "1Gi"));
        metricsSource.setNodeUsage("node-b", new ResourceCapacity(3000, 10 * GI, 0, 0));

        cache.refresh();

        NodeResourceInfo nodeB = cache.snapshot().node("node-b").orElseThrow();
        assertEquals(3000, nodeB.getUsed().getCpuMillis());
        assertEquals(10 * GI, nodeB.getUsed().getMemoryBytes());
    }

    @Test
    @DisplayName("used equals external usage plus live allocations on every node, whatever the call sequence")
    void testAllocationConservation_RandomSequence() {
        // Given
        platform.addPod(TestFixtures.externalPod("dns", "node-a", "500m", "1Gi"));
        cache.refresh();
        ResourceCapacity externalA = new ResourceCapacity(500, GI, 0, 0);
        Random random = new Random(42);

        // When / Then
        for (int step = 0; step < 200; step++) {
            WorkloadKey key = WorkloadKey.of("ns", "w" + random.nextInt(6));
            if (random.nextBoolean()) {
                String node = random.nextBoolean() ? "node-a" : "node-b";
                ResourceCapacity envelope = new ResourceCapacity(250L * (1 + random.nextInt(8)),
                        GI * (1 + random.nextInt(8)), random.nextInt(2), 0);
                try {
                    cache.applyAllocation(allocation(key, node, envelope));
                } catch (NoFeasibleNodeException e) {
                    // a full node rejects; the invariant must still hold
                }
            } else {
                cache.releaseAllocation(key);
            }

            CapacitySnapshot snapshot = cache.snapshot();
            for (NodeResourceInfo node : snapshot.getNodes()) {
                ResourceCapacity expected = node.getName().equals("node-a") ? externalA : ResourceCapacity.ZERO;
                for (ResourceAllocation allocation : snapshot.allocationsOn(node.getName())) {
                    expected = expected.plus(allocation.getEnvelope());
                }
                assertEquals(expected, node.getUsed(), "used on " + node.getName() + " at step " + step);
                assertEquals(node.getAllocatable(), node.getUsed().plus(node.getAvailable()));
                assertTrue(node.getAllocatable().covers(node.getUsed()), "overcommitted " + node.getName());
            }
        }
    }

    @Test
    void testApplyAllocation_TooLargeIsRejected() {
        cache.refresh();

        NoFeasibleNodeException e = assertThrows(NoFeasibleNodeException.class, () ->
                cache.applyAllocation(allocation(WorkloadKey.of("ns", "big"), "node-a",
                        new ResourceCapacity(9000, GI, 0, 0))));

        assertTrue(e.getRejections().containsKey("node-a"));
        assertTrue(cache.snapshot().getAllocations().isEmpty());
    }

    @Test
    void testApplyAllocation_UnknownNodeIsRejected() {
        cache.refresh();

        assertThrows(NoFeasibleNodeException.class, () ->
                cache.applyAllocation(allocation(WorkloadKey.of("ns", "w"), "node-z",
                        new ResourceCapacity(1000, GI, 0, 0))));
    }

    @Test
    void testApplyAllocation_ReplacingOwnAllocationCreditsItBack() {
        cache.refresh();
        WorkloadKey key = WorkloadKey.of("ns", "w");
        cache.applyAllocation(allocation(key, "node-a", new ResourceCapacity(6000, GI, 0, 0)));

        // 7 cores only fit because the previous 6 are returned first
        cache.applyAllocation(allocation(key, "node-a", new ResourceCapacity(7000, GI, 0, 0)));

        NodeResourceInfo nodeA = cache.snapshot().node("node-a").orElseThrow();
        assertEquals(7000, nodeA.getUsed().getCpuMillis());
        assertEquals(1, nodeA.getWorkloadCount());
    }

    @Test
    void testRelease_IsIdempotent() {
        cache.refresh();
        WorkloadKey key = WorkloadKey.of("ns", "w");
        cache.applyAllocation(allocation(key, "node-b", new ResourceCapacity(1000, GI, 1, 0)));

        assertTrue(cache.releaseAllocation(key).isPresent());
        assertFalse(cache.releaseAllocation(key).isPresent());
        assertEquals(ResourceCapacity.ZERO, cache.snapshot().node("node-b").orElseThrow().getUsed());
    }

    @Test
    void testRefresh_AllocationsSurviveButVanishedNodesDropThem() {
        cache.refresh();
        cache.applyAllocation(allocation(WorkloadKey.of("ns", "on-a"), "node-a", new ResourceCapacity(1000, GI, 0, 0)));
        cache.applyAllocation(allocation(WorkloadKey.of("ns", "on-b"), "node-b", new ResourceCapacity(1000, GI, 0, 0)));

        platform.removeNode("node-b");
        cache.refresh();

        CapacitySnapshot snapshot = cache.snapshot();
        assertEquals(1, snapshot.getNodes().size());
        assertTrue(snapshot.allocation(WorkloadKey.of("ns", "on-a")).isPresent());
        assertFalse(snapshot.allocation(WorkloadKey.of("ns", "on-b")).isPresent());
    }

    @Test
    void testSnapshot_ClusterTotalsRollUp() {
        cache.refresh();
        cache.applyAllocation(allocation(WorkloadKey.of("ns", "w"), "node-a", new ResourceCapacity(2000, 8 * GI, 1, 0)));

        CapacitySnapshot snapshot = cache.snapshot();

        assertEquals(16000, snapshot.getCluster().getTotalAllocatable().getCpuMillis());
        assertEquals(14000, snapshot.getCluster().getTotalAvailable().getCpuMillis());
    }

    private static ResourceAllocation allocation(WorkloadKey key, String node, ResourceCapacity envelope) {
        return ResourceAllocation.builder()
                .namespace(key.namespace())
                .workloadName(key.name())
                .nodeName(node)
                .modelName("llama-7b")
                .envelope(envelope)
                .qosClass(QualityClass.STANDARD)
                .allocatedAt(TestFixtures.T0)
                .build();
    }
}
