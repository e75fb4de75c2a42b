package com.llmorch.orchestrator.placement;

import com.llmorch.core.crd.PlacementSpec;
import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.NodeScore;
import com.llmorch.core.model.NodeTaint;
import com.llmorch.core.model.PlacementResult;
import com.llmorch.core.model.QualityClass;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.llmorch.orchestrator.support.TestFixtures.GI;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlacementEngineTest {

    private static final ResourceCapacity NODE = new ResourceCapacity(8000, 64 * GI, 2, 0);

    private final PlacementEngine engine = new PlacementEngine();

    @Test
    @DisplayName("Identical inputs give identical rankings whatever the node order")
    void testScoring_IsDeterministic() {
        // Given
        List<NodeResourceInfo> nodes = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            nodes.add(TestFixtures.nodeInfo("node-" + i, NODE,
                    new ResourceCapacity(500L * (i % 4), GI * (i % 3), 0, 0),
                    Map.of(WorkloadLabels.ZONE, "zone-" + (i % 2))));
        }
        ModelLocalityIndex locality = ModelLocalityIndex.from(nodes, List.of(allocation("node-3", "llama-7b")));
        PlacementRequest request = request(new ResourceCapacity(2000, 8 * GI, 1, 0), null);

        // When
        PlacementResult first = engine.score(request, nodes, locality);
        List<NodeResourceInfo> shuffled = new ArrayList<>(nodes);
        Collections.reverse(shuffled);
        PlacementResult second = engine.score(request, shuffled, locality);

        // Then
        assertEquals(names(first), names(second));
        assertEquals(scores(first), scores(second));
        assertEquals("node-3", first.selected().orElseThrow().getNodeName());
    }

    @Test
    void testRanking_MoreHeadroomWins() {
        NodeResourceInfo roomy = TestFixtures.nodeInfo("roomy", NODE, ResourceCapacity.ZERO, Map.of());
        NodeResourceInfo busy = TestFixtures.nodeInfo("busy", NODE, new ResourceCapacity(4000, 32 * GI, 1, 0), Map.of());

        PlacementResult result = engine.score(request(new ResourceCapacity(1000, GI, 0, 0), null),
                List.of(busy, roomy), ModelLocalityIndex.EMPTY);

        assertEquals(List.of("roomy", "busy"), names(result));
    }

    @Test
    void testTieBreak_AvailableCpuThenWorkloadCountThenName() {
        NodeResourceInfo small = TestFixtures.nodeInfo("small", NODE, ResourceCapacity.ZERO, Map.of());
        NodeResourceInfo large = TestFixtures.nodeInfo("large", new ResourceCapacity(16000, 128 * GI, 4, 0),
                ResourceCapacity.ZERO, Map.of());
        NodeResourceInfo crowded = small.toBuilder().name("crowded").workloadCount(3).build();
        NodeResourceInfo twin = small.toBuilder().name("a-twin").build();

        PlacementResult result = engine.score(request(new ResourceCapacity(1000, GI, 0, 0), null),
                List.of(crowded, small, twin, large), ModelLocalityIndex.EMPTY);

        // All four score the same
        assertEquals(1, scores(result).stream().distinct().count());
        assertEquals(List.of("large", "a-twin", "small", "crowded"), names(result));
    }

    @Test
    void testConstraints_RejectedNodesCarryTheirReason() {
        NodeResourceInfo base = TestFixtures.nodeInfo("base", NODE, ResourceCapacity.ZERO,
                Map.of("pool", "gpu", "rack", "r1"));
        List<NodeResourceInfo> nodes = List.of(
                base.toBuilder().name("not-ready").ready(false).build(),
                base.toBuilder().name("cordoned").unschedulable(true).build(),
                base.toBuilder().name("wrong-pool").clearLabels().label("pool", "cpu").build(),
                base.toBuilder().name("rack-two").clearLabels().label("pool", "gpu").label("rack", "r2").build(),
                base.toBuilder().name("ok").build());

        PlacementSpec placement = new PlacementSpec();
        placement.getNodeSelector().put("pool", "gpu");
        placement.getAntiAffinity().add(new PlacementSpec.LabelTerm("rack", "r1"));

        PlacementResult result = engine.score(request(new ResourceCapacity(1000, GI, 0, 0), placement),
                nodes, ModelLocalityIndex.EMPTY);

        assertEquals(List.of("rack-two"), names(result));
        Map<String, String> rejected = result.getRejected();
        assertEquals("node not ready", rejected.get("not-ready"));
        assertEquals("node cordoned", rejected.get("cordoned"));
        assertEquals("nodeSelector pool=gpu not matched", rejected.get("wrong-pool"));
        assertEquals("anti-affinity rack=r1", rejected.get("ok"));
    }

    @Test
    void testTaints_TolerationsAndGpuTaint() {
        NodeResourceInfo base = TestFixtures.nodeInfo("base", NODE, ResourceCapacity.ZERO, Map.of());
        NodeResourceInfo dedicated = base.toBuilder().name("dedicated")
                .taint(new NodeTaint("dedicated", "ml", NodeTaint.NO_SCHEDULE)).build();
        NodeResourceInfo gpuOnly = base.toBuilder().name("gpu-only")
                .taint(new NodeTaint(WorkloadLabels.GPU_RESOURCE, "present", NodeTaint.NO_SCHEDULE)).build();
        NodeResourceInfo soft = base.toBuilder().name("soft")
                .taint(new NodeTaint("dedicated", "ml", "PreferNoSchedule")).build();
        PlacementSpec tolerating = new PlacementSpec();
        tolerating.getTolerations().add("dedicated");

        PlacementResult cpuOnly = engine.score(request(new ResourceCapacity(1000, GI, 0, 0), null),
                List.of(dedicated, gpuOnly, soft), ModelLocalityIndex.EMPTY);
        PlacementResult withGpu = engine.score(request(new ResourceCapacity(1000, GI, 1, 0), tolerating),
                List.of(dedicated, gpuOnly), ModelLocalityIndex.EMPTY);

        assertEquals(List.of("soft"), names(cpuOnly));
        assertEquals("untolerated taint dedicated:NoSchedule", cpuOnly.getRejected().get("dedicated"));
        assertEquals(2, withGpu.getRanking().size());
    }

    @Test
    void testMaxNodeUtilization_ProjectsTheRequest() {
        NodeResourceInfo half = TestFixtures.nodeInfo("half", NODE, new ResourceCapacity(4000, GI, 0, 0), Map.of());
        NodeResourceInfo idle = TestFixtures.nodeInfo("idle", NODE, ResourceCapacity.ZERO, Map.of());
        PlacementSpec placement = new PlacementSpec();
        placement.setMaxNodeUtilization(0.6);

        PlacementResult result = engine.score(request(new ResourceCapacity(2000, GI, 0, 0), placement),
                List.of(half, idle), ModelLocalityIndex.EMPTY);

        // 6000m of 8000m would be 75%
        assertEquals(List.of("idle"), names(result));
        assertEquals("would exceed maxNodeUtilization 0.6", result.getRejected().get("half"));
    }

    @Test
    void testNoCandidates_EmptySelection() {
        PlacementResult result = engine.score(request(new ResourceCapacity(1000, GI, 0, 0), null),
                List.of(), ModelLocalityIndex.EMPTY);

        assertFalse(result.selected().isPresent());
    }

    private static PlacementRequest request(ResourceCapacity requested, PlacementSpec placement) {
        return PlacementRequest.builder()
                .workload(WorkloadKey.of("ml", "llama"))
                .modelName("llama-7b")
                .requested(requested)
                .qualityClass(QualityClass.STANDARD)
                .placement(placement)
                .localityPreference(true)
                .build();
    }

    private static ResourceAllocation allocation(String node, String model) {
        return ResourceAllocation.builder()
                .namespace("ml")
                .workloadName("existing")
                .nodeName(node)
                .modelName(model)
                .envelope(ResourceCapacity.ZERO)
                .qosClass(QualityClass.STANDARD)
                .allocatedAt(TestFixtures.T0)
                .build();
    }

    private static List<String> names(PlacementResult result) {
        return result.getRanking().stream().map(NodeScore::getNodeName).collect(Collectors.toList());
    }

    private static List<Double> scores(PlacementResult result) {
        return result.getRanking().stream().map(NodeScore::getScore).collect(Collectors.toList());
    }
}
