package com.llmorch.orchestrator.placement;

import com.llmorch.core.crd.PlacementSpec;
import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.model.NodeResourceInfo;
import com.llmorch.core.model.NodeScore;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.ScoreBreakdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes the four placement sub-scores of a node, each in [0, 100].
 */
public class NodeScorer {
    private static final double BASE_SCORE = 50.0;

    private static final Map<String, Double> INSTANCE_TYPE_BONUS = Map.of(
            "c5.xlarge", 10.0,
            "c5.2xlarge", 15.0,
            "c5.4xlarge", 20.0,
            "p3.2xlarge", 30.0,
            "p3.8xlarge", 40.0,
            "p4d.24xlarge", 50.0);

    private static final double SSD_BONUS = 10.0;
    private static final double NETWORK_BONUS = 5.0;
    private static final double FAST_NETWORK_BONUS = 10.0;
    private static final double FAST_NETWORK_GBPS = 25.0;

    public NodeScore score(NodeResourceInfo node, PlacementRequest request, ModelLocalityIndex locality) {
        List<String> reasons = new ArrayList<>();

        double resource = resourceScore(node, request.getRequested());
        double affinity = affinityScore(node, request.getPlacement(), reasons);
        double localityScore = localityScore(node, request, locality, reasons);
        double performance = performanceScore(node, reasons);

        ScoreWeights weights = ScoreWeights.forQuality(request.getQualityClass());
        double total = weights.combine(resource, affinity, localityScore, performance);
        reasons.add(0, String.format("resource=%.1f affinity=%.1f locality=%.1f performance=%.1f",
                resource, affinity, localityScore, performance));

        return NodeScore.builder()
                .nodeName(node.getName())
                .score(clamp(total))
                .breakdown(new ScoreBreakdown(resource, affinity, localityScore, performance))
                .reasons(reasons)
                .availableCpuMillis(node.getAvailable().getCpuMillis())
                .workloadCount(node.getWorkloadCount())
                .build();
    }

    /**
     * Mean of the available share of CPU, memory and GPU.
     */
    double resourceScore(NodeResourceInfo node, ResourceCapacity requested) {
        ResourceCapacity available = node.getAvailable();
        ResourceCapacity allocatable = node.getAllocatable();

        double cpu = share(available.getCpuMillis(), allocatable.getCpuMillis());
        double memory = share(available.getMemoryBytes(), allocatable.getMemoryBytes());
        double gpu;
        if (allocatable.getGpu() > 0) {
            gpu = share(available.getGpu(), allocatable.getGpu());
        } else {
            gpu = requested.getGpu() > 0 ? 0.0 : 100.0;
        }
        return clamp((cpu + memory + gpu) / 3.0);
    }

    double affinityScore(NodeResourceInfo node, PlacementSpec placement, List<String> reasons) {
        double score = BASE_SCORE;
        if (placement != null && placement.getPreferences() != null) {
            for (PlacementSpec.NodePreference preference : placement.getPreferences()) {
                if (preference.getKey() == null || preference.getWeight() == null) {
                    continue;
                }
                String value = node.getLabels().get(preference.getKey());
                if (value != null && value.equals(preference.getValue())) {
                    score += preference.getWeight();
                    reasons.add("prefers " + preference.getKey() + "=" + preference.getValue());
                }
            }
        }
        return clamp(score);
    }

    double localityScore(NodeResourceInfo node, PlacementRequest request, ModelLocalityIndex locality,
                         List<String> reasons) {
        if (!request.isLocalityPreference()) {
            return 50.0;
        }
        if (locality.isCachedOn(request.getModelName(), node.getName())) {
            reasons.add("model cached on node");
            return 100.0;
        }
        if (locality.isCachedInZone(request.getModelName(), node.zone())) {
            reasons.add("model cached in zone " + node.zone());
            return 75.0;
        }
        return 25.0;
    }

    double performanceScore(NodeResourceInfo node, List<String> reasons) {
        double score = BASE_SCORE;
        Map<String, String> labels = node.getLabels();

        String instanceType = labels.get(WorkloadLabels.INSTANCE_TYPE);
        if (instanceType != null && INSTANCE_TYPE_BONUS.containsKey(instanceType)) {
            score += INSTANCE_TYPE_BONUS.get(instanceType);
            reasons.add("instance type " + instanceType);
        }
        if (node.getPerformance() != null && node.getPerformance().isSsd()) {
            score += SSD_BONUS;
            reasons.add("ssd");
        }
        if (labels.containsKey(WorkloadLabels.BANDWIDTH)) {
            double gbps = node.getPerformance() == null ? 0.0 : node.getPerformance().getNetworkBandwidthGbps();
            score += gbps >= FAST_NETWORK_GBPS ? FAST_NETWORK_BONUS : NETWORK_BONUS;
        }
        return clamp(score);
    }

    private static double share(double available, double total) {
        if (total <= 0) {
            return 0.0;
        }
        return clamp(available / total * 100.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
