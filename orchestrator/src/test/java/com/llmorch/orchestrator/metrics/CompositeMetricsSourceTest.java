package com.llmorch.orchestrator.metrics;

import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.support.StubMetricsSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CompositeMetricsSourceTest {

    private static final WorkloadKey KEY = WorkloadKey.of("ml", "llama");

    @Test
    void testNodeUsage_FirstNonEmptySourceWins() {
        StubMetricsSource traffic = new StubMetricsSource();
        StubMetricsSource platform = new StubMetricsSource();
        platform.setNodeUsage("node-a", new ResourceCapacity(1500, 0, 0, 0));

        CompositeMetricsSource composite = new CompositeMetricsSource(List.of(traffic, platform));

        assertEquals(Map.of("node-a", new ResourceCapacity(1500, 0, 0, 0)), composite.nodeUsage());
    }

    @Test
    void testWorkloadMetrics_MergedFieldByField() {
        StubMetricsSource platform = new StubMetricsSource();
        platform.setWorkloadMetrics(KEY, WorkloadMetrics.builder().cpuUtilization(0.6).requestsPerSecond(1.0).build());
        StubMetricsSource traffic = new StubMetricsSource();
        traffic.setWorkloadMetrics(KEY, WorkloadMetrics.builder().requestsPerSecond(40.0).latencyMs(250.0).build());

        WorkloadMetrics merged = new CompositeMetricsSource(List.of(platform, traffic))
                .workloadMetrics(KEY, ResourceCapacity.ZERO);

        assertEquals(0.6, merged.getCpuUtilization());
        assertEquals(1.0, merged.getRequestsPerSecond());
        assertEquals(250.0, merged.getLatencyMs());
    }
}
