package com.llmorch.orchestrator.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestratorConfigTest {

    @Test
    void testDefaults() {
        OrchestratorConfig config = OrchestratorConfig.defaults();

        assertEquals(8080, config.getMetricsPort());
        assertEquals(8081, config.getHealthPort());
        assertTrue(config.isLeaderElection());
        assertEquals("llm-orchestrator-leader", config.getLeaderLockName());
        assertEquals(Duration.ofSeconds(30), config.getReconcileInterval());
        assertEquals(4, config.getMaxConcurrentReconciles());
        assertEquals(0.8, config.getUtilizationTarget());
        assertEquals(OrchestratorConfig.ModelTypeMatching.PREFIX, config.getModelTypeMatching());
        assertEquals(Duration.ofMinutes(3), config.getScaleUpCooldown());
        assertTrue(config.isAllNamespaces());
        assertSame(config, config.validate());
    }

    @Test
    void testFromEnv_Overrides() {
        OrchestratorConfig config = OrchestratorConfig.fromEnv(Map.of(
                "WATCH_NAMESPACE", "ml",
                "RECONCILE_INTERVAL", "PT1M",
                "MAX_CONCURRENT_RECONCILES", "8",
                "UTILIZATION_TARGET", "0.7",
                "MODEL_TYPE_MATCHING", "substring",
                "POD_NAME", "orchestrator-0"));

        assertEquals("ml", config.getNamespace());
        assertFalse(config.isAllNamespaces());
        assertEquals(Duration.ofMinutes(1), config.getReconcileInterval());
        assertEquals(8, config.getMaxConcurrentReconciles());
        assertEquals(0.7, config.getUtilizationTarget());
        assertEquals(OrchestratorConfig.ModelTypeMatching.SUBSTRING, config.getModelTypeMatching());
        assertEquals("orchestrator-0", config.getIdentity());
    }

    @Test
    void testFromEnv_MalformedValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> OrchestratorConfig.fromEnv(Map.of("METRICS_PORT", "eighty")));
        assertThrows(IllegalArgumentException.class, () -> OrchestratorConfig.fromEnv(Map.of("REBALANCE_INTERVAL", "often")));
        assertThrows(IllegalArgumentException.class, () -> OrchestratorConfig.fromEnv(Map.of("SCALE_UP_THRESHOLD", "high")));
        assertThrows(IllegalArgumentException.class, () -> OrchestratorConfig.fromEnv(Map.of("MODEL_TYPE_MATCHING", "regex")));
    }

    @Test
    void testValidate_CrossFieldConstraints() {
        OrchestratorConfig base = OrchestratorConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().healthPort(8080).build().validate());
        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().metricsPort(70000).build().validate());
        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().maxConcurrentReconciles(0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().utilizationTarget(1.2).build().validate());
        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().scaleDownThreshold(0.9).build().validate());
        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().leaderLockName(" ").build().validate());
        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().reconcileInterval(Duration.ZERO).build().validate());
        base.toBuilder().leaderElection(false).leaderLockName("").build().validate();
    }
}
