package com.llmorch.orchestrator.reconcile;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.crd.LlmWorkloadStatus;
import com.llmorch.core.crd.WorkloadCondition;
import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.crd.WorkloadPhase;
import com.llmorch.core.metrics.MetricsNames;
import com.llmorch.core.metrics.MetricsTags;
import com.llmorch.core.model.QualityClass;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.core.validation.WorkloadValidator;
import com.llmorch.orchestrator.capacity.CapacityCache;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.error.ModelNotFoundException;
import com.llmorch.orchestrator.error.NoFeasibleNodeException;
import com.llmorch.orchestrator.error.OwnershipConflictException;
import com.llmorch.orchestrator.error.ReconcileCancelledException;
import com.llmorch.orchestrator.error.RegistryUnavailableException;
import com.llmorch.orchestrator.error.WorkloadValidationException;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import com.llmorch.orchestrator.placement.PlacementEngine;
import com.llmorch.orchestrator.resource.ResourceManager;
import com.llmorch.orchestrator.resource.ResourceSizer;
import com.llmorch.orchestrator.support.InMemoryPlatformClient;
import com.llmorch.orchestrator.support.MutableClock;
import com.llmorch.orchestrator.support.StubMetricsSource;
import com.llmorch.orchestrator.support.StubModelRegistry;
import com.llmorch.orchestrator.support.TestFixtures;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatusBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.llmorch.orchestrator.support.TestFixtures.GI;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconcilerTest {

    private static final String NS = "ml";
    private static final WorkloadKey KEY = WorkloadKey.of(NS, "llama");

    private InMemoryPlatformClient platform;
    private StubModelRegistry registry;
    private StubMetricsSource metricsSource;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private CapacityCache cache;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = TestFixtures.config();
        platform = new InMemoryPlatformClient();
        platform.addNode(TestFixtures.node("node-a", "8", "64Gi", 2));
        platform.addNode(TestFixtures.node("node-b", "8", "64Gi", 2));
        registry = new StubModelRegistry()
                .publish("llama-7b", "v1", "ghcr.io/llm-orchestrator/llama-7b:v1")
                .publish("llama-7b", "v2", "ghcr.io/llm-orchestrator/llama-7b:v2");
        metricsSource = new StubMetricsSource();
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(TestFixtures.T0);

        OrchestratorMetrics metrics = new OrchestratorMetrics(meterRegistry);
        cache = new CapacityCache(platform, metricsSource, metrics, Duration.ofSeconds(30), clock);
        cache.refresh();
        ResourceManager resources = new ResourceManager(new ResourceSizer(config), cache, new PlacementEngine(),
                metrics, config, clock);
        reconciler = new Reconciler(platform, registry, resources, metricsSource,
                new WorkloadScaler(config, metrics), new ChildObjectFactory(), new WorkloadValidator(),
                metrics, config, clock);
    }

    @Test
    @DisplayName("A new workload gets its children and reaches Running once both replicas are ready")
    void testHappyPath_ReachesRunning() {
        // Given
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));

        // When
        ReconcileResult first = reconcile();

        // Then
        assertTrue(first.isRequeue());
        assertEquals(List.of(
                "update LLMWorkload ml/llama",
                "create ConfigMap ml/llama-config",
                "create Deployment ml/llama",
                "create Service ml/llama",
                "status LLMWorkload ml/llama"), platform.getWrites());
        assertEquals(new ResourceCapacity(2400, 12 * GI, 1, 0), cache.allocationOf(KEY).orElseThrow().getEnvelope());
        Deployment deployment = platform.get(Deployment.class, NS, "llama");
        assertEquals(2, deployment.getSpec().getReplicas());
        assertEquals("25%", deployment.getSpec().getStrategy().getRollingUpdate().getMaxUnavailable().getStrVal());
        assertEquals("25%", deployment.getSpec().getStrategy().getRollingUpdate().getMaxSurge().getStrVal());
        assertEquals("ghcr.io/llm-orchestrator/llama-7b:v1",
                deployment.getSpec().getTemplate().getSpec().getContainers().get(0).getImage());
        assertEquals(WorkloadPhase.PROGRESSING, status().getPhase());
        assertFalse(status().isConditionTrue(WorkloadCondition.READY));

        // When
        platform.markDeploymentReady(NS, "llama");
        ReconcileResult second = reconcile();

        // Then
        assertEquals(ReconcileResult.Outcome.DONE, second.getOutcome());
        LlmWorkloadStatus status = status();
        assertEquals(WorkloadPhase.RUNNING, status.getPhase());
        assertTrue(status.isConditionTrue(WorkloadCondition.READY));
        assertEquals(2, status.getReadyReplicas());
        assertEquals(2, status.getDesiredReplicas());
        assertEquals(cache.allocationOf(KEY).orElseThrow().getNodeName(), status.getNodeName());
        assertEquals(List.of("http://llama.ml.svc.cluster.local", "grpc://llama.ml.svc.cluster.local:9090"),
                status.getEndpoints());
        assertEquals(1L, status.getObservedGeneration());
    }

    @Test
    @DisplayName("An unknown model fails the workload within one pass and creates nothing")
    void testModelNotFound_FailsWithoutChildren() {
        // Given
        LlmWorkload workload = TestFixtures.llamaWorkload(NS, "llama");
        workload.getSpec().setModelName("nonexistent");
        platform.submit(workload);

        // When
        ReconcileResult result = reconcile();

        // Then
        assertEquals(ReconcileResult.Outcome.FAILED, result.getOutcome());
        assertEquals(ModelNotFoundException.REASON, result.getReason());
        LlmWorkloadStatus status = status();
        assertEquals(WorkloadPhase.FAILED, status.getPhase());
        WorkloadCondition ready = status.findCondition(WorkloadCondition.READY).orElseThrow();
        assertEquals(WorkloadCondition.FALSE, ready.getStatus());
        assertEquals(ModelNotFoundException.REASON, ready.getReason());
        assertTrue(platform.getWrites().stream().noneMatch(w -> w.startsWith("create")), platform.getWrites().toString());
        assertFalse(cache.allocationOf(KEY).isPresent());

        // A failed workload is left alone until its spec changes
        platform.clearWrites();
        assertEquals(ReconcileResult.Outcome.DONE, reconcile().getOutcome());
        assertTrue(platform.getWrites().isEmpty());
        assertEquals(1.0, meterRegistry.get(MetricsNames.RECONCILE_FAILURES)
                .tag(MetricsTags.REASON, ModelNotFoundException.REASON).counter().count());
    }

    @Test
    void testFailedWorkload_RetriedAfterSpecChange() {
        LlmWorkload workload = TestFixtures.llamaWorkload(NS, "llama");
        workload.getSpec().setModelName("nonexistent");
        platform.submit(workload);
        reconcile();

        platform.editSpec(KEY, spec -> spec.setModelName("llama-7b"));
        reconcile();

        assertEquals(WorkloadPhase.PROGRESSING, status().getPhase());
        assertTrue(platform.contains(Deployment.class, NS, "llama"));
    }

    @Test
    @DisplayName("A full cluster marks the workload Unschedulable and it advances once capacity frees up")
    void testNoFeasibleNode_UnschedulableThenAdvances() {
        // Given
        metricsSource.setNodeUsage("node-a", new ResourceCapacity(7200, 0, 0, 0));
        metricsSource.setNodeUsage("node-b", new ResourceCapacity(7200, 0, 0, 0));
        cache.refresh();
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));

        // When
        ReconcileResult result = reconcile();

        // Then
        assertTrue(result.isRequeue());
        assertEquals(NoFeasibleNodeException.REASON, result.getReason());
        assertNotNull(result.getRequeueAfter());
        LlmWorkloadStatus status = status();
        assertEquals(WorkloadPhase.PENDING, status.getPhase());
        WorkloadCondition progressing = status.findCondition(WorkloadCondition.PROGRESSING).orElseThrow();
        assertEquals(WorkloadCondition.FALSE, progressing.getStatus());
        assertEquals(NoFeasibleNodeException.REASON, progressing.getReason());
        assertFalse(cache.allocationOf(KEY).isPresent());
        assertFalse(platform.contains(Deployment.class, NS, "llama"));

        // When
        metricsSource.setNodeUsage("node-b", new ResourceCapacity(1000, 0, 0, 0));
        cache.refresh();
        reconcile();

        // Then
        assertEquals("node-b", cache.allocationOf(KEY).orElseThrow().getNodeName());
        assertEquals(WorkloadPhase.PROGRESSING, status().getPhase());
        assertTrue(status().isConditionTrue(WorkloadCondition.PROGRESSING));
    }

    @Test
    @DisplayName("Changing the model version rolls the deployment and returns to Running")
    void testRollingUpdate_UpdatesTemplate() {
        // Given
        runToRunning();
        String node = cache.allocationOf(KEY).orElseThrow().getNodeName();
        platform.clearWrites();

        // When
        platform.editSpec(KEY, spec -> spec.setModelVersion("v2"));
        ReconcileResult rolling = reconcile();

        // Then
        assertTrue(rolling.isRequeue());
        assertEquals(List.of(
                "update ConfigMap ml/llama-config",
                "update Deployment ml/llama",
                "status LLMWorkload ml/llama"), platform.getWrites());
        Deployment deployment = platform.get(Deployment.class, NS, "llama");
        assertEquals("ghcr.io/llm-orchestrator/llama-7b:v2",
                deployment.getSpec().getTemplate().getSpec().getContainers().get(0).getImage());
        assertEquals("25%", deployment.getSpec().getStrategy().getRollingUpdate().getMaxUnavailable().getStrVal());
        assertEquals("v2", platform.get(ConfigMap.class, NS, "llama-config").getData().get("model_version"));
        assertEquals(WorkloadPhase.PROGRESSING, status().getPhase());
        assertTrue(status().isConditionTrue(WorkloadCondition.DEGRADED));
        assertEquals(node, cache.allocationOf(KEY).orElseThrow().getNodeName());

        // When
        platform.markDeploymentReady(NS, "llama");
        reconcile();

        // Then
        assertEquals(WorkloadPhase.RUNNING, status().getPhase());
        assertFalse(status().isConditionTrue(WorkloadCondition.DEGRADED));
        assertEquals(2L, status().getObservedGeneration());
    }

    @Test
    @DisplayName("Deleting a workload removes service, deployment and config map, then the finalizer")
    void testDeletion_TearsDownInOrder() {
        // Given
        runToRunning();
        platform.clearWrites();

        // When
        platform.markForDeletion(KEY);
        ReconcileResult result = reconcile();

        // Then
        assertEquals(ReconcileResult.Outcome.DONE, result.getOutcome());
        assertEquals(List.of(
                "status LLMWorkload ml/llama",
                "delete Service ml/llama",
                "delete Deployment ml/llama",
                "delete ConfigMap ml/llama-config",
                "update LLMWorkload ml/llama"), platform.getWrites());
        assertNull(platform.getWorkload(KEY));
        assertFalse(cache.allocationOf(KEY).isPresent());
        assertEquals(8000, cache.snapshot().node("node-a").orElseThrow().getAvailable().getCpuMillis());
    }

    @Test
    @DisplayName("The finalizer stays while any child still exists")
    void testFinalizerSafety_WaitsForChildren() {
        // Given
        runToRunning();
        platform.retainOnDelete(Deployment.class);

        // When
        platform.markForDeletion(KEY);
        ReconcileResult first = reconcile();
        ReconcileResult second = reconcile();

        // Then
        assertEquals(Reconciler.TEARDOWN_RECHECK, first.getRequeueAfter());
        assertEquals(Reconciler.TEARDOWN_RECHECK, second.getRequeueAfter());
        LlmWorkload workload = platform.getWorkload(KEY);
        assertNotNull(workload);
        assertTrue(workload.getMetadata().getFinalizers().contains(WorkloadLabels.FINALIZER));
        assertEquals(WorkloadPhase.TERMINATING, workload.getStatus().getPhase());
        assertTrue(cache.allocationOf(KEY).isPresent());
    }

    @Test
    @DisplayName("A second pass with nothing changed writes nothing")
    void testIdempotence_SecondPassWritesNothing() {
        // Given
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));
        reconcile();
        platform.clearWrites();

        // When
        reconcile();

        // Then
        assertTrue(platform.getWrites().isEmpty(), platform.getWrites().toString());

        // Same once Running
        platform.markDeploymentReady(NS, "llama");
        reconcile();
        platform.clearWrites();
        reconcile();
        assertTrue(platform.getWrites().isEmpty(), platform.getWrites().toString());
    }

    @Test
    void testReadyRequiresEveryDesiredReplica() {
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));
        reconcile();
        Deployment deployment = platform.get(Deployment.class, NS, "llama");
        deployment.setStatus(new DeploymentStatusBuilder()
                .withReplicas(2)
                .withReadyReplicas(1)
                .withUpdatedReplicas(2)
                .withObservedGeneration(deployment.getMetadata().getGeneration())
                .build());
        platform.seed(deployment);

        reconcile();
        assertEquals(WorkloadPhase.PROGRESSING, status().getPhase());
        assertFalse(status().isConditionTrue(WorkloadCondition.READY));
        assertEquals(1, status().getReadyReplicas());

        platform.markDeploymentReady(NS, "llama");
        reconcile();
        assertEquals(WorkloadPhase.RUNNING, status().getPhase());
        assertTrue(status().isConditionTrue(WorkloadCondition.READY));
    }

    @Test
    void testTerminatingNeverReturnsToRunning() {
        runToRunning();
        platform.retainOnDelete(Service.class);
        platform.markForDeletion(KEY);

        for (int i = 0; i < 3; i++) {
            reconcile();
            assertEquals(WorkloadPhase.TERMINATING, status().getPhase());
            assertFalse(status().isConditionTrue(WorkloadCondition.READY));
        }
    }

    @Test
    @DisplayName("A cancelled pass leaves only what was already written and the next pass converges")
    void testCancellation_NextPassConverges() {
        // Given
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));
        ReconcileContext ctx = ReconcileContext.unbounded(clock);
        platform.onCreate(object -> {
            if (object instanceof ConfigMap) {
                ctx.cancel();
            }
        });

        // When
        ReconcileResult cancelled = reconciler.reconcile(KEY, ctx);

        // Then
        assertEquals(ReconcileResult.Outcome.CANCELLED, cancelled.getOutcome());
        assertTrue(platform.contains(ConfigMap.class, NS, "llama-config"));
        assertFalse(platform.contains(Deployment.class, NS, "llama"));
        assertFalse(platform.contains(Service.class, NS, "llama"));

        // When
        platform.onCreate(object -> { });
        platform.clearWrites();
        reconcile();

        // Then
        assertEquals(List.of(
                "create Deployment ml/llama",
                "create Service ml/llama",
                "status LLMWorkload ml/llama"), platform.getWrites());
    }

    @Test
    void testExpiredDeadline_RequeuesBeforeFirstWrite() {
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));
        ReconcileContext ctx = ReconcileContext.withTimeout(Duration.ofSeconds(5), clock);
        clock.advance(Duration.ofSeconds(6));

        ReconcileResult result = reconciler.reconcile(KEY, ctx);

        assertTrue(result.isRequeue());
        assertEquals(ReconcileCancelledException.DEADLINE_REASON, result.getReason());
        assertTrue(platform.getWrites().isEmpty());
        assertEquals(1.0, meterRegistry.get(MetricsNames.RECONCILE_FAILURES)
                .tag(MetricsTags.REASON, ReconcileCancelledException.DEADLINE_REASON).counter().count());
    }

    @Test
    @DisplayName("An unexpected failure is retried once and fails the workload the second time")
    void testUnexpectedFailure_RetriedOnceThenFailed() {
        // Given
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));
        platform.onCreate(object -> {
            throw new IllegalStateException("boom");
        });

        // When
        ReconcileResult first = reconcile();

        // Then
        assertTrue(first.isRequeue());
        assertEquals(Reconciler.INTERNAL_REASON, first.getReason());
        assertTrue(status() == null || status().getPhase() != WorkloadPhase.FAILED);

        // When
        ReconcileResult second = reconcile();

        // Then
        assertEquals(ReconcileResult.Outcome.FAILED, second.getOutcome());
        assertEquals(Reconciler.INTERNAL_REASON, second.getReason());
        assertEquals(WorkloadPhase.FAILED, status().getPhase());
        assertEquals(Reconciler.INTERNAL_REASON,
                status().findCondition(WorkloadCondition.READY).orElseThrow().getReason());
        assertEquals(2.0, meterRegistry.get(MetricsNames.RECONCILE_FAILURES)
                .tag(MetricsTags.REASON, Reconciler.INTERNAL_REASON).counter().count());
    }

    @Test
    @DisplayName("A child without the workload's owner reference fails the workload and is left untouched")
    void testOwnershipConflict_FailsWithOwnedByOther() {
        // Given
        platform.seed(new ServiceBuilder()
                .withNewMetadata().withName("llama").withNamespace(NS).endMetadata()
                .withNewSpec().withType("ClusterIP").endSpec()
                .build());
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));

        // When
        ReconcileResult result = reconcile();

        // Then
        assertEquals(ReconcileResult.Outcome.FAILED, result.getOutcome());
        assertEquals(OwnershipConflictException.REASON, result.getReason());
        assertEquals(WorkloadPhase.FAILED, status().getPhase());
        assertEquals(OwnershipConflictException.REASON,
                status().findCondition(WorkloadCondition.READY).orElseThrow().getReason());
        assertTrue(platform.getWrites().stream().noneMatch(w -> w.startsWith("create")), platform.getWrites().toString());
        assertTrue(platform.get(Service.class, NS, "llama").getMetadata().getOwnerReferences().isEmpty());
    }

    @Test
    void testInvalidSpec_FailsWithoutRetry() {
        LlmWorkload workload = TestFixtures.llamaWorkload(NS, "llama");
        workload.getSpec().getScaling().setMaxReplicas(1);
        platform.submit(workload);

        ReconcileResult result = reconcile();

        assertEquals(ReconcileResult.Outcome.FAILED, result.getOutcome());
        assertEquals(WorkloadValidationException.REASON, result.getReason());
        assertEquals(WorkloadPhase.FAILED, status().getPhase());
    }

    @Test
    void testRegistryUnavailable_RequeuesAndKeepsPhase() {
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));
        registry.setAvailable(false);

        ReconcileResult result = reconcile();

        assertTrue(result.isRequeue());
        assertEquals(RegistryUnavailableException.REASON, result.getReason());
        assertNull(status());
        assertEquals(1.0, meterRegistry.get(MetricsNames.RECONCILES)
                .tag(MetricsTags.RESULT, "requeue").counter().count());
    }

    @Test
    void testMissingWorkload_ReleasesLeftoverAllocation() {
        WorkloadKey gone = WorkloadKey.of(NS, "gone");
        cache.applyAllocation(ResourceAllocation.builder()
                .namespace(NS).workloadName("gone").nodeName("node-a").modelName("llama-7b")
                .envelope(new ResourceCapacity(1000, GI, 0, 0))
                .qosClass(QualityClass.BASIC).allocatedAt(TestFixtures.T0)
                .build());

        ReconcileResult result = reconciler.reconcile(gone, ReconcileContext.unbounded(clock));

        assertEquals(ReconcileResult.Outcome.DONE, result.getOutcome());
        assertFalse(cache.allocationOf(gone).isPresent());
        assertTrue(platform.getWrites().isEmpty());
    }

    private void runToRunning() {
        platform.submit(TestFixtures.llamaWorkload(NS, "llama"));
        reconcile();
        platform.markDeploymentReady(NS, "llama");
        reconcile();
        assertEquals(WorkloadPhase.RUNNING, status().getPhase());
    }

    private ReconcileResult reconcile() {
        return reconciler.reconcile(KEY, ReconcileContext.unbounded(clock));
    }

    private LlmWorkloadStatus status() {
        return platform.getWorkload(KEY).getStatus();
    }
}
