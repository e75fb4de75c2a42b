package com.llmorch.orchestrator.reconcile;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.crd.LlmWorkloadSpec;
import com.llmorch.core.crd.LlmWorkloadStatus;
import com.llmorch.core.crd.WorkloadCondition;
import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.crd.WorkloadPhase;
import com.llmorch.core.model.ResourceAllocation;
import com.llmorch.core.model.ResourceRequirements;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.core.util.Backoff;
import com.llmorch.core.util.JsonUtils;
import com.llmorch.core.validation.FieldError;
import com.llmorch.core.validation.WorkloadValidator;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.error.NoFeasibleNodeException;
import com.llmorch.orchestrator.error.OrchestratorException;
import com.llmorch.orchestrator.error.OwnershipConflictException;
import com.llmorch.orchestrator.error.ReconcileCancelledException;
import com.llmorch.orchestrator.error.WorkloadValidationException;
import com.llmorch.orchestrator.k8s.IPlatformClient;
import com.llmorch.orchestrator.k8s.OwnerReferences;
import com.llmorch.orchestrator.metrics.IMetricsSource;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import com.llmorch.orchestrator.metrics.WorkloadMetrics;
import com.llmorch.orchestrator.registry.IModelRegistry;
import com.llmorch.orchestrator.registry.ModelResolution;
import com.llmorch.orchestrator.resource.ResourceManager;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Drives one workload's children and status toward its spec.
 * <p>
 * Pass order: finalizer, validation, model resolution, allocation, config map,
 * deployment, service, status. Every platform write is preceded by a
 * cancellation checkpoint. Children are only written through an owner
 * reference to the workload and only when their content hash differs, so an
 * unchanged workload produces no writes.
 * </p>
 * <p>
 * Errors are classified here and nowhere else: retryable failures requeue with
 * bounded back-off and keep the phase, non-retryable failures move the
 * workload to {@code Failed} until its spec changes, and unexpected failures
 * are retried once before the workload is failed.
 * </p>
 */
public class Reconciler implements IReconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    static final String INTERNAL_REASON = "Internal";
    static final Duration TEARDOWN_RECHECK = Duration.ofSeconds(2);
    static final Duration ROLLOUT_RECHECK = Duration.ofSeconds(10);

    private final IPlatformClient platform;
    private final IModelRegistry registry;
    private final ResourceManager resources;
    private final IMetricsSource metricsSource;
    private final WorkloadScaler scaler;
    private final ChildObjectFactory children;
    private final WorkloadValidator validator;
    private final OrchestratorMetrics metrics;
    private final OrchestratorConfig config;
    private final Clock clock;

    // Consecutive failures per workload, for back-off and the single Internal retry
    private final Map<WorkloadKey, Integer> retryAttempts = new ConcurrentHashMap<>();
    private final Map<WorkloadKey, Integer> internalFailures = new ConcurrentHashMap<>();

    public Reconciler(IPlatformClient platform,
                      IModelRegistry registry,
                      ResourceManager resources,
                      IMetricsSource metricsSource,
                      WorkloadScaler scaler,
                      ChildObjectFactory children,
                      WorkloadValidator validator,
                      OrchestratorMetrics metrics,
                      OrchestratorConfig config,
                      Clock clock) {
        this.platform = platform;
        this.registry = registry;
        this.resources = resources;
        this.metricsSource = metricsSource;
        this.scaler = scaler;
        this.children = children;
        this.validator = validator;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;

        log.info("Reconciler initialized");
    }

    @Override
    public ReconcileResult reconcile(WorkloadKey key, ReconcileContext ctx) {
        Instant start = clock.instant();
        ReconcileResult result;
        try {
            result = reconcileOnce(key, ctx);
            retryAttempts.remove(key);
            internalFailures.remove(key);
        } catch (ReconcileCancelledException e) {
            if (e.isDeadlineExceeded()) {
                metrics.recordReconcileFailure(e.getReason());
                result = onRetryable(key, e);
            } else {
                log.info("Reconcile of {} cancelled: {}", key, e.getMessage());
                result = ReconcileResult.cancelled();
            }
        } catch (OrchestratorException e) {
            metrics.recordReconcileFailure(e.getReason());
            result = e.isRetryable() ? onRetryable(key, e) : onTerminal(key, e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("✗ Unexpected failure reconciling {}", key, e);
            metrics.recordReconcileFailure(INTERNAL_REASON);
            int failures = internalFailures.merge(key, 1, Integer::sum);
            if (failures <= 1) {
                result = ReconcileResult.requeue(nextBackoff(key), INTERNAL_REASON);
            } else {
                internalFailures.remove(key);
                result = onTerminal(key, INTERNAL_REASON, "Internal error: " + e.getClass().getSimpleName());
            }
        }
        metrics.recordReconcile(Duration.between(start, clock.instant()), result.getOutcome().label());
        return result;
    }

    private ReconcileResult reconcileOnce(WorkloadKey key, ReconcileContext ctx) {
        ctx.checkpoint("read " + key);
        LlmWorkload workload = platform.getWorkload(key);
        if (workload == null) {
            resources.release(key);
            return ReconcileResult.done();
        }
        if (workload.isMarkedForDeletion()) {
            return teardown(workload, ctx);
        }

        LlmWorkloadStatus current = workload.getStatus() != null ? workload.getStatus() : new LlmWorkloadStatus();
        Long generation = workload.getMetadata().getGeneration();
        if (current.getPhase() == WorkloadPhase.FAILED && Objects.equals(current.getObservedGeneration(), generation)) {
            log.debug("{} is Failed at generation {}; waiting for a spec change", key, generation);
            return ReconcileResult.done();
        }

        if (!hasFinalizer(workload)) {
            ctx.checkpoint("add finalizer to " + key);
            List<String> finalizers = new ArrayList<>(finalizers(workload));
            finalizers.add(WorkloadLabels.FINALIZER);
            workload.getMetadata().setFinalizers(finalizers);
            workload = platform.updateWorkload(workload);
            log.info("Finalizer attached to {}", key);
        }

        LlmWorkloadSpec spec = workload.getSpec();
        List<FieldError> errors = validator.validate(spec);
        if (!errors.isEmpty()) {
            throw new WorkloadValidationException(errors);
        }

        ModelResolution resolution = registry.resolve(spec.getModelName(), spec.getEffectiveModelVersion());
        ResourceRequirements requirements = resources.size(spec, resolution.hints().orElse(null));
        ResourceAllocation allocation = resources.allocate(workload, requirements);

        String name = workload.getMetadata().getName();
        ConfigMap existingConfig = owned(workload, platform.get(ConfigMap.class, key.namespace(), ChildObjectFactory.configMapName(name)));
        Deployment existingDeployment = owned(workload, platform.get(Deployment.class, key.namespace(), name));
        Service existingService = owned(workload, platform.get(Service.class, key.namespace(), name));

        int currentReplicas = existingDeployment != null && existingDeployment.getSpec() != null
                && existingDeployment.getSpec().getReplicas() != null
                ? existingDeployment.getSpec().getReplicas() : 0;
        WorkloadMetrics observed = currentReplicas > 0
                ? metricsSource.workloadMetrics(key, requirements.getRequested())
                : WorkloadMetrics.EMPTY;
        Instant now = clock.instant();
        ScalingDecision decision = scaler.decide(spec.getScaling(), currentReplicas, observed,
                parseTime(current.getLastScaleTime(), key), now);

        WorkloadPlan plan = WorkloadPlan.builder()
                .image(resolution.imageOr(config.getDefaultImage()))
                .modelVersion(resolution.getVersion())
                .requirements(requirements)
                .nodeName(allocation.getNodeName())
                .replicas(decision.getTargetReplicas())
                .build();

        ConfigMap configMap = apply(children.configMap(workload, plan), existingConfig, ctx);
        Deployment deployment = apply(children.deployment(workload, plan, configMap), existingDeployment, ctx);
        apply(children.service(workload), existingService, ctx);

        return writeStatus(workload, current, deployment, plan, decision, now, ctx);
    }

    private ReconcileResult writeStatus(LlmWorkload workload,
                                        LlmWorkloadStatus current,
                                        Deployment deployment,
                                        WorkloadPlan plan,
                                        ScalingDecision decision,
                                        Instant now,
                                        ReconcileContext ctx) {
        int desired = plan.getReplicas();
        int minReplicas = workload.getSpec().getScaling() != null
                ? workload.getSpec().getScaling().getEffectiveMinReplicas() : 1;
        DeploymentStatus observed = deployment.getStatus();
        int ready = observed != null && observed.getReadyReplicas() != null ? observed.getReadyReplicas() : 0;
        int replicas = observed != null && observed.getReplicas() != null ? observed.getReplicas() : 0;
        boolean rolledOut = isRolledOut(deployment, desired);
        boolean running = rolledOut && ready == desired && replicas == desired && desired > 0 && desired >= minReplicas;

        LlmWorkloadStatus next = JsonUtils.copy(current);
        next.setPhase(running ? WorkloadPhase.RUNNING : WorkloadPhase.PROGRESSING);
        next.setReplicas(replicas);
        next.setReadyReplicas(ready);
        next.setDesiredReplicas(desired);
        next.setNodeName(plan.getNodeName());
        next.setEndpoints(new ArrayList<>(ChildObjectFactory.endpoints(workload)));
        next.setCurrentMetrics(new TreeMap<>(decision.getObserved()));
        next.setObservedGeneration(workload.getMetadata().getGeneration());
        if (decision.isScaling()) {
            next.setLastScaleTime(now.toString());
        }
        next.putCondition(WorkloadCondition.PROGRESSING, WorkloadCondition.TRUE, "ChildrenApplied",
                "Config map, deployment and service are up to date", now);
        if (running) {
            next.putCondition(WorkloadCondition.READY, WorkloadCondition.TRUE, "AllReplicasReady",
                    ready + "/" + desired + " replicas ready", now);
            next.putCondition(WorkloadCondition.DEGRADED, WorkloadCondition.FALSE, "AllReplicasReady", "", now);
        } else {
            next.putCondition(WorkloadCondition.READY, WorkloadCondition.FALSE, "ReplicasNotReady",
                    ready + "/" + desired + " replicas ready", now);
            boolean wasRunning = current.getPhase() == WorkloadPhase.RUNNING;
            next.putCondition(WorkloadCondition.DEGRADED, wasRunning ? WorkloadCondition.TRUE : WorkloadCondition.FALSE,
                    wasRunning ? "ReplicasUnavailable" : "RollingOut", "", now);
        }

        if (!next.equals(current)) {
            ctx.checkpoint("update status of " + workload.key());
            if (current.getPhase() != next.getPhase()) {
                log.info("{} phase {} -> {}", workload.key(), current.getPhase(), next.getPhase());
            }
            workload.setStatus(next);
            try {
                platform.updateWorkloadStatus(workload);
            } catch (OrchestratorException e) {
                // Children are already written; the status catches up on the retry
                log.warn("✗ Status update of {} failed: {}", workload.key(), e.getMessage());
                return ReconcileResult.requeue(nextBackoff(workload.key()), e.getReason());
            }
        }
        return running ? ReconcileResult.done() : ReconcileResult.requeue(ROLLOUT_RECHECK, "waiting for replicas");
    }

    /**
     * Deletes children in reverse dependency order and removes the finalizer once
     * none of them is left.
     */
    private ReconcileResult teardown(LlmWorkload workload, ReconcileContext ctx) {
        WorkloadKey key = workload.key();
        if (!hasFinalizer(workload)) {
            resources.release(key);
            return ReconcileResult.done();
        }

        LlmWorkloadStatus status = workload.getStatus() != null ? workload.getStatus() : new LlmWorkloadStatus();
        if (status.getPhase() != WorkloadPhase.TERMINATING) {
            LlmWorkloadStatus next = JsonUtils.copy(status);
            next.setPhase(WorkloadPhase.TERMINATING);
            next.putCondition(WorkloadCondition.READY, WorkloadCondition.FALSE, "Terminating",
                    "Workload is being deleted", clock.instant());
            ctx.checkpoint("mark " + key + " terminating");
            workload.setStatus(next);
            try {
                workload = platform.updateWorkloadStatus(workload);
            } catch (OrchestratorException e) {
                log.warn("✗ Status update of {} failed: {}", key, e.getMessage());
            }
            log.info("{} phase {} -> {}", key, status.getPhase(), WorkloadPhase.TERMINATING);
        }

        String name = key.name();
        deleteOwned(workload, Service.class, name, ctx);
        deleteOwned(workload, Deployment.class, name, ctx);
        deleteOwned(workload, ConfigMap.class, ChildObjectFactory.configMapName(name), ctx);

        if (stillPresent(workload, Service.class, name)
                || stillPresent(workload, Deployment.class, name)
                || stillPresent(workload, ConfigMap.class, ChildObjectFactory.configMapName(name))) {
            log.info("Children of {} still present; rechecking in {}", key, TEARDOWN_RECHECK);
            return ReconcileResult.requeue(TEARDOWN_RECHECK, "children still present");
        }

        resources.release(key);

        ctx.checkpoint("remove finalizer from " + key);
        LlmWorkload latest = platform.getWorkload(key);
        if (latest == null) {
            return ReconcileResult.done();
        }
        List<String> finalizers = new ArrayList<>(finalizers(latest));
        finalizers.remove(WorkloadLabels.FINALIZER);
        latest.getMetadata().setFinalizers(finalizers);
        platform.updateWorkload(latest);
        log.info("✓ Teardown of {} complete, finalizer removed", key);
        return ReconcileResult.done();
    }

    private ReconcileResult onRetryable(WorkloadKey key, OrchestratorException e) {
        Duration delay = nextBackoff(key);
        log.warn("✗ Reconcile of {} failed ({}), requeue in {}: {}", key, e.getReason(), delay, e.getMessage());
        if (e instanceof NoFeasibleNodeException) {
            updateStatusQuietly(key, status -> {
                if (status.getPhase() == null) {
                    status.setPhase(WorkloadPhase.PENDING);
                }
                status.putCondition(WorkloadCondition.PROGRESSING, WorkloadCondition.FALSE,
                        NoFeasibleNodeException.REASON, e.getMessage(), clock.instant());
            });
        }
        return ReconcileResult.requeue(delay, e.getReason());
    }

    private ReconcileResult onTerminal(WorkloadKey key, String reason, String message) {
        retryAttempts.remove(key);
        log.warn("✗ {} failed: {} ({})", key, reason, message);
        updateStatusQuietly(key, status -> {
            status.setPhase(WorkloadPhase.FAILED);
            status.putCondition(WorkloadCondition.READY, WorkloadCondition.FALSE, reason, message, clock.instant());
            status.putCondition(WorkloadCondition.PROGRESSING, WorkloadCondition.FALSE, reason, message, clock.instant());
        });
        return ReconcileResult.failed(reason);
    }

    private void updateStatusQuietly(WorkloadKey key, Consumer<LlmWorkloadStatus> mutation) {
        try {
            LlmWorkload workload = platform.getWorkload(key);
            if (workload == null || workload.isMarkedForDeletion()) {
                return;
            }
            LlmWorkloadStatus current = workload.getStatus() != null ? workload.getStatus() : new LlmWorkloadStatus();
            LlmWorkloadStatus next = JsonUtils.copy(current);
            mutation.accept(next);
            next.setObservedGeneration(workload.getMetadata().getGeneration());
            if (!next.equals(current)) {
                workload.setStatus(next);
                platform.updateWorkloadStatus(workload);
            }
        } catch (OrchestratorException e) {
            log.warn("✗ Status update of {} failed: {}", key, e.getMessage());
        }
    }

    private <T extends HasMetadata> T apply(T desired, T existing, ReconcileContext ctx) {
        String kind = desired.getKind();
        String ref = desired.getMetadata().getNamespace() + "/" + desired.getMetadata().getName();
        if (existing == null) {
            ctx.checkpoint("create " + kind + " " + ref);
            T created = platform.create(desired);
            log.info("Created {} {}", kind, ref);
            return created;
        }
        if (Objects.equals(ChildObjectFactory.specHash(existing), ChildObjectFactory.specHash(desired))) {
            return existing;
        }
        desired.getMetadata().setResourceVersion(existing.getMetadata().getResourceVersion());
        if (desired instanceof Service && existing instanceof Service) {
            // Cluster IPs are assigned by the platform and immutable
            Service desiredService = (Service) desired;
            Service existingService = (Service) existing;
            desiredService.getSpec().setClusterIP(existingService.getSpec().getClusterIP());
            desiredService.getSpec().setClusterIPs(existingService.getSpec().getClusterIPs());
        }
        ctx.checkpoint("update " + kind + " " + ref);
        T updated = platform.update(desired);
        log.info("Updated {} {}", kind, ref);
        return updated;
    }

    private <T extends HasMetadata> T owned(LlmWorkload workload, T existing) {
        if (existing != null && !OwnerReferences.isOwnedBy(existing, workload)) {
            throw new OwnershipConflictException(existing.getKind(), existing.getMetadata().getNamespace(),
                    existing.getMetadata().getName());
        }
        return existing;
    }

    private <T extends HasMetadata> void deleteOwned(LlmWorkload workload, Class<T> kind, String name, ReconcileContext ctx) {
        T existing = platform.get(kind, workload.getMetadata().getNamespace(), name);
        if (existing == null) {
            return;
        }
        if (!OwnerReferences.isOwnedBy(existing, workload)) {
            log.warn("Leaving {} {}/{} in place: not owned by the workload", kind.getSimpleName(),
                    workload.getMetadata().getNamespace(), name);
            return;
        }
        ctx.checkpoint("delete " + kind.getSimpleName() + " " + name);
        platform.delete(kind, workload.getMetadata().getNamespace(), name);
        log.info("Deleted {} {}/{}", kind.getSimpleName(), workload.getMetadata().getNamespace(), name);
    }

    private <T extends HasMetadata> boolean stillPresent(LlmWorkload workload, Class<T> kind, String name) {
        T existing = platform.get(kind, workload.getMetadata().getNamespace(), name);
        return existing != null && OwnerReferences.isOwnedBy(existing, workload);
    }

    private Duration nextBackoff(WorkloadKey key) {
        int attempt = retryAttempts.merge(key, 1, Integer::sum) - 1;
        Duration jitter = config.getBackoffBase().dividedBy(2);
        return Backoff.next(attempt, config.getBackoffBase(), config.getBackoffMax(), jitter);
    }

    private static boolean isRolledOut(Deployment deployment, int desired) {
        DeploymentStatus status = deployment.getStatus();
        if (status == null) {
            return false;
        }
        Long generation = deployment.getMetadata().getGeneration();
        if (generation != null && status.getObservedGeneration() != null && status.getObservedGeneration() < generation) {
            return false;
        }
        return status.getUpdatedReplicas() == null || status.getUpdatedReplicas() == desired;
    }

    private static boolean hasFinalizer(LlmWorkload workload) {
        return finalizers(workload).contains(WorkloadLabels.FINALIZER);
    }

    private static List<String> finalizers(LlmWorkload workload) {
        List<String> finalizers = workload.getMetadata().getFinalizers();
        return finalizers != null ? finalizers : List.of();
    }

    private static Instant parseTime(String value, WorkloadKey key) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable lastScaleTime '{}' of {}", value, key);
            return null;
        }
    }
}
