package com.llmorch.orchestrator.k8s;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.error.PlatformTransientException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;

import java.io.Closeable;
import java.util.List;
import java.util.function.Consumer;

/**
 * Narrow view of the container platform used by the orchestrator.
 * <p>
 * Every method may throw {@link PlatformTransientException} for timeouts,
 * optimistic-concurrency conflicts and server errors. Lookups of absent
 * objects return {@code null} rather than throwing.
 * </p>
 */
public interface IPlatformClient {

    LlmWorkload getWorkload(WorkloadKey key);

    /**
     * @return workloads in the watched namespace, or in all namespaces
     */
    List<LlmWorkload> listWorkloads();

    /**
     * Writes metadata and spec (finalizers included). Fails with a conflict
     * when the resource version is stale.
     */
    LlmWorkload updateWorkload(LlmWorkload workload);

    LlmWorkload updateWorkloadStatus(LlmWorkload workload);

    <T extends HasMetadata> T get(Class<T> kind, String namespace, String name);

    <T extends HasMetadata> T create(T object);

    <T extends HasMetadata> T update(T object);

    /**
     * @return true when something was deleted, false when it was already absent
     */
    <T extends HasMetadata> boolean delete(Class<T> kind, String namespace, String name);

    List<Node> listNodes();

    /**
     * @return pods across all namespaces
     */
    List<Pod> listPods();

    /**
     * Subscribes to workload changes. Each event carries the affected key.
     */
    Closeable watchWorkloads(Consumer<WorkloadKey> onChange);

    /**
     * Subscribes to changes of deployments labelled as managed by the orchestrator;
     * events carry the owning workload's key.
     */
    Closeable watchOwnedDeployments(Consumer<WorkloadKey> onChange);

    /**
     * Cheap reachability check.
     *
     * @throws PlatformTransientException when the API server cannot be reached
     */
    void ping();
}
