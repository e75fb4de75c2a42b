package com.llmorch.orchestrator.k8s;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.error.PlatformTransientException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.HttpURLConnection;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link IPlatformClient} on top of the fabric8 Kubernetes client.
 * <p>
 * Client exceptions are translated: 404 becomes {@code null}/{@code false},
 * everything else a {@link PlatformTransientException} so that the reconciler
 * retries with back-off.
 * </p>
 */
public class KubernetesPlatformClient implements IPlatformClient {
    private static final Logger log = LoggerFactory.getLogger(KubernetesPlatformClient.class);

    private final KubernetesClient client;
    private final String namespace;

    /**
     * @param client    configured client
     * @param namespace namespace to watch, blank for all namespaces
     */
    public KubernetesPlatformClient(KubernetesClient client, String namespace) {
        this.client = client;
        this.namespace = namespace == null ? "" : namespace;
        log.info("Kubernetes platform client initialized (namespace={})",
                this.namespace.isBlank() ? "<all>" : this.namespace);
    }

    @Override
    public LlmWorkload getWorkload(WorkloadKey key) {
        return call("get workload " + key, () -> client.resources(LlmWorkload.class)
                .inNamespace(key.namespace())
                .withName(key.name())
                .get());
    }

    @Override
    public List<LlmWorkload> listWorkloads() {
        return call("list workloads", () -> namespace.isBlank()
                ? client.resources(LlmWorkload.class).inAnyNamespace().list().getItems()
                : client.resources(LlmWorkload.class).inNamespace(namespace).list().getItems());
    }

    @Override
    public LlmWorkload updateWorkload(LlmWorkload workload) {
        return call("update workload " + workload.key(), () -> client.resources(LlmWorkload.class)
                .inNamespace(workload.getMetadata().getNamespace())
                .resource(workload)
                .update());
    }

    @Override
    public LlmWorkload updateWorkloadStatus(LlmWorkload workload) {
        return call("update status of " + workload.key(), () -> client.resources(LlmWorkload.class)
                .inNamespace(workload.getMetadata().getNamespace())
                .resource(workload)
                .updateStatus());
    }

    @Override
    public <T extends HasMetadata> T get(Class<T> kind, String ns, String name) {
        return call("get " + kind.getSimpleName() + " " + ns + "/" + name,
                () -> client.resources(kind).inNamespace(ns).withName(name).get());
    }

    @Override
    public <T extends HasMetadata> T create(T object) {
        return call("create " + describe(object), () -> client.resource(object).create());
    }

    @Override
    public <T extends HasMetadata> T update(T object) {
        return call("update " + describe(object), () -> client.resource(object).update());
    }

    @Override
    public <T extends HasMetadata> boolean delete(Class<T> kind, String ns, String name) {
        Boolean deleted = call("delete " + kind.getSimpleName() + " " + ns + "/" + name,
                () -> !client.resources(kind).inNamespace(ns).withName(name).delete().isEmpty());
        return deleted != null && deleted;
    }

    @Override
    public List<Node> listNodes() {
        return call("list nodes", () -> client.nodes().list().getItems());
    }

    @Override
    public List<Pod> listPods() {
        return call("list pods", () -> client.pods().inAnyNamespace().list().getItems());
    }

    @Override
    public Closeable watchWorkloads(Consumer<WorkloadKey> onChange) {
        Watcher<LlmWorkload> watcher = new Watcher<>() {
            @Override
            public void eventReceived(Action action, LlmWorkload resource) {
                log.debug("Workload event {} for {}", action, resource.key());
                onChange.accept(resource.key());
            }

            @Override
            public void onClose(WatcherException cause) {
                log.warn("Workload watch closed: {}; periodic resync continues", cause.getMessage());
            }
        };
        return call("watch workloads", () -> namespace.isBlank()
                ? client.resources(LlmWorkload.class).inAnyNamespace().watch(watcher)
                : client.resources(LlmWorkload.class).inNamespace(namespace).watch(watcher));
    }

    @Override
    public Closeable watchOwnedDeployments(Consumer<WorkloadKey> onChange) {
        Watcher<Deployment> watcher = new Watcher<>() {
            @Override
            public void eventReceived(Action action, Deployment deployment) {
                String owner = deployment.getMetadata().getLabels() == null
                        ? null : deployment.getMetadata().getLabels().get(WorkloadLabels.WORKLOAD);
                if (owner != null) {
                    onChange.accept(WorkloadKey.of(deployment.getMetadata().getNamespace(), owner));
                }
            }

            @Override
            public void onClose(WatcherException cause) {
                log.warn("Deployment watch closed: {}; periodic resync continues", cause.getMessage());
            }
        };
        return call("watch deployments", () -> namespace.isBlank()
                ? client.apps().deployments().inAnyNamespace()
                    .withLabel(WorkloadLabels.MANAGED_BY, WorkloadLabels.MANAGED_BY_VALUE).watch(watcher)
                : client.apps().deployments().inNamespace(namespace)
                    .withLabel(WorkloadLabels.MANAGED_BY, WorkloadLabels.MANAGED_BY_VALUE).watch(watcher));
    }

    @Override
    public void ping() {
        call("ping", () -> client.getKubernetesVersion());
    }

    private static String describe(HasMetadata object) {
        return object.getKind() + " " + object.getMetadata().getNamespace() + "/" + object.getMetadata().getName();
    }

    private static <R> R call(String operation, Supplier<R> action) {
        try {
            return action.get();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                return null;
            }
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                throw new PlatformTransientException("Conflict during " + operation + ": " + e.getMessage(), e);
            }
            throw new PlatformTransientException("Platform call failed during " + operation
                    + " (code " + e.getCode() + "): " + e.getMessage(), e);
        }
    }
}
