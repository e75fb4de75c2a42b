package com.llmorch.orchestrator.reconcile;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.crd.LlmWorkloadSpec;
import com.llmorch.core.crd.PlacementSpec;
import com.llmorch.core.crd.SecuritySpec;
import com.llmorch.core.crd.WorkloadLabels;
import com.llmorch.core.util.ContentHash;
import com.llmorch.orchestrator.k8s.OwnerReferences;
import com.llmorch.orchestrator.k8s.ResourceQuantities;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.NodeSelectorRequirementBuilder;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.PreferredSchedulingTermBuilder;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.ProbeBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.Toleration;
import io.fabric8.kubernetes.api.model.TolerationBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the desired config map, deployment and service of a workload.
 * <p>
 * Each object carries a controller owner reference to the workload and a
 * {@link WorkloadLabels#SPEC_HASH} annotation over its own content, which the
 * reconciler compares to skip writes that would change nothing.
 * </p>
 */
public class ChildObjectFactory {
    public static final String CONTAINER_NAME = "llm-server";
    public static final int HTTP_PORT = 8080;
    public static final int GRPC_PORT = 9090;
    public static final int SERVICE_HTTP_PORT = 80;
    public static final String CONFIG_MOUNT_PATH = "/etc/config";

    public static String configMapName(String workloadName) {
        return workloadName + "-config";
    }

    public ConfigMap configMap(LlmWorkload workload, WorkloadPlan plan) {
        LlmWorkloadSpec spec = workload.getSpec();
        Map<String, String> data = new TreeMap<>();
        if (spec.getParameters() != null) {
            data.putAll(spec.getParameters());
        }
        // model keys always reflect the resolved model
        data.put("model_name", spec.getModelName());
        data.put("model_version", plan.getModelVersion());
        data.put("model_type", nullToEmpty(spec.getModelType()));

        ConfigMap configMap = new ConfigMapBuilder()
                .withMetadata(metadata(workload, configMapName(workload.getMetadata().getName()), baseLabels(workload)))
                .withData(data)
                .build();
        return withSpecHash(configMap);
    }

    public Deployment deployment(LlmWorkload workload, WorkloadPlan plan, ConfigMap configMap) {
        LlmWorkloadSpec spec = workload.getSpec();
        String name = workload.getMetadata().getName();

        Map<String, String> podLabels = baseLabels(workload);
        podLabels.put(WorkloadLabels.MODEL, spec.getModelName());
        podLabels.put(WorkloadLabels.MODEL_VERSION, plan.getModelVersion());

        Map<String, String> podAnnotations = new TreeMap<>(securityAnnotations(spec.getSecurity()));
        podAnnotations.put(WorkloadLabels.CONFIG_HASH, ContentHash.of(configMap.getData()));

        Deployment deployment = new DeploymentBuilder()
                .withMetadata(metadata(workload, name, podLabels))
                .withNewSpec()
                    .withReplicas(plan.getReplicas())
                    .withNewSelector()
                        .withMatchLabels(selector(workload))
                    .endSelector()
                    .withNewStrategy()
                        .withType("RollingUpdate")
                        .withNewRollingUpdate()
                            .withMaxUnavailable(new IntOrString("25%"))
                            .withMaxSurge(new IntOrString("25%"))
                        .endRollingUpdate()
                    .endStrategy()
                    .withNewTemplate()
                        .withNewMetadata()
                            .withLabels(podLabels)
                            .withAnnotations(podAnnotations)
                        .endMetadata()
                        .withNewSpec()
                            .withContainers(container(spec, plan))
                            .addNewVolume()
                                .withName("config")
                                .withNewConfigMap()
                                    .withName(configMap.getMetadata().getName())
                                .endConfigMap()
                            .endVolume()
                            .withNodeSelector(nodeSelector(spec.getPlacement()))
                            .withTolerations(tolerations(spec.getPlacement(), plan))
                            .withNewAffinity()
                                .withNewNodeAffinity()
                                    .withPreferredDuringSchedulingIgnoredDuringExecution(new PreferredSchedulingTermBuilder()
                                            .withWeight(100)
                                            .withNewPreference()
                                                .withMatchExpressions(new NodeSelectorRequirementBuilder()
                                                        .withKey(WorkloadLabels.HOSTNAME)
                                                        .withOperator("In")
                                                        .withValues(plan.getNodeName())
                                                        .build())
                                            .endPreference()
                                            .build())
                                .endNodeAffinity()
                            .endAffinity()
                        .endSpec()
                    .endTemplate()
                .endSpec()
                .build();
        return withSpecHash(deployment);
    }

    public Service service(LlmWorkload workload) {
        String name = workload.getMetadata().getName();
        Service service = new ServiceBuilder()
                .withMetadata(metadata(workload, name, baseLabels(workload)))
                .withNewSpec()
                    .withType("ClusterIP")
                    .withSelector(selector(workload))
                    .addNewPort()
                        .withName("http")
                        .withProtocol("TCP")
                        .withPort(SERVICE_HTTP_PORT)
                        .withTargetPort(new IntOrString(HTTP_PORT))
                    .endPort()
                    .addNewPort()
                        .withName("grpc")
                        .withProtocol("TCP")
                        .withPort(GRPC_PORT)
                        .withTargetPort(new IntOrString(GRPC_PORT))
                    .endPort()
                .endSpec()
                .build();
        return withSpecHash(service);
    }

    /**
     * @return cluster-local HTTP and gRPC endpoints of the workload's service
     */
    public static List<String> endpoints(LlmWorkload workload) {
        String host = workload.getMetadata().getName() + "." + workload.getMetadata().getNamespace() + ".svc.cluster.local";
        return List.of("http://" + host, "grpc://" + host + ":" + GRPC_PORT);
    }

    public static String specHash(HasMetadata object) {
        Map<String, String> annotations = object.getMetadata().getAnnotations();
        return annotations == null ? null : annotations.get(WorkloadLabels.SPEC_HASH);
    }

    private Container container(LlmWorkloadSpec spec, WorkloadPlan plan) {
        return new ContainerBuilder()
                .withName(CONTAINER_NAME)
                .withImage(plan.getImage())
                .addNewPort().withName("http").withContainerPort(HTTP_PORT).withProtocol("TCP").endPort()
                .addNewPort().withName("grpc").withContainerPort(GRPC_PORT).withProtocol("TCP").endPort()
                .addNewEnv().withName("MODEL_NAME").withValue(spec.getModelName()).endEnv()
                .addNewEnv().withName("MODEL_VERSION").withValue(plan.getModelVersion()).endEnv()
                .addNewEnv().withName("MODEL_TYPE").withValue(nullToEmpty(spec.getModelType())).endEnv()
                .withNewResources()
                    .withRequests(ResourceQuantities.toResourceMap(plan.getRequirements().getRequested()))
                    .withLimits(ResourceQuantities.toResourceMap(plan.getRequirements().getLimits()))
                .endResources()
                .withLivenessProbe(httpProbe("/health", 30, 10, 5, 3))
                .withReadinessProbe(httpProbe("/ready", 10, 5, 3, 3))
                .addNewVolumeMount()
                    .withName("config")
                    .withMountPath(CONFIG_MOUNT_PATH)
                    .withReadOnly(true)
                .endVolumeMount()
                .build();
    }

    private static Probe httpProbe(String path, int initialDelay, int period, int timeout, int failureThreshold) {
        return new ProbeBuilder()
                .withNewHttpGet()
                    .withPath(path)
                    .withPort(new IntOrString("http"))
                .endHttpGet()
                .withInitialDelaySeconds(initialDelay)
                .withPeriodSeconds(period)
                .withTimeoutSeconds(timeout)
                .withFailureThreshold(failureThreshold)
                .build();
    }

    private static List<Toleration> tolerations(PlacementSpec placement, WorkloadPlan plan) {
        List<Toleration> tolerations = new ArrayList<>();
        boolean gpu = plan.getRequirements().getRequested().getGpu() > 0;
        if (gpu) {
            tolerations.add(new TolerationBuilder()
                    .withKey(WorkloadLabels.GPU_RESOURCE)
                    .withOperator("Exists")
                    .withEffect("NoSchedule")
                    .build());
        }
        if (placement != null && placement.getTolerations() != null) {
            for (String key : placement.getTolerations()) {
                if (!(gpu && WorkloadLabels.GPU_RESOURCE.equals(key))) {
                    tolerations.add(new TolerationBuilder().withKey(key).withOperator("Exists").build());
                }
            }
        }
        return tolerations;
    }

    private static Map<String, String> nodeSelector(PlacementSpec placement) {
        if (placement == null || placement.getNodeSelector() == null) {
            return new TreeMap<>();
        }
        return new TreeMap<>(placement.getNodeSelector());
    }

    private static Map<String, String> securityAnnotations(SecuritySpec security) {
        Map<String, String> annotations = new TreeMap<>();
        if (security == null) {
            return annotations;
        }
        if (security.getEncryption() != null) {
            annotations.put(WorkloadLabels.ENCRYPTION, security.getEncryption().toString());
        }
        if (security.getComplianceLevel() != null) {
            annotations.put(WorkloadLabels.COMPLIANCE_LEVEL, security.getComplianceLevel());
        }
        if (security.getDataClassification() != null) {
            annotations.put(WorkloadLabels.DATA_CLASSIFICATION, security.getDataClassification());
        }
        return annotations;
    }

    private static Map<String, String> selector(LlmWorkload workload) {
        Map<String, String> selector = new TreeMap<>();
        selector.put(WorkloadLabels.APP, workload.getMetadata().getName());
        selector.put(WorkloadLabels.WORKLOAD, workload.getMetadata().getName());
        return selector;
    }

    private static Map<String, String> baseLabels(LlmWorkload workload) {
        Map<String, String> labels = selector(workload);
        labels.put(WorkloadLabels.MANAGED_BY, WorkloadLabels.MANAGED_BY_VALUE);
        return labels;
    }

    private static ObjectMeta metadata(LlmWorkload workload, String name, Map<String, String> labels) {
        return new ObjectMetaBuilder()
                .withName(name)
                .withNamespace(workload.getMetadata().getNamespace())
                .withLabels(new TreeMap<>(labels))
                .withOwnerReferences(OwnerReferences.controllerOf(workload))
                .build();
    }

    private static <T extends HasMetadata> T withSpecHash(T object) {
        String hash = ContentHash.of(object);
        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(WorkloadLabels.SPEC_HASH, hash);
        object.getMetadata().setAnnotations(annotations);
        return object;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
