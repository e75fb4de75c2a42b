package com.llmorch.core.crd;

/**
 * Label, annotation and finalizer keys written by the orchestrator.
 */
public final class WorkloadLabels {
    private WorkloadLabels() {
    }

    public static final String PREFIX = "llm-orchestrator.io/";

    public static final String FINALIZER = PREFIX + "finalizer";

    public static final String APP = "app";
    public static final String WORKLOAD = PREFIX + "workload";
    public static final String MODEL = PREFIX + "model";
    public static final String MODEL_VERSION = PREFIX + "version";
    public static final String MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "llm-orchestrator";

    /**
     * Hash of the desired child spec; an unchanged hash means no write is needed.
     */
    public static final String SPEC_HASH = PREFIX + "spec-hash";
    public static final String CONFIG_HASH = PREFIX + "config-hash";

    public static final String ENCRYPTION = PREFIX + "encryption";
    public static final String COMPLIANCE_LEVEL = PREFIX + "compliance-level";
    public static final String DATA_CLASSIFICATION = PREFIX + "data-classification";

    // Node labels read during capacity refresh and scoring
    public static final String ZONE = "topology.kubernetes.io/zone";
    public static final String HOSTNAME = "kubernetes.io/hostname";
    public static final String INSTANCE_TYPE = "node.kubernetes.io/instance-type";
    public static final String SSD = "storage.kubernetes.io/ssd";
    public static final String BANDWIDTH = "networking.kubernetes.io/bandwidth";

    public static final String GPU_RESOURCE = "nvidia.com/gpu";
}
