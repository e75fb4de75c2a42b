package com.llmorch.core.crd;

import com.llmorch.core.model.WorkloadKey;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * The declarative workload resource: one LLM inference service with its
 * resource appetite, scaling policy, SLA and placement envelope.
 * <p>
 * Identity is {@code (namespace, name)}. External operators own {@code spec};
 * only the reconciler writes {@code status}.
 * </p>
 */
@Group(LlmWorkload.GROUP)
@Version(LlmWorkload.VERSION)
@Kind(LlmWorkload.KIND)
@Plural("llmworkloads")
@Singular("llmworkload")
@ShortNames("llmw")
public class LlmWorkload extends CustomResource<LlmWorkloadSpec, LlmWorkloadStatus> implements Namespaced {
    public static final String GROUP = "llm-orchestrator.io";
    public static final String VERSION = "v1alpha1";
    public static final String KIND = "LLMWorkload";
    public static final String API_VERSION = GROUP + "/" + VERSION;

    /**
     * @return the workload identity derived from metadata
     */
    public WorkloadKey key() {
        return WorkloadKey.of(getMetadata().getNamespace(), getMetadata().getName());
    }

    /**
     * @return true once the platform has placed a deletion marker on the record
     */
    public boolean isMarkedForDeletion() {
        return getMetadata() != null && getMetadata().getDeletionTimestamp() != null;
    }
}
