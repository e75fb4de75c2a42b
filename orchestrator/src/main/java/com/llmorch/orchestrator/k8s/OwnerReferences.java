package com.llmorch.orchestrator.k8s;

import com.llmorch.core.crd.LlmWorkload;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;

import java.util.List;

/**
 * Owner-reference helpers for child objects of a workload.
 */
public final class OwnerReferences {
    private OwnerReferences() {
    }

    public static OwnerReference controllerOf(LlmWorkload workload) {
        return new OwnerReferenceBuilder()
                .withApiVersion(LlmWorkload.API_VERSION)
                .withKind(LlmWorkload.KIND)
                .withName(workload.getMetadata().getName())
                .withUid(workload.getMetadata().getUid())
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build();
    }

    /**
     * Whether {@code child} carries an owner reference to {@code workload}.
     * Matches on uid when both sides have one, otherwise on kind and name.
     */
    public static boolean isOwnedBy(HasMetadata child, LlmWorkload workload) {
        List<OwnerReference> refs = child.getMetadata().getOwnerReferences();
        if (refs == null) {
            return false;
        }
        String uid = workload.getMetadata().getUid();
        for (OwnerReference ref : refs) {
            if (!LlmWorkload.KIND.equals(ref.getKind())) {
                continue;
            }
            if (uid != null && ref.getUid() != null) {
                if (uid.equals(ref.getUid())) {
                    return true;
                }
            } else if (workload.getMetadata().getName().equals(ref.getName())) {
                return true;
            }
        }
        return false;
    }
}
