package com.llmorch.orchestrator.k8s;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.orchestrator.support.TestFixtures;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OwnerReferencesTest {

    @Test
    void testControllerOf_PointsAtWorkload() {
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");
        workload.getMetadata().setUid("uid-1");

        OwnerReference ref = OwnerReferences.controllerOf(workload);

        assertEquals(LlmWorkload.API_VERSION, ref.getApiVersion());
        assertEquals(LlmWorkload.KIND, ref.getKind());
        assertEquals("uid-1", ref.getUid());
        assertTrue(ref.getController());
        assertTrue(ref.getBlockOwnerDeletion());
    }

    @Test
    void testIsOwnedBy_MatchesUidWhenKnown() {
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");
        workload.getMetadata().setUid("uid-1");

        assertTrue(OwnerReferences.isOwnedBy(child("llama", "uid-1"), workload));
        // Same name, recreated workload
        assertFalse(OwnerReferences.isOwnedBy(child("llama", "uid-0"), workload));
    }

    @Test
    void testIsOwnedBy_FallsBackToName() {
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");

        assertTrue(OwnerReferences.isOwnedBy(child("llama", "uid-1"), workload));
        assertFalse(OwnerReferences.isOwnedBy(child("other", null), workload));
    }

    @Test
    void testIsOwnedBy_IgnoresForeignKindsAndUnownedObjects() {
        LlmWorkload workload = TestFixtures.llamaWorkload("ml", "llama");
        ConfigMap foreign = new ConfigMapBuilder()
                .withNewMetadata().withName("llama-config")
                    .addToOwnerReferences(new OwnerReferenceBuilder().withKind("Deployment").withName("llama").build())
                .endMetadata()
                .build();
        ConfigMap unowned = new ConfigMapBuilder().withNewMetadata().withName("llama-config").endMetadata().build();

        assertFalse(OwnerReferences.isOwnedBy(foreign, workload));
        assertFalse(OwnerReferences.isOwnedBy(unowned, workload));
    }

    private static ConfigMap child(String ownerName, String ownerUid) {
        return new ConfigMapBuilder()
                .withNewMetadata().withName("llama-config")
                    .addToOwnerReferences(new OwnerReferenceBuilder()
                            .withKind(LlmWorkload.KIND)
                            .withName(ownerName)
                            .withUid(ownerUid)
                            .build())
                .endMetadata()
                .build();
    }
}
