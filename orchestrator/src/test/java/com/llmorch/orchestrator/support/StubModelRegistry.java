package com.llmorch.orchestrator.support;

import com.llmorch.orchestrator.error.ModelNotFoundException;
import com.llmorch.orchestrator.error.RegistryUnavailableException;
import com.llmorch.orchestrator.registry.IModelRegistry;
import com.llmorch.orchestrator.registry.ModelResolution;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry stub with a fixed set of model versions and a lookup counter.
 */
public class StubModelRegistry implements IModelRegistry {
    private final Map<String, Map<String, String>> images = new HashMap<>();
    private final Map<String, String> latest = new HashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private volatile boolean available = true;

    public StubModelRegistry publish(String model, String version, String image) {
        images.computeIfAbsent(model, m -> new HashMap<>()).put(version, image);
        latest.put(model, version);
        return this;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int getLookups() {
        return lookups.get();
    }

    @Override
    public ModelResolution resolve(String modelName, String version) {
        lookups.incrementAndGet();
        if (!available) {
            throw new RegistryUnavailableException("registry down");
        }
        Map<String, String> versions = images.get(modelName);
        if (versions == null) {
            throw new ModelNotFoundException(modelName, version);
        }
        String concrete = IModelRegistry.isLatest(version) ? latest.get(modelName) : version;
        String image = versions.get(concrete);
        if (image == null) {
            throw new ModelNotFoundException(modelName, version);
        }
        return ModelResolution.builder()
                .modelName(modelName)
                .version(concrete)
                .imageReference(image)
                .build();
    }

    @Override
    public void ping() {
        if (!available) {
            throw new RegistryUnavailableException("registry down");
        }
    }
}
