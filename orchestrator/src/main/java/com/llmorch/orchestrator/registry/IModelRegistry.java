package com.llmorch.orchestrator.registry;

import com.llmorch.orchestrator.error.ModelNotFoundException;
import com.llmorch.orchestrator.error.RegistryUnavailableException;

/**
 * Resolves a model name and version to a container image.
 * <p>
 * Implementations are side-effect free. A version of {@code ""} or
 * {@code latest} resolves to the most recently published version.
 * </p>
 */
public interface IModelRegistry {

    /**
     * @param modelName model identifier
     * @param version   version string, {@code latest} or empty for the newest
     * @return the resolution, never null
     * @throws ModelNotFoundException       when the model or version is unknown
     * @throws RegistryUnavailableException when the registry cannot be reached
     */
    ModelResolution resolve(String modelName, String version);

    /**
     * Reachability probe for health reporting.
     *
     * @throws RegistryUnavailableException when the registry cannot be reached
     */
    default void ping() {
    }

    static boolean isLatest(String version) {
        return version == null || version.isBlank() || "latest".equalsIgnoreCase(version.trim());
    }
}
