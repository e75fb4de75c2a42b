package com.llmorch.orchestrator.registry;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Result of a successful registry lookup.
 */
@Value
@Builder(toBuilder = true)
public class ModelResolution {
    String modelName;

    /**
     * Concrete version; never {@code latest}.
     */
    String version;

    /**
     * Image published for the version, may be null.
     */
    String imageReference;

    ModelHints hints;

    public Optional<ModelHints> hints() {
        return Optional.ofNullable(hints);
    }

    /**
     * Picks the registry image, then the hint's default image, then {@code configuredDefault}.
     */
    public String imageOr(String configuredDefault) {
        if (imageReference != null && !imageReference.isBlank()) {
            return imageReference;
        }
        if (hints != null && hints.getDefaultImage() != null && !hints.getDefaultImage().isBlank()) {
            return hints.getDefaultImage();
        }
        return configuredDefault;
    }
}
