package com.llmorch.orchestrator.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Body of {@code GET /models/{name}/versions/{version}} on an HTTP model registry.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryModelResponse {
    private String name;
    private String version;
    private String image;
    private ModelHints hints;
}
