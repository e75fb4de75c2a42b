package com.llmorch.orchestrator.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * YAML document describing the models known to {@link CatalogModelRegistry}.
 * <pre>
 * models:
 *   - name: llama-7b
 *     versions:
 *       - version: v1
 *         image: registry.example.com/llm/llama-7b:v1
 *         publishedAt: 2024-05-01T00:00:00Z
 *         hints: {cpuMultiplier: 1.0, memoryMultiplier: 1.2}
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelCatalog {
    private List<ModelEntry> models = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelEntry {
        private String name;
        private List<VersionEntry> versions = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VersionEntry {
        private String version;
        private String image;
        private Instant publishedAt;
        private ModelHints hints;
    }
}
