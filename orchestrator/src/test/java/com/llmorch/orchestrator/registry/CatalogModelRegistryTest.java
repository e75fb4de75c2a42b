package com.llmorch.orchestrator.registry;

import com.llmorch.orchestrator.error.ModelNotFoundException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CatalogModelRegistryTest {

    private final CatalogModelRegistry registry = CatalogModelRegistry.fromClasspath("test-catalog.yaml");

    @Test
    void testLatest_PicksNewestPublished() {
        ModelResolution resolution = registry.resolve("mistral-7b", "latest");

        assertEquals("v2", resolution.getVersion());
        assertEquals("registry.test/mistral-7b:v2", resolution.getImageReference());
        assertEquals(resolution, registry.resolve("mistral-7b", ""));
        assertEquals(resolution, registry.resolve("mistral-7b", null));
    }

    @Test
    void testLatest_WithoutTimestampsLastListedWins() {
        assertEquals("b", registry.resolve("undated", "latest").getVersion());
    }

    @Test
    void testExactVersion_CarriesHints() {
        ModelResolution resolution = registry.resolve("mistral-7b", "v3");

        assertEquals("v3", resolution.getVersion());
        assertEquals(1.5, resolution.hints().orElseThrow().getCpuMultiplier());
        assertNull(resolution.getHints().getMemoryMultiplier());
        assertFalse(registry.resolve("mistral-7b", "v2").hints().isPresent());
    }

    @Test
    void testUnknownModelOrVersion_NotFound() {
        ModelNotFoundException unknownModel = assertThrows(ModelNotFoundException.class,
                () -> registry.resolve("gpt-5", "latest"));
        assertThrows(ModelNotFoundException.class, () -> registry.resolve("mistral-7b", "v9"));
        assertEquals(ModelNotFoundException.REASON, unknownModel.getReason());
        assertFalse(unknownModel.isRetryable());
    }

    @Test
    void testBundledCatalogue_ResolvesLlama() {
        CatalogModelRegistry bundled = CatalogModelRegistry.fromClasspath("models.yaml");

        ModelResolution resolution = bundled.resolve("llama-7b", "latest");

        assertEquals("v2", resolution.getVersion());
        assertEquals("ghcr.io/llm-orchestrator/llama-7b:v2", resolution.imageOr("fallback"));
    }

    @Test
    void testFromFile_ReadsYaml() throws IOException {
        Path file = Files.createTempFile("catalog", ".yaml");
        try {
            Files.write(file, List.of(
                    "models:",
                    "  - name: phi-2",
                    "    versions:",
                    "      - version: v1",
                    "        hints: {defaultImage: registry.test/phi-2:default}"));

            ModelResolution resolution = CatalogModelRegistry.fromFile(file).resolve("phi-2", "v1");

            assertNull(resolution.getImageReference());
            assertEquals("registry.test/phi-2:default", resolution.imageOr("fallback"));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void testMissingSources_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> CatalogModelRegistry.fromClasspath("nope.yaml"));
        assertThrows(UncheckedIOException.class, () -> CatalogModelRegistry.fromFile(Path.of("/nonexistent/models.yaml")));
    }
}
