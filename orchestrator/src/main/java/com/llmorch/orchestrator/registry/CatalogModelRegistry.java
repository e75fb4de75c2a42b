package com.llmorch.orchestrator.registry;

import com.llmorch.core.util.JsonUtils;
import com.llmorch.orchestrator.error.ModelNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Model registry backed by a static YAML catalogue.
 * <p>
 * {@code latest} resolves to the version with the greatest {@code publishedAt};
 * versions without a timestamp sort first, and among equal timestamps the one
 * listed last wins.
 * </p>
 */
public class CatalogModelRegistry implements IModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(CatalogModelRegistry.class);

    private final Map<String, List<ModelCatalog.VersionEntry>> versionsByModel = new HashMap<>();

    public CatalogModelRegistry(ModelCatalog catalog) {
        for (ModelCatalog.ModelEntry model : catalog.getModels()) {
            if (model.getName() == null || model.getName().isBlank()) {
                log.warn("Skipping catalogue entry without a model name");
                continue;
            }
            versionsByModel.put(model.getName(), List.copyOf(model.getVersions()));
        }
        log.info("CatalogModelRegistry initialized with {} models", versionsByModel.size());
    }

    public static CatalogModelRegistry fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return new CatalogModelRegistry(JsonUtils.readYaml(in, ModelCatalog.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read model catalogue " + path, e);
        }
    }

    public static CatalogModelRegistry fromClasspath(String resource) {
        InputStream in = CatalogModelRegistry.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Model catalogue resource not found: " + resource);
        }
        try (in) {
            return new CatalogModelRegistry(JsonUtils.readYaml(in, ModelCatalog.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read model catalogue " + resource, e);
        }
    }

    @Override
    public ModelResolution resolve(String modelName, String version) {
        List<ModelCatalog.VersionEntry> versions = versionsByModel.get(modelName);
        if (versions == null || versions.isEmpty()) {
            throw new ModelNotFoundException(modelName, version);
        }

        Optional<ModelCatalog.VersionEntry> match;
        if (IModelRegistry.isLatest(version)) {
            match = latest(versions);
        } else {
            match = versions.stream().filter(v -> version.equals(v.getVersion())).findFirst();
        }

        ModelCatalog.VersionEntry entry = match.orElseThrow(() -> new ModelNotFoundException(modelName, version));
        log.debug("Resolved {}:{} to {}:{}", modelName, version, modelName, entry.getVersion());
        return ModelResolution.builder()
                .modelName(modelName)
                .version(entry.getVersion())
                .imageReference(entry.getImage())
                .hints(entry.getHints())
                .build();
    }

    private static Optional<ModelCatalog.VersionEntry> latest(List<ModelCatalog.VersionEntry> versions) {
        ModelCatalog.VersionEntry best = null;
        Comparator<Instant> order = Comparator.nullsFirst(Comparator.naturalOrder());
        for (ModelCatalog.VersionEntry candidate : versions) {
            if (best == null || order.compare(candidate.getPublishedAt(), best.getPublishedAt()) >= 0) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }
}
