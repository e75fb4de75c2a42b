package com.llmorch.orchestrator.resource;

import com.llmorch.core.crd.LlmWorkloadSpec;
import com.llmorch.core.crd.ResourceSpec;
import com.llmorch.core.model.ModelSize;
import com.llmorch.core.model.QualityClass;
import com.llmorch.core.model.ResourceCapacity;
import com.llmorch.core.model.ResourceRequirements;
import com.llmorch.core.util.Quantities;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.registry.ModelHints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a workload spec into the resource envelope of one replica.
 * <p>
 * requested = base x size factor x model-type factor x quality-class factor x
 * registry hint, limits = 1.5 x requested (GPU limit = GPU request), all
 * clipped at the configured per-workload maxima.
 * </p>
 */
public class ResourceSizer {
    private static final Logger log = LoggerFactory.getLogger(ResourceSizer.class);

    static final double LIMIT_FACTOR = 1.5;

    private final OrchestratorConfig config;
    private final long defaultCpuMillis;
    private final long defaultMemoryBytes;
    private final long maxCpuMillis;
    private final long maxMemoryBytes;

    public ResourceSizer(OrchestratorConfig config) {
        this.config = config;
        this.defaultCpuMillis = Quantities.cpuMillisOrDefault(config.getDefaultCpu(), 1000, "default cpu");
        this.defaultMemoryBytes = Quantities.bytesOrDefault(config.getDefaultMemory(), 2L << 30, "default memory");
        this.maxCpuMillis = Quantities.cpuMillisOrDefault(config.getMaxCpu(), 8000, "max cpu");
        this.maxMemoryBytes = Quantities.bytesOrDefault(config.getMaxMemory(), 32L << 30, "max memory");
    }

    public ResourceRequirements size(LlmWorkloadSpec spec, ModelHints hints) {
        ResourceSpec resources = spec.getResources() != null
                ? spec.getResources() : new ResourceSpec(null, null, null, null, null);

        long baseCpu = Quantities.cpuMillisOrDefault(resources.getCpu(), defaultCpuMillis, "spec.resources.cpu");
        long baseMemory = Quantities.bytesOrDefault(resources.getMemory(), defaultMemoryBytes, "spec.resources.memory");
        int baseGpu = Quantities.countOrDefault(resources.getGpu(), config.getDefaultGpu(), "spec.resources.gpu");
        long storage = Quantities.bytesOrDefault(resources.getStorage(), 0L, "spec.resources.storage");

        ModelSize size = ModelSize.fromLabel(spec.getEffectiveModelSize()).orElseGet(() -> {
            log.warn("Unknown model size '{}', using medium", spec.getModelSize());
            return ModelSize.MEDIUM;
        });
        ModelTypeMultipliers.Factors type = ModelTypeMultipliers.lookup(spec.getModelName(),
                config.getModelTypeMatching());
        QualityClass quality = QualityClass.fromSla(spec.getSla());

        double cpuFactor = size.cpuFactor() * type.cpu() * qualityCpuFactor(quality);
        double memoryFactor = size.memoryFactor() * type.memory() * qualityMemoryFactor(quality);
        if (hints != null && hints.getCpuMultiplier() != null) {
            cpuFactor *= hints.getCpuMultiplier();
        }
        if (hints != null && hints.getMemoryMultiplier() != null) {
            memoryFactor *= hints.getMemoryMultiplier();
        }

        long cpu = Math.round(baseCpu * cpuFactor);
        long memory = Math.round(baseMemory * memoryFactor);
        // Fractional GPUs round up so a GPU workload never ends up with none
        int gpu = baseGpu > 0 ? (int) Math.ceil(baseGpu * size.gpuFactor() * type.gpu() - 1e-9) : 0;

        ResourceCapacity requested = new ResourceCapacity(
                Math.min(cpu, maxCpuMillis),
                Math.min(memory, maxMemoryBytes),
                Math.min(gpu, config.getMaxGpu()),
                storage);
        ResourceCapacity limits = new ResourceCapacity(
                Math.min(Math.round(cpu * LIMIT_FACTOR), maxCpuMillis),
                Math.min(Math.round(memory * LIMIT_FACTOR), maxMemoryBytes),
                requested.getGpu(),
                storage);

        log.debug("Sized {} ({}, {}, {}): requested {} limits {}", spec.getModelName(), size.label(),
                type.family().isEmpty() ? "generic" : type.family(), quality.label(), requested, limits);

        return ResourceRequirements.builder()
                .requested(requested)
                .limits(limits)
                .qualityClass(quality)
                .build();
    }

    private double qualityCpuFactor(QualityClass quality) {
        switch (quality) {
            case PREMIUM:
                return config.getPremiumCpuMultiplier();
            case BASIC:
                return config.getBasicCpuMultiplier();
            default:
                return 1.0;
        }
    }

    private double qualityMemoryFactor(QualityClass quality) {
        switch (quality) {
            case PREMIUM:
                return config.getPremiumMemoryMultiplier();
            case BASIC:
                return config.getBasicMemoryMultiplier();
            default:
                return 1.0;
        }
    }
}
