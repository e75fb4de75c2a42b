package com.llmorch.orchestrator.resource;

import com.llmorch.orchestrator.config.OrchestratorConfig.ModelTypeMatching;

import java.util.List;
import java.util.Locale;

/**
 * Per-model-family CPU, memory and GPU factors. The first matching family wins.
 */
final class ModelTypeMultipliers {
    private ModelTypeMultipliers() {
    }

    record Factors(String family, double cpu, double memory, double gpu) {
    }

    static final Factors NEUTRAL = new Factors("", 1.0, 1.0, 1.0);

    private static final List<Factors> TABLE = List.of(
            new Factors("llama", 1.2, 1.5, 1.0),
            new Factors("gpt", 1.0, 1.2, 1.0),
            new Factors("bert", 0.8, 0.8, 0.8),
            new Factors("t5", 1.1, 1.3, 1.0),
            new Factors("gemini", 1.3, 1.4, 1.1));

    static Factors lookup(String modelName, ModelTypeMatching matching) {
        if (modelName == null) {
            return NEUTRAL;
        }
        String name = modelName.toLowerCase(Locale.ROOT);
        for (Factors factors : TABLE) {
            boolean matches = matching == ModelTypeMatching.SUBSTRING
                    ? name.contains(factors.family())
                    : name.startsWith(factors.family());
            if (matches) {
                return factors;
            }
        }
        return NEUTRAL;
    }
}
