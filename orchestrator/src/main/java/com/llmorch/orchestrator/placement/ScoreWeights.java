package com.llmorch.orchestrator.placement;

import com.llmorch.core.model.QualityClass;

/**
 * Sub-score weights; always sum to 100.
 */
public record ScoreWeights(double resource, double affinity, double locality, double performance) {

    /**
     * Latency-sensitive workloads favour locality and fast nodes over headroom.
     */
    public static final ScoreWeights LOW_LATENCY = new ScoreWeights(20, 20, 30, 30);
    public static final ScoreWeights DEFAULT = new ScoreWeights(40, 20, 20, 20);

    public ScoreWeights {
        double sum = resource + affinity + locality + performance;
        if (Math.abs(sum - 100.0) > 1e-9) {
            throw new IllegalArgumentException("Score weights must sum to 100, got " + sum);
        }
    }

    public static ScoreWeights forQuality(QualityClass qualityClass) {
        return qualityClass == QualityClass.PREMIUM ? LOW_LATENCY : DEFAULT;
    }

    public double combine(double resourceScore, double affinityScore, double localityScore, double performanceScore) {
        return (resourceScore * resource
                + affinityScore * affinity
                + localityScore * locality
                + performanceScore * performance) / 100.0;
    }
}
