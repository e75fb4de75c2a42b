package com.llmorch.core.model;

import lombok.Value;

/**
 * The four placement sub-scores, each in [0, 100].
 */
@Value
public class ScoreBreakdown {
    double resource;
    double affinity;
    double locality;
    double performance;
}
