package com.llmorch.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ranked placement candidate.
 */
@Value
@Builder
public class NodeScore {
    String nodeName;

    /**
     * Weighted final score in [0, 100].
     */
    double score;

    ScoreBreakdown breakdown;

    @Singular
    List<String> reasons;

    // Tie-break inputs
    long availableCpuMillis;
    int workloadCount;
}
