package com.llmorch.core.model;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ranked candidates plus the nodes dropped by hard constraints and why.
 */
@Value
public class PlacementResult {
    List<NodeScore> ranking;
    Map<String, String> rejected;

    public Optional<NodeScore> selected() {
        return ranking.isEmpty() ? Optional.empty() : Optional.of(ranking.get(0));
    }
}
