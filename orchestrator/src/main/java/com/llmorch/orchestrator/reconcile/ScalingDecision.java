package com.llmorch.orchestrator.reconcile;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Replica count chosen for a workload in one reconcile.
 */
@Value
@Builder
public class ScalingDecision {
    public enum Action {
        SCALE_OUT("scale_out"),
        SCALE_IN("scale_in"),
        NONE("none");

        private final String label;

        Action(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    Action action;
    int targetReplicas;
    String reason;

    /**
     * Metric values the decision was based on, keyed by target-metric type.
     */
    Map<String, Double> observed;

    public boolean isScaling() {
        return action != Action.NONE;
    }
}
