package com.llmorch.core.crd;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Observed state of an {@link LlmWorkload}. Written only by the reconciler.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LlmWorkloadStatus {
    private WorkloadPhase phase;
    private List<WorkloadCondition> conditions = new ArrayList<>();

    private Integer replicas;
    private Integer readyReplicas;
    private Integer desiredReplicas;

    private String lastScaleTime;
    private Map<String, Double> currentMetrics = new TreeMap<>();
    private List<String> endpoints = new ArrayList<>();

    /**
     * Node chosen for the workload's allocation.
     */
    private String nodeName;
    private Long observedGeneration;

    public Optional<WorkloadCondition> findCondition(String type) {
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream().filter(c -> type.equals(c.getType())).findFirst();
    }

    /**
     * Updates the condition of the given type in place, or appends it.
     * The transition time is refreshed only when the status value changes.
     */
    public void putCondition(String type, String status, String reason, String message, Instant now) {
        if (conditions == null) {
            conditions = new ArrayList<>();
        }
        Optional<WorkloadCondition> existing = findCondition(type);
        if (existing.isPresent()) {
            WorkloadCondition condition = existing.get();
            if (!status.equals(condition.getStatus())) {
                condition.setLastTransitionTime(now.toString());
            }
            condition.setStatus(status);
            condition.setReason(reason);
            condition.setMessage(message);
        } else {
            conditions.add(new WorkloadCondition(type, status, reason, message, now.toString()));
        }
    }

    @JsonIgnore
    public boolean isConditionTrue(String type) {
        return findCondition(type).map(c -> WorkloadCondition.TRUE.equals(c.getStatus())).orElse(false);
    }
}
