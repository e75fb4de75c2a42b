package com.llmorch.core.crd;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Replica bounds and metric targets for a workload.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScalingSpec {
    public static final String HORIZONTAL = "horizontal";
    public static final String VERTICAL = "vertical";
    public static final String HYBRID = "hybrid";

    private Integer minReplicas;
    private Integer maxReplicas;
    private List<TargetMetric> targetMetrics = new ArrayList<>();

    /**
     * Duration such as {@code 3m} or {@code PT3M}.
     */
    private String scaleUpCooldown;
    private String scaleDownCooldown;

    /**
     * Largest replica change applied in one scaling decision.
     */
    private Integer maxScaleStep;

    private String strategy;

    @JsonIgnore
    public int getEffectiveMinReplicas() {
        return minReplicas == null ? 1 : minReplicas;
    }

    @JsonIgnore
    public int getEffectiveMaxReplicas() {
        return maxReplicas == null ? Math.max(1, getEffectiveMinReplicas()) : maxReplicas;
    }

    @JsonIgnore
    public String getEffectiveStrategy() {
        return strategy == null || strategy.isBlank() ? HORIZONTAL : strategy;
    }
}
