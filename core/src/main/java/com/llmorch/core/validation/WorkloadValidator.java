package com.llmorch.core.validation;

import com.llmorch.core.crd.LlmWorkloadSpec;
import com.llmorch.core.crd.PlacementSpec;
import com.llmorch.core.crd.ResourceSpec;
import com.llmorch.core.crd.ScalingSpec;
import com.llmorch.core.crd.SlaSpec;
import com.llmorch.core.crd.TargetMetric;
import com.llmorch.core.model.ModelSize;
import com.llmorch.core.util.Durations;
import com.llmorch.core.util.Quantities;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Structural validation of a workload spec.
 * <p>
 * Returns one {@link FieldError} per offending field; an empty list means the
 * spec is acceptable. Used both by the admission endpoint and by the
 * reconciler before it acts on a workload.
 * </p>
 */
public final class WorkloadValidator {
    private static final Set<String> STRATEGIES = Set.of(ScalingSpec.HORIZONTAL, ScalingSpec.VERTICAL, ScalingSpec.HYBRID);

    public List<FieldError> validate(LlmWorkloadSpec spec) {
        List<FieldError> errors = new ArrayList<>();
        if (spec == null) {
            errors.add(new FieldError("spec", "is required"));
            return errors;
        }

        if (spec.getModelName() == null || spec.getModelName().isBlank()) {
            errors.add(new FieldError("spec.modelName", "is required"));
        }
        if (spec.getModelSize() != null && ModelSize.fromLabel(spec.getModelSize()).isEmpty()) {
            errors.add(new FieldError("spec.modelSize", "must be one of small, medium, large, xlarge"));
        }

        validateResources(spec.getResources(), errors);
        validateScaling(spec.getScaling(), errors);
        validateSla(spec.getSla(), errors);
        validatePlacement(spec.getPlacement(), errors);
        return errors;
    }

    private void validateResources(ResourceSpec resources, List<FieldError> errors) {
        if (resources == null) {
            return;
        }
        if (resources.getCpu() != null && !Quantities.isValidCpu(resources.getCpu())) {
            errors.add(new FieldError("spec.resources.cpu", "is not a valid quantity: '" + resources.getCpu() + "'"));
        }
        checkQuantity(resources.getMemory(), "spec.resources.memory", errors);
        checkQuantity(resources.getStorage(), "spec.resources.storage", errors);
        if (resources.getGpu() != null && Quantities.count(resources.getGpu()).isEmpty()) {
            errors.add(new FieldError("spec.resources.gpu", "must be a non-negative integer"));
        }
        if (resources.getNetworkBandwidth() != null && Quantities.bandwidthGbps(resources.getNetworkBandwidth()).isEmpty()) {
            errors.add(new FieldError("spec.resources.networkBandwidth", "must be a bandwidth such as 10Gbps"));
        }
    }

    private void checkQuantity(String value, String path, List<FieldError> errors) {
        if (value != null && !Quantities.isValid(value)) {
            errors.add(new FieldError(path, "is not a valid quantity: '" + value + "'"));
        }
    }

    private void validateScaling(ScalingSpec scaling, List<FieldError> errors) {
        if (scaling == null) {
            return;
        }
        Integer min = scaling.getMinReplicas();
        Integer max = scaling.getMaxReplicas();
        if (min != null && min < 1) {
            errors.add(new FieldError("spec.scaling.minReplicas", "must be at least 1"));
        }
        if (max != null && max < 1) {
            errors.add(new FieldError("spec.scaling.maxReplicas", "must be at least 1"));
        }
        if (min != null && max != null && max < min) {
            errors.add(new FieldError("spec.scaling.maxReplicas", "must be greater than or equal to minReplicas"));
        }
        if (scaling.getMaxScaleStep() != null && scaling.getMaxScaleStep() < 1) {
            errors.add(new FieldError("spec.scaling.maxScaleStep", "must be at least 1"));
        }
        if (scaling.getStrategy() != null && !STRATEGIES.contains(scaling.getStrategy())) {
            errors.add(new FieldError("spec.scaling.strategy", "must be one of horizontal, vertical, hybrid"));
        }
        checkDuration(scaling.getScaleUpCooldown(), "spec.scaling.scaleUpCooldown", errors);
        checkDuration(scaling.getScaleDownCooldown(), "spec.scaling.scaleDownCooldown", errors);

        List<TargetMetric> metrics = scaling.getTargetMetrics();
        if (metrics == null) {
            return;
        }
        for (int i = 0; i < metrics.size(); i++) {
            TargetMetric metric = metrics.get(i);
            String path = "spec.scaling.targetMetrics[" + i + "]";
            if (metric == null) {
                errors.add(new FieldError(path, "must not be null"));
                continue;
            }
            if (metric.getType() == null || !TargetMetric.TYPES.contains(metric.getType())) {
                errors.add(new FieldError(path + ".type", "must be one of cpu, memory, rps, queue_length, latency"));
            }
            if (metric.getTarget() == null || metric.getTarget() <= 0) {
                errors.add(new FieldError(path + ".target", "must be greater than 0"));
            }
        }
    }

    private void checkDuration(String value, String path, List<FieldError> errors) {
        if (value != null && Durations.parse(value).isEmpty()) {
            errors.add(new FieldError(path, "is not a valid duration: '" + value + "'"));
        }
    }

    private void validateSla(SlaSpec sla, List<FieldError> errors) {
        if (sla == null) {
            return;
        }
        if (sla.getAvailability() != null && (sla.getAvailability() < 0 || sla.getAvailability() > 100)) {
            errors.add(new FieldError("spec.sla.availability", "must be a percentage between 0 and 100"));
        }
        if (sla.getMaxErrorRate() != null && (sla.getMaxErrorRate() < 0 || sla.getMaxErrorRate() > 1)) {
            errors.add(new FieldError("spec.sla.maxErrorRate", "must be a fraction between 0 and 1"));
        }
        checkNonNegative(sla.getMaxLatencyMs(), "spec.sla.maxLatencyMs", errors);
        checkNonNegative(sla.getMinThroughput(), "spec.sla.minThroughput", errors);
        checkNonNegative(sla.getP95ResponseTimeMs(), "spec.sla.p95ResponseTimeMs", errors);
        checkNonNegative(sla.getP99ResponseTimeMs(), "spec.sla.p99ResponseTimeMs", errors);
        if (sla.getConcurrentUsers() != null && sla.getConcurrentUsers() < 0) {
            errors.add(new FieldError("spec.sla.concurrentUsers", "must not be negative"));
        }
    }

    private void checkNonNegative(Double value, String path, List<FieldError> errors) {
        if (value != null && value < 0) {
            errors.add(new FieldError(path, "must not be negative"));
        }
    }

    private void validatePlacement(PlacementSpec placement, List<FieldError> errors) {
        if (placement == null) {
            return;
        }
        Double maxUtil = placement.getMaxNodeUtilization();
        if (maxUtil != null && (maxUtil <= 0 || maxUtil > 1)) {
            errors.add(new FieldError("spec.placement.maxNodeUtilization", "must be in (0, 1]"));
        }
        if (placement.getPreferences() != null) {
            for (int i = 0; i < placement.getPreferences().size(); i++) {
                PlacementSpec.NodePreference pref = placement.getPreferences().get(i);
                String path = "spec.placement.preferences[" + i + "]";
                if (pref.getKey() == null || pref.getKey().isBlank()) {
                    errors.add(new FieldError(path + ".key", "is required"));
                }
                if (pref.getWeight() == null || pref.getWeight() < 0 || pref.getWeight() > 100) {
                    errors.add(new FieldError(path + ".weight", "must be between 0 and 100"));
                }
            }
        }
        if (placement.getAntiAffinity() != null) {
            for (int i = 0; i < placement.getAntiAffinity().size(); i++) {
                PlacementSpec.LabelTerm term = placement.getAntiAffinity().get(i);
                if (term.getKey() == null || term.getKey().isBlank()) {
                    errors.add(new FieldError("spec.placement.antiAffinity[" + i + "].key", "is required"));
                }
            }
        }
    }
}
