package com.llmorch.orchestrator.reconcile;

import com.llmorch.core.crd.ScalingSpec;
import com.llmorch.core.crd.TargetMetric;
import com.llmorch.core.util.Durations;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import com.llmorch.orchestrator.metrics.WorkloadMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the desired replica count of a workload from its target metrics.
 * <p>
 * Formula, per target metric with an observed value:
 * <pre>
 *   r_metric = ceil(current * observed / target)
 *   desired  = clamp(max(r_metric), minReplicas, maxReplicas)
 * </pre>
 * </p>
 * <p>
 * Includes hysteresis on scale-in, a max step per decision and separate
 * scale-up and scale-down cooldowns. Replica bounds are enforced regardless
 * of cooldown.
 * </p>
 */
public class WorkloadScaler {
    private static final Logger log = LoggerFactory.getLogger(WorkloadScaler.class);

    private final OrchestratorConfig config;
    private final OrchestratorMetrics metrics;

    public WorkloadScaler(OrchestratorConfig config, OrchestratorMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * @param scaling         scaling policy, may be null
     * @param currentReplicas replicas of the existing deployment, 0 when there is none yet
     * @param observed        measured load
     * @param lastScaleTime   time of the last scaling action, null if never scaled
     * @param now             decision time
     */
    public ScalingDecision decide(ScalingSpec scaling,
                                  int currentReplicas,
                                  WorkloadMetrics observed,
                                  Instant lastScaleTime,
                                  Instant now) {
        ScalingSpec policy = scaling != null ? scaling : new ScalingSpec();
        int min = policy.getEffectiveMinReplicas();
        int max = Math.max(min, policy.getEffectiveMaxReplicas());
        Map<String, Double> values = observed.asMap();

        if (currentReplicas <= 0) {
            return record(ScalingDecision.Action.NONE, min, "Initial replicas", values);
        }
        if (currentReplicas < min) {
            return record(ScalingDecision.Action.SCALE_OUT, min, "Below minReplicas " + min, values);
        }
        if (currentReplicas > max) {
            return record(ScalingDecision.Action.SCALE_IN, max, "Above maxReplicas " + max, values);
        }
        if (ScalingSpec.VERTICAL.equalsIgnoreCase(policy.getEffectiveStrategy())) {
            return record(ScalingDecision.Action.NONE, currentReplicas, "Vertical strategy", values);
        }

        int desired = 0;
        String driver = null;
        for (TargetMetric target : policy.getTargetMetrics()) {
            Optional<Double> value = observed.get(target.getType());
            if (value.isEmpty() || target.getTarget() == null || target.getTarget() <= 0) {
                continue;
            }
            int replicas = (int) Math.ceil(currentReplicas * value.get() / target.getTarget() - 1e-9);
            if (replicas > desired) {
                desired = replicas;
                driver = String.format("%s=%.2f target=%.2f", target.getType(), value.get(), target.getTarget());
            }
        }
        if (driver == null) {
            return record(ScalingDecision.Action.NONE, currentReplicas, "No metrics", values);
        }
        desired = Math.max(min, Math.min(max, desired));

        int maxStep = policy.getMaxScaleStep() != null && policy.getMaxScaleStep() > 0
                ? policy.getMaxScaleStep() : config.getMaxScaleStep();

        if (desired > currentReplicas) {
            if (inCooldown(lastScaleTime, now, cooldown(policy.getScaleUpCooldown(), config.getScaleUpCooldown()))) {
                return record(ScalingDecision.Action.NONE, currentReplicas, "Scale-up cooldown (" + driver + ")", values);
            }
            int target = currentReplicas + Math.min(desired - currentReplicas, maxStep);
            return record(ScalingDecision.Action.SCALE_OUT, target, "Demand exceeds capacity (" + driver + ")", values);
        }
        // Hysteresis: at least 2 replicas below
        if (desired < currentReplicas - 1) {
            if (inCooldown(lastScaleTime, now, cooldown(policy.getScaleDownCooldown(), config.getScaleDownCooldown()))) {
                return record(ScalingDecision.Action.NONE, currentReplicas, "Scale-down cooldown (" + driver + ")", values);
            }
            int target = currentReplicas - Math.min(currentReplicas - desired, maxStep);
            return record(ScalingDecision.Action.SCALE_IN, target, "Under-utilized (" + driver + ")", values);
        }
        return record(ScalingDecision.Action.NONE, currentReplicas, "Within target (" + driver + ")", values);
    }

    private ScalingDecision record(ScalingDecision.Action action, int target, String reason, Map<String, Double> values) {
        metrics.recordScalingDecision(action.label());
        if (action != ScalingDecision.Action.NONE) {
            log.info("Scaling decision: action={}, target={}, reason={}", action, target, reason);
        }
        return ScalingDecision.builder()
                .action(action)
                .targetReplicas(target)
                .reason(reason)
                .observed(values)
                .build();
    }

    private static boolean inCooldown(Instant lastScaleTime, Instant now, Duration cooldown) {
        return lastScaleTime != null && now.isBefore(lastScaleTime.plus(cooldown));
    }

    private static Duration cooldown(String specValue, Duration fallback) {
        if (specValue == null || specValue.isBlank()) {
            return fallback;
        }
        Optional<Duration> parsed = Durations.parse(specValue);
        if (parsed.isEmpty()) {
            log.warn("Unparseable cooldown '{}', using {}", specValue, fallback);
        }
        return parsed.orElse(fallback);
    }
}
