package com.llmorch.orchestrator.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Instant-vector result of a PromQL query with typed accessors.
 * <p>
 * {@code NaN} and infinite samples are treated as absent: a workload with no
 * traffic yields no latency rather than a latency of zero.
 * </p>
 */
public class PrometheusQueryResult {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryResult.class);

    private final List<PrometheusQueryService.PrometheusResult> results;

    private PrometheusQueryResult(List<PrometheusQueryService.PrometheusResult> results) {
        this.results = results != null ? results : Collections.emptyList();
    }

    public static PrometheusQueryResult from(PrometheusQueryService.PrometheusResponse response) {
        if (response == null || response.getData() == null) {
            return empty();
        }
        return new PrometheusQueryResult(response.getData().getResult());
    }

    public static PrometheusQueryResult empty() {
        return new PrometheusQueryResult(Collections.emptyList());
    }

    /**
     * @return the first series' sample, for aggregations such as {@code sum()} and {@code avg()}
     */
    public Optional<Double> getValue() {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return sample(results.get(0));
    }

    /**
     * @param labelName label identifying each series
     * @return label value to sample, skipping series without the label or a finite sample
     */
    public Map<String, Double> getValuesByLabel(String labelName) {
        Map<String, Double> valuesByLabel = new HashMap<>();
        for (PrometheusQueryService.PrometheusResult result : results) {
            if (result.getMetric() == null || !result.getMetric().containsKey(labelName)) {
                log.debug("Result missing label '{}': {}", labelName, result.getMetric());
                continue;
            }
            String labelValue = result.getMetric().get(labelName);
            sample(result).ifPresent(value -> valuesByLabel.put(labelValue, value));
        }
        return valuesByLabel;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }

    private static Optional<Double> sample(PrometheusQueryService.PrometheusResult result) {
        // Prometheus returns [timestamp, "value"]
        if (result.getValue() == null || result.getValue().size() < 2) {
            return Optional.empty();
        }
        Object valueObj = result.getValue().get(1);
        double value;
        if (valueObj instanceof Number) {
            value = ((Number) valueObj).doubleValue();
        } else if (valueObj instanceof String) {
            try {
                value = Double.parseDouble(((String) valueObj).replace("Inf", "Infinity"));
            } catch (NumberFormatException e) {
                log.warn("Unparseable Prometheus sample '{}'", valueObj);
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }
}
