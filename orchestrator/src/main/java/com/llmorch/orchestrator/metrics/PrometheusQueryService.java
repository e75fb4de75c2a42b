package com.llmorch.orchestrator.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.llmorch.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs PromQL queries against the Prometheus HTTP API using reactor-netty HttpClient.
 * <p>
 * Inference servers export {@code llm_requests_total}, {@code llm_request_duration_seconds}
 * and {@code llm_queue_length}, each labelled with {@code namespace} and {@code workload}.
 * </p>
 */
public class PrometheusQueryService {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryService.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    /**
     * @param baseUrl e.g. {@code http://prometheus.monitoring.svc.cluster.local:9090}
     * @param timeout upper bound on one query
     */
    public PrometheusQueryService(String baseUrl, Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.create()
                .baseUrl(baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl)
                .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
                .responseTimeout(timeout);

        log.info("PrometheusQueryService initialized with {}", baseUrl);
    }

    /**
     * Executes an instant PromQL query. Failures yield an empty result.
     */
    public Mono<PrometheusQueryResult> query(String query) {
        String uri = "/api/v1/query?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8);

        log.debug("Executing Prometheus query: {}", query);

        return httpClient.get()
                .uri(uri)
                .responseContent()
                .aggregate()
                .asString()
                .timeout(timeout)
                .retry(2)
                .map(responseBody -> {
                    PrometheusResponse response = JsonUtils.readValue(responseBody, PrometheusResponse.class);
                    if (!"success".equalsIgnoreCase(response.getStatus())) {
                        log.error("Prometheus query failed: {}", response.getError());
                        return PrometheusQueryResult.empty();
                    }
                    return PrometheusQueryResult.from(response);
                })
                .doOnError(err -> log.error("Failed to query Prometheus: {}", err.getMessage()))
                .onErrorReturn(PrometheusQueryResult.empty())
                .defaultIfEmpty(PrometheusQueryResult.empty());
    }

    /**
     * Requests per second per replica over the last minute.
     */
    public Mono<Double> getRequestsPerReplica(String namespace, String workload) {
        String selector = selector(namespace, workload);
        String query = "sum(rate(llm_requests_total" + selector + "[1m])) / count(count by (pod) (llm_requests_total"
                + selector + "))";
        return scalar(query);
    }

    /**
     * p95 request latency in milliseconds over the last five minutes.
     */
    public Mono<Double> getP95LatencyMs(String namespace, String workload) {
        String query = "histogram_quantile(0.95, sum by (le) (rate(llm_request_duration_seconds_bucket"
                + selector(namespace, workload) + "[5m]))) * 1000";
        return scalar(query);
    }

    /**
     * Average pending requests per replica.
     */
    public Mono<Double> getQueueLengthPerReplica(String namespace, String workload) {
        return scalar("avg(llm_queue_length" + selector(namespace, workload) + ")");
    }

    /**
     * Health check against {@code /-/healthy}.
     */
    public Mono<Boolean> healthCheck() {
        return httpClient.get()
                .uri("/-/healthy")
                .responseSingle((response, body) -> Mono.just(response.status().code() == 200))
                .timeout(Duration.ofSeconds(3))
                .doOnNext(healthy -> {
                    if (!healthy) {
                        log.warn("Prometheus health check: FAILED");
                    }
                })
                .onErrorReturn(false);
    }

    private Mono<Double> scalar(String query) {
        return query(query).flatMap(result -> Mono.justOrEmpty(result.getValue()));
    }

    private static String selector(String namespace, String workload) {
        return "{namespace=\"" + escape(namespace) + "\",workload=\"" + escape(workload) + "\"}";
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Data class for Prometheus API response.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResponse {
        private String status;
        private PrometheusData data;
        private String error;
        private String errorType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusData {
        private String resultType;
        private List<PrometheusResult> result;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResult {
        private Map<String, String> metric;
        private List<Object> value;
    }
}
