package com.llmorch.orchestrator.http;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.model.MigrationSuggestion;
import com.llmorch.core.util.JsonUtils;
import com.llmorch.core.validation.FieldError;
import com.llmorch.core.validation.WorkloadValidator;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.health.HealthService;
import com.llmorch.orchestrator.health.SubsystemHealth;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * HTTP surfaces of the orchestrator, bound to two ports.
 * <ul>
 *   <li>metrics port: {@code GET /metrics}</li>
 *   <li>health port: {@code GET /health}, {@code GET /healthz},
 *       {@code POST /validate}, {@code GET /suggestions}</li>
 * </ul>
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String JSON = "application/json";
    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(45);

    private final OrchestratorConfig config;
    private final OrchestratorMetrics metrics;
    private final HealthService healthService;
    private final WorkloadValidator validator;
    private final Supplier<List<MigrationSuggestion>> suggestions;

    private DisposableServer metricsServer;
    private DisposableServer healthServer;

    /**
     * Status code plus JSON body of a handled request.
     */
    record Reply(int status, String body) {
    }

    public HttpServer(OrchestratorConfig config,
                      OrchestratorMetrics metrics,
                      HealthService healthService,
                      WorkloadValidator validator,
                      Supplier<List<MigrationSuggestion>> suggestions) {
        this.config = config;
        this.metrics = metrics;
        this.healthService = healthService;
        this.validator = validator;
        this.suggestions = suggestions;
    }

    /**
     * Binds both ports.
     *
     * @throws IllegalStateException when a port cannot be bound
     */
    public void start() {
        metricsServer = bind(config.getMetricsPort(), this::metricsRoutes, "Metrics");
        healthServer = bind(config.getHealthPort(), this::healthRoutes, "Health");
    }

    public void stop() {
        if (healthServer != null) {
            healthServer.disposeNow(Duration.ofSeconds(20));
        }
        if (metricsServer != null) {
            metricsServer.disposeNow(Duration.ofSeconds(20));
        }
        log.info("HTTP servers stopped");
    }

    private DisposableServer bind(int port, Consumer<HttpServerRoutes> routes, String name) {
        return reactor.netty.http.server.HttpServer.create()
            .port(port)
            .route(routes)
            .bind()
            .doOnNext(server -> log.info("{} server started on port {}", name, server.port()))
            .doOnError(err -> log.error("Failed to start {} server on port {}", name, port, err))
            .block(BIND_TIMEOUT);
    }

    private void metricsRoutes(HttpServerRoutes routes) {
        routes.get("/metrics", (req, res) ->
            res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                .sendString(Mono.fromCallable(metrics::scrape))
                .then()
        );
    }

    private void healthRoutes(HttpServerRoutes routes) {
        routes
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            .get("/health", (req, res) ->
                Mono.fromCallable(this::health)
                    .flatMap(reply -> send(res, reply))
            )
            .get("/suggestions", (req, res) ->
                Mono.fromCallable(() -> new Reply(200, JsonUtils.writeValueAsString(suggestions.get())))
                    .flatMap(reply -> send(res, reply))
            )
            .post("/validate", (req, res) ->
                req.receive().aggregate().asString()
                    .defaultIfEmpty("")
                    .map(this::validate)
                    .onErrorResume(err -> {
                        log.error("Validation request failed", err);
                        return Mono.just(new Reply(500, "{\"error\":\"Validation failed\"}"));
                    })
                    .flatMap(reply -> send(res, reply))
            );
    }

    private Mono<Void> send(HttpServerResponse res, Reply reply) {
        return res.status(HttpResponseStatus.valueOf(reply.status()))
            .header("Content-Type", JSON)
            .sendString(Mono.just(reply.body()))
            .then();
    }

    /**
     * Per-subsystem report with 200 when everything is healthy, 503 otherwise.
     */
    Reply health() {
        Map<String, SubsystemHealth> report = healthService.report();
        boolean healthy = report.values().stream().allMatch(SubsystemHealth::isHealthy);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? SubsystemHealth.HEALTHY : SubsystemHealth.UNHEALTHY);
        body.put("subsystems", report);
        return new Reply(healthy ? 200 : 503, JsonUtils.writeValueAsString(body));
    }

    /**
     * Validates a workload document given as JSON or YAML.
     */
    Reply validate(String document) {
        if (document == null || document.isBlank()) {
            return new Reply(400, "{\"error\":\"Empty request body\"}");
        }
        LlmWorkload workload;
        try {
            workload = JsonUtils.readYaml(document, LlmWorkload.class);
        } catch (UncheckedIOException e) {
            log.debug("Unparseable workload document: {}", e.getMessage());
            return new Reply(400, "{\"error\":\"Malformed workload document\"}");
        }
        List<FieldError> errors = validator.validate(workload != null ? workload.getSpec() : null);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", errors.isEmpty());
        if (!errors.isEmpty()) {
            body.put("errors", errors);
        }
        return new Reply(errors.isEmpty() ? 200 : 422, JsonUtils.writeValueAsString(body));
    }
}
