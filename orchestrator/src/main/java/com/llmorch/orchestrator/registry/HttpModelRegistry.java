package com.llmorch.orchestrator.registry;

import com.llmorch.core.util.JsonUtils;
import com.llmorch.orchestrator.error.ModelNotFoundException;
import com.llmorch.orchestrator.error.OrchestratorException;
import com.llmorch.orchestrator.error.RegistryUnavailableException;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Model registry client over HTTP using reactor-netty.
 * <p>
 * 404 maps to {@link ModelNotFoundException}; server errors, timeouts and
 * connection failures map to {@link RegistryUnavailableException}.
 * </p>
 */
public class HttpModelRegistry implements IModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(HttpModelRegistry.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    /**
     * @param baseUrl registry base URL, e.g. {@code http://model-registry.ml.svc:8080/api/v1}
     * @param timeout upper bound on a single lookup
     */
    public HttpModelRegistry(String baseUrl, Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.create()
                .baseUrl(stripTrailingSlash(baseUrl))
                .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
                .responseTimeout(timeout);

        log.info("HttpModelRegistry initialized with {}", baseUrl);
    }

    @Override
    public ModelResolution resolve(String modelName, String version) {
        String requested = IModelRegistry.isLatest(version) ? "latest" : version;
        String uri = "/models/" + encode(modelName) + "/versions/" + encode(requested);

        log.debug("Resolving model {}:{} via {}", modelName, requested, uri);

        return httpClient.get()
                .uri(uri)
                .responseSingle((response, body) -> {
                    int code = response.status().code();
                    if (code == 404) {
                        return Mono.<RegistryModelResponse>error(new ModelNotFoundException(modelName, requested));
                    }
                    if (code >= 300) {
                        return Mono.<RegistryModelResponse>error(
                                new RegistryUnavailableException("Registry answered HTTP " + code + " for " + uri));
                    }
                    return body.asString().map(json -> JsonUtils.readValue(json, RegistryModelResponse.class));
                })
                .switchIfEmpty(Mono.error(() -> new RegistryUnavailableException("Empty registry response for " + uri)))
                .timeout(timeout)
                .onErrorMap(err -> !(err instanceof OrchestratorException),
                        err -> new RegistryUnavailableException("Registry lookup failed: " + err.getMessage(), err))
                .map(body -> toResolution(modelName, requested, body))
                .doOnError(err -> log.warn("✗ Registry lookup {}:{} failed: {}", modelName, requested, err.getMessage()))
                .block();
    }

    @Override
    public void ping() {
        Integer code = httpClient.get()
                .uri("/healthz")
                .responseSingle((response, body) -> Mono.just(response.status().code()))
                .timeout(timeout)
                .onErrorMap(err -> new RegistryUnavailableException("Registry unreachable: " + err.getMessage(), err))
                .block();
        if (code == null || code >= 500) {
            throw new RegistryUnavailableException("Registry health check answered " + code);
        }
    }

    private static ModelResolution toResolution(String modelName, String requested, RegistryModelResponse body) {
        String resolvedVersion = body.getVersion() != null && !body.getVersion().isBlank()
                ? body.getVersion() : requested;
        return ModelResolution.builder()
                .modelName(modelName)
                .version(resolvedVersion)
                .imageReference(body.getImage())
                .hints(body.getHints())
                .build();
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
