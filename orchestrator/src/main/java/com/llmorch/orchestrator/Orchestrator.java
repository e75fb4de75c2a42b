package com.llmorch.orchestrator;

import com.llmorch.core.validation.WorkloadValidator;
import com.llmorch.orchestrator.capacity.CapacityCache;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.health.HealthService;
import com.llmorch.orchestrator.http.HttpServer;
import com.llmorch.orchestrator.k8s.ILeaderElection;
import com.llmorch.orchestrator.k8s.IPlatformClient;
import com.llmorch.orchestrator.k8s.KubernetesClients;
import com.llmorch.orchestrator.k8s.KubernetesPlatformClient;
import com.llmorch.orchestrator.k8s.LeaderElectionService;
import com.llmorch.orchestrator.k8s.StaticLeaderElection;
import com.llmorch.orchestrator.metrics.CompositeMetricsSource;
import com.llmorch.orchestrator.metrics.IMetricsSource;
import com.llmorch.orchestrator.metrics.KubernetesMetricsSource;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import com.llmorch.orchestrator.metrics.PrometheusMetricsSource;
import com.llmorch.orchestrator.metrics.PrometheusQueryService;
import com.llmorch.orchestrator.placement.PlacementEngine;
import com.llmorch.orchestrator.reconcile.ChildObjectFactory;
import com.llmorch.orchestrator.reconcile.ReconcileDispatcher;
import com.llmorch.orchestrator.reconcile.Reconciler;
import com.llmorch.orchestrator.reconcile.WorkloadScaler;
import com.llmorch.orchestrator.registry.CachingModelRegistry;
import com.llmorch.orchestrator.registry.CatalogModelRegistry;
import com.llmorch.orchestrator.registry.HttpModelRegistry;
import com.llmorch.orchestrator.registry.IModelRegistry;
import com.llmorch.orchestrator.resource.ResourceManager;
import com.llmorch.orchestrator.resource.ResourceSizer;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composition root: builds every component from the configuration and owns
 * their start and stop order.
 */
public class Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String BUNDLED_CATALOG = "models.yaml";

    private final OrchestratorConfig config;
    private final KubernetesClient client;
    private final IPlatformClient platform;
    private final ILeaderElection leaderElection;
    private final CapacityCache capacityCache;
    private final ResourceManager resourceManager;
    private final ReconcileDispatcher dispatcher;
    private final HealthService healthService;
    private final HttpServer httpServer;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public Orchestrator(OrchestratorConfig config) {
        this.config = config;
        Clock clock = Clock.systemUTC();

        // the global registry also carries the reactor-netty HTTP meters
        OrchestratorMetrics metrics = OrchestratorMetrics.withPrometheus(Metrics.globalRegistry, config.getIdentity());

        this.client = KubernetesClients.create(config);
        this.platform = new KubernetesPlatformClient(client, config.getNamespace());
        this.leaderElection = config.isLeaderElection()
            ? new LeaderElectionService(client, config.getLeaderLockNamespace(), config.getLeaderLockName(),
                config.getIdentity(), config.getLeaseDuration(), config.getLeaseRenewInterval())
            : new StaticLeaderElection();

        IModelRegistry registry = new CachingModelRegistry(createRegistry(config), config.getRegistryCacheTtl());
        IMetricsSource metricsSource = createMetricsSource(config, client);

        this.capacityCache = new CapacityCache(platform, metricsSource, metrics, config.getCacheRefreshInterval(), clock);
        this.resourceManager = new ResourceManager(new ResourceSizer(config), capacityCache, new PlacementEngine(),
            metrics, config, clock);

        WorkloadValidator validator = new WorkloadValidator();
        Reconciler reconciler = new Reconciler(platform, registry, resourceManager, metricsSource,
            new WorkloadScaler(config, metrics), new ChildObjectFactory(), validator, metrics, config, clock);
        this.dispatcher = new ReconcileDispatcher(reconciler, platform, leaderElection, metrics,
            config.getMaxConcurrentReconciles(), config.getReconcileInterval(), config.getReconcileTimeout(),
            Schedulers.boundedElastic(), clock);

        this.healthService = new HealthService(config.getHealthCheckInterval(), clock)
            .register(HealthService.REGISTRY, () -> {
                registry.ping();
                return "reachable";
            })
            .register(HealthService.CAPACITY_CACHE, () -> cacheFreshness(clock))
            .register(HealthService.RECONCILER, () -> {
                if (!running.get()) {
                    throw new IllegalStateException("not running");
                }
                return leaderElection.isLeader() ? "leader" : "standby";
            })
            .register(HealthService.PLATFORM_API, () -> {
                platform.ping();
                return "reachable";
            });

        this.httpServer = new HttpServer(config, metrics, healthService, validator,
            resourceManager::getLatestSuggestions);
        log.info("Orchestrator initialized (identity {}, namespace {})", config.getIdentity(),
            config.isAllNamespaces() ? "<all>" : config.getNamespace());
    }

    /**
     * Starts every component. The platform API is checked first so that an
     * unreachable cluster fails fast before anything is bound or scheduled.
     *
     * @throws com.llmorch.orchestrator.error.PlatformTransientException when the platform API is unreachable
     */
    public void start() {
        platform.ping();
        log.info("✓ Platform API reachable");

        capacityCache.start();
        resourceManager.start();
        httpServer.start();
        dispatcher.start();
        running.set(true);
        healthService.start();
        leaderElection.start();
        log.info("✓ Orchestrator started");
    }

    /**
     * Stops reconciling, drains in-flight work within the configured bound and
     * releases the leader lock.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            dispatcher.stop(config.getShutdownDrain());
            leaderElection.stop();
            resourceManager.stop();
            capacityCache.stop();
            healthService.stop();
            httpServer.stop();
        }
        client.close();
        log.info("Orchestrator stopped");
    }

    private String cacheFreshness(Clock clock) {
        Duration maxAge = capacityCache.getRefreshInterval().multipliedBy(3);
        Instant last = capacityCache.lastRefresh()
            .orElseThrow(() -> new IllegalStateException("never refreshed"));
        Duration age = Duration.between(last, clock.instant());
        if (age.compareTo(maxAge) > 0) {
            throw new IllegalStateException("stale: last refresh " + age.toSeconds() + "s ago");
        }
        return "refreshed " + age.toSeconds() + "s ago";
    }

    private static IModelRegistry createRegistry(OrchestratorConfig config) {
        if (!config.getRegistryUrl().isBlank()) {
            return new HttpModelRegistry(config.getRegistryUrl(), config.getPlatformTimeout());
        }
        if (!config.getModelCatalog().isBlank()) {
            return CatalogModelRegistry.fromFile(Path.of(config.getModelCatalog()));
        }
        log.info("No model registry configured, using the bundled catalogue");
        return CatalogModelRegistry.fromClasspath(BUNDLED_CATALOG);
    }

    private static IMetricsSource createMetricsSource(OrchestratorConfig config, KubernetesClient client) {
        List<IMetricsSource> sources = new ArrayList<>();
        sources.add(new KubernetesMetricsSource(client, config.getMetricsTimeout()));
        if (!config.getPrometheusUrl().isBlank()) {
            sources.add(new PrometheusMetricsSource(
                new PrometheusQueryService(config.getPrometheusUrl(), config.getMetricsTimeout()),
                config.getMetricsTimeout()));
        }
        return new CompositeMetricsSource(sources);
    }
}
