package com.llmorch.orchestrator.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodically probes the orchestrator's subsystems and keeps the latest
 * result of each one.
 * <p>
 * The aggregate is healthy only when every registered subsystem is healthy.
 * A subsystem that has not been probed yet counts as unhealthy.
 * </p>
 */
public class HealthService {
    private static final Logger log = LoggerFactory.getLogger(HealthService.class);

    public static final String REGISTRY = "registry";
    public static final String CAPACITY_CACHE = "capacity_cache";
    public static final String RECONCILER = "reconciler";
    public static final String PLATFORM_API = "platform_api";

    private final Map<String, HealthProbe> probes = new LinkedHashMap<>();
    private final Map<String, SubsystemHealth> results = new ConcurrentHashMap<>();
    private final Duration interval;
    private final Clock clock;

    private Disposable checkTask;

    public HealthService(Duration interval, Clock clock) {
        this.interval = interval;
        this.clock = clock;
        log.info("Health service initialized (check every {})", interval);
    }

    public synchronized HealthService register(String subsystem, HealthProbe probe) {
        probes.put(subsystem, probe);
        return this;
    }

    public void start() {
        checkTask = Flux.interval(Duration.ZERO, interval)
                .onBackpressureDrop()
                .concatMap(tick -> Mono.fromRunnable(this::checkAll)
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            log.error("Health check round failed", e);
                            return Mono.empty();
                        }))
                .subscribe();
    }

    public void stop() {
        if (checkTask != null) {
            checkTask.dispose();
        }
    }

    /**
     * Runs every probe once and records the results.
     */
    public void checkAll() {
        Map<String, HealthProbe> current;
        synchronized (this) {
            current = new LinkedHashMap<>(probes);
        }
        current.forEach((name, probe) -> {
            SubsystemHealth previous = results.get(name);
            SubsystemHealth next = run(probe);
            results.put(name, next);
            if (previous != null && previous.isHealthy() != next.isHealthy()) {
                if (next.isHealthy()) {
                    log.info("✓ {} is healthy again", name);
                } else {
                    log.warn("✗ {} became unhealthy: {}", name, next.getMessage());
                }
            }
        });
    }

    /**
     * @return latest result per subsystem, in registration order
     */
    public Map<String, SubsystemHealth> report() {
        Map<String, SubsystemHealth> report = new LinkedHashMap<>();
        synchronized (this) {
            for (String name : probes.keySet()) {
                report.put(name, results.getOrDefault(name,
                        SubsystemHealth.unhealthy(clock.instant(), "not checked yet")));
            }
        }
        return Collections.unmodifiableMap(report);
    }

    public boolean isHealthy() {
        return report().values().stream().allMatch(SubsystemHealth::isHealthy);
    }

    private SubsystemHealth run(HealthProbe probe) {
        Instant now = clock.instant();
        try {
            String message = probe.check();
            return SubsystemHealth.healthy(now, message != null ? message : "ok");
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return SubsystemHealth.unhealthy(now, message);
        }
    }
}
