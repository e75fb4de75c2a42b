package com.llmorch.orchestrator.config;

import com.llmorch.core.util.Durations;
import lombok.Builder;
import lombok.Value;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration for the orchestrator.
 * <p>
 * Defaults are overridden by environment variables ({@link #fromEnv()}), which
 * are in turn overridden by command-line flags ({@link CommandLineOptions}).
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class OrchestratorConfig {

    /**
     * How model names are matched against the model-type multiplier table.
     */
    public enum ModelTypeMatching {
        PREFIX,
        SUBSTRING
    }

    // Platform
    String kubeconfig;          // empty => in-cluster
    String namespace;           // empty => all namespaces
    Duration platformTimeout;

    // Exposition
    int metricsPort;
    int healthPort;

    // Leader election
    boolean leaderElection;
    String leaderLockName;
    String leaderLockNamespace;
    String identity;
    Duration leaseDuration;
    Duration leaseRenewInterval;

    // Reconcile loop
    Duration reconcileInterval;
    int maxConcurrentReconciles;
    Duration reconcileTimeout;
    Duration backoffBase;
    Duration backoffMax;
    Duration shutdownDrain;

    // Capacity and rebalancing
    Duration cacheRefreshInterval;
    Duration rebalanceInterval;
    Duration healthCheckInterval;
    double utilizationTarget;
    double scaleUpThreshold;
    double scaleDownThreshold;

    // Sizing
    String defaultCpu;
    String defaultMemory;
    int defaultGpu;
    String maxCpu;
    String maxMemory;
    int maxGpu;
    double premiumCpuMultiplier;
    double premiumMemoryMultiplier;
    double basicCpuMultiplier;
    double basicMemoryMultiplier;
    ModelTypeMatching modelTypeMatching;
    boolean localityPreference;

    // Replica scaling
    Duration scaleUpCooldown;
    Duration scaleDownCooldown;
    int maxScaleStep;

    // Collaborators
    String modelCatalog;
    String registryUrl;
    Duration registryCacheTtl;
    String prometheusUrl;
    Duration metricsTimeout;
    String defaultImage;

    boolean help;

    /**
     * @return configuration with built-in defaults only
     */
    public static OrchestratorConfig defaults() {
        return fromEnv(Map.of());
    }

    public static OrchestratorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Loads configuration from the given environment map.
     *
     * @throws IllegalArgumentException on malformed values
     */
    public static OrchestratorConfig fromEnv(Map<String, String> env) {
        return OrchestratorConfig.builder()
            .kubeconfig(getEnv(env, "KUBECONFIG_PATH", ""))
            .namespace(getEnv(env, "WATCH_NAMESPACE", ""))
            .platformTimeout(duration(env, "PLATFORM_TIMEOUT", "10s"))
            .metricsPort(integer(env, "METRICS_PORT", "8080"))
            .healthPort(integer(env, "HEALTH_PORT", "8081"))
            .leaderElection(Boolean.parseBoolean(getEnv(env, "LEADER_ELECTION", "true")))
            .leaderLockName(getEnv(env, "LEADER_LOCK_NAME", "llm-orchestrator-leader"))
            .leaderLockNamespace(getEnv(env, "POD_NAMESPACE", "default"))
            .identity(getEnv(env, "POD_NAME", hostname()))
            .leaseDuration(duration(env, "LEASE_DURATION", "15s"))
            .leaseRenewInterval(duration(env, "LEASE_RENEW_INTERVAL", "5s"))
            .reconcileInterval(duration(env, "RECONCILE_INTERVAL", "30s"))
            .maxConcurrentReconciles(integer(env, "MAX_CONCURRENT_RECONCILES", "4"))
            .reconcileTimeout(duration(env, "RECONCILE_TIMEOUT", "30s"))
            .backoffBase(duration(env, "BACKOFF_BASE", "1s"))
            .backoffMax(duration(env, "BACKOFF_MAX", "60s"))
            .shutdownDrain(duration(env, "SHUTDOWN_DRAIN", "30s"))
            .cacheRefreshInterval(duration(env, "CACHE_REFRESH_INTERVAL", "30s"))
            .rebalanceInterval(duration(env, "REBALANCE_INTERVAL", "5m"))
            .healthCheckInterval(duration(env, "HEALTH_CHECK_INTERVAL", "10s"))
            .utilizationTarget(decimal(env, "UTILIZATION_TARGET", "0.8"))
            .scaleUpThreshold(decimal(env, "SCALE_UP_THRESHOLD", "0.8"))
            .scaleDownThreshold(decimal(env, "SCALE_DOWN_THRESHOLD", "0.3"))
            .defaultCpu(getEnv(env, "DEFAULT_CPU", "1000m"))
            .defaultMemory(getEnv(env, "DEFAULT_MEMORY", "2Gi"))
            .defaultGpu(integer(env, "DEFAULT_GPU", "0"))
            .maxCpu(getEnv(env, "MAX_CPU", "8000m"))
            .maxMemory(getEnv(env, "MAX_MEMORY", "32Gi"))
            .maxGpu(integer(env, "MAX_GPU", "4"))
            .premiumCpuMultiplier(decimal(env, "PREMIUM_CPU_MULTIPLIER", "1.5"))
            .premiumMemoryMultiplier(decimal(env, "PREMIUM_MEMORY_MULTIPLIER", "2.0"))
            .basicCpuMultiplier(decimal(env, "BASIC_CPU_MULTIPLIER", "1.0"))
            .basicMemoryMultiplier(decimal(env, "BASIC_MEMORY_MULTIPLIER", "1.0"))
            .modelTypeMatching(ModelTypeMatching.valueOf(getEnv(env, "MODEL_TYPE_MATCHING", "prefix").toUpperCase()))
            .localityPreference(Boolean.parseBoolean(getEnv(env, "LOCALITY_PREFERENCE", "true")))
            .scaleUpCooldown(duration(env, "SCALE_UP_COOLDOWN", "3m"))
            .scaleDownCooldown(duration(env, "SCALE_DOWN_COOLDOWN", "10m"))
            .maxScaleStep(integer(env, "MAX_SCALE_STEP", "3"))
            .modelCatalog(getEnv(env, "MODEL_CATALOG", ""))
            .registryUrl(getEnv(env, "REGISTRY_URL", ""))
            .registryCacheTtl(duration(env, "REGISTRY_CACHE_TTL", "2m"))
            .prometheusUrl(getEnv(env, "PROMETHEUS_URL", ""))
            .metricsTimeout(duration(env, "METRICS_TIMEOUT", "5s"))
            .defaultImage(getEnv(env, "DEFAULT_MODEL_IMAGE", "llm-server:latest"))
            .help(false)
            .build();
    }

    /**
     * Checks cross-field constraints.
     *
     * @throws IllegalArgumentException describing the first violation
     */
    public OrchestratorConfig validate() {
        requirePort(metricsPort, "metrics-port");
        requirePort(healthPort, "health-port");
        if (metricsPort == healthPort) {
            throw new IllegalArgumentException("metrics-port and health-port must differ");
        }
        if (maxConcurrentReconciles < 1) {
            throw new IllegalArgumentException("max-concurrent-reconciles must be at least 1");
        }
        requireRatio(utilizationTarget, "utilization target");
        requireRatio(scaleUpThreshold, "scale-up threshold");
        requireRatio(scaleDownThreshold, "scale-down threshold");
        if (scaleDownThreshold >= scaleUpThreshold) {
            throw new IllegalArgumentException("scale-down threshold must be below scale-up threshold");
        }
        if (leaderElection && (leaderLockName == null || leaderLockName.isBlank())) {
            throw new IllegalArgumentException("leader-lock-name is required when leader election is enabled");
        }
        if (reconcileInterval.isZero() || reconcileInterval.isNegative()) {
            throw new IllegalArgumentException("reconcile-interval must be positive");
        }
        return this;
    }

    public boolean isAllNamespaces() {
        return namespace == null || namespace.isBlank();
    }

    private static void requirePort(int port, String name) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }

    private static void requireRatio(double value, String name) {
        if (value <= 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be in (0, 1]: " + value);
        }
    }

    private static int integer(Map<String, String> env, String key, String defaultValue) {
        String value = getEnv(env, key, defaultValue);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static double decimal(Map<String, String> env, String key, String defaultValue) {
        String value = getEnv(env, key, defaultValue);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static Duration duration(Map<String, String> env, String key, String defaultValue) {
        String value = getEnv(env, key, defaultValue);
        return Durations.parse(value)
            .orElseThrow(() -> new IllegalArgumentException("Invalid duration for " + key + ": " + value));
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "llm-orchestrator";
        }
    }
}
