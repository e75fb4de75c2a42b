package com.llmorch.orchestrator.k8s;

import io.fabric8.kubernetes.api.model.coordination.v1.Lease;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseBuilder;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpec;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpecBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Leader election using the Kubernetes Lease API.
 * <p>
 * The lease is created, renewed or taken over on every renew tick. Any failure
 * to write the lease drops leadership immediately, so a partitioned instance
 * stops reconciling before another one can acquire the expired lease.
 * On stop the lease is deleted so that a standby takes over without waiting.
 * </p>
 */
public class LeaderElectionService implements ILeaderElection {
    private static final Logger log = LoggerFactory.getLogger(LeaderElectionService.class);

    /**
     * What to do with the lease on a tick.
     */
    public enum LeaseAction {
        CREATE,
        RENEW,
        ACQUIRE,
        FOLLOW
    }

    private final KubernetesClient client;
    private final String namespace;
    private final String leaseName;
    private final String identity;
    private final Duration leaseDuration;
    private final Duration renewInterval;
    private final Clock clock;
    private final AtomicBoolean isLeader = new AtomicBoolean(false);
    private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();
    private Disposable leaseRenewalTask;

    public LeaderElectionService(KubernetesClient client, String namespace, String leaseName, String identity,
                                 Duration leaseDuration, Duration renewInterval) {
        this(client, namespace, leaseName, identity, leaseDuration, renewInterval, Clock.systemUTC());
    }

    LeaderElectionService(KubernetesClient client, String namespace, String leaseName, String identity,
                          Duration leaseDuration, Duration renewInterval, Clock clock) {
        this.client = client;
        this.namespace = namespace;
        this.leaseName = leaseName;
        this.identity = identity;
        this.leaseDuration = leaseDuration;
        this.renewInterval = renewInterval;
        this.clock = clock;

        log.info("Leader election service initialized for {} on lease {}/{}", identity, namespace, leaseName);
    }

    /**
     * Decides the lease action for {@code identity} given the current lease.
     *
     * @param existing current lease, null when none exists
     * @param identity this instance's identity
     * @param now      current time
     * @param fallback lease duration used when the lease does not carry one
     */
    public static LeaseAction decide(Lease existing, String identity, Instant now, Duration fallback) {
        if (existing == null) {
            return LeaseAction.CREATE;
        }
        LeaseSpec spec = existing.getSpec();
        if (spec == null || spec.getHolderIdentity() == null || spec.getHolderIdentity().isBlank()) {
            return LeaseAction.ACQUIRE;
        }
        if (identity.equals(spec.getHolderIdentity())) {
            return LeaseAction.RENEW;
        }
        Duration duration = spec.getLeaseDurationSeconds() != null
                ? Duration.ofSeconds(spec.getLeaseDurationSeconds()) : fallback;
        Instant renewed = toInstant(spec.getRenewTime() != null ? spec.getRenewTime() : spec.getAcquireTime());
        boolean expired = renewed.plus(duration).isBefore(now);
        return expired ? LeaseAction.ACQUIRE : LeaseAction.FOLLOW;
    }

    @Override
    public void start() {
        log.info("Starting leader election for {}", identity);

        leaseRenewalTask = Flux.interval(Duration.ZERO, renewInterval)
                .onBackpressureDrop()
                .concatMap(tick -> attemptLeadershipAcquisition())
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }

    private Mono<Void> attemptLeadershipAcquisition() {
        return Mono.fromRunnable(this::tick)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("Error during leader election attempt", e);
                    setLeader(false);
                    return Mono.empty();
                })
                .then();
    }

    void tick() {
        Lease existing = client.leases().inNamespace(namespace).withName(leaseName).get();
        LeaseAction action = decide(existing, identity, clock.instant(), leaseDuration);
        switch (action) {
            case CREATE:
                createLease();
                break;
            case RENEW:
                renewLease(existing);
                break;
            case ACQUIRE:
                log.info("Lease expired (held by {}), attempting to acquire leadership",
                        existing.getSpec() == null ? null : existing.getSpec().getHolderIdentity());
                acquireLease(existing);
                break;
            default:
                if (isLeader.get()) {
                    log.warn("✗ Leadership LOST - {} now holds the lease", existing.getSpec().getHolderIdentity());
                }
                setLeader(false);
        }
    }

    private ZonedDateTime now() {
        return ZonedDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static Instant toInstant(ZonedDateTime zonedDateTime) {
        if (zonedDateTime == null) {
            return Instant.EPOCH;
        }
        return zonedDateTime.toInstant();
    }

    private void createLease() {
        ZonedDateTime now = now();
        Lease lease = new LeaseBuilder()
                .withNewMetadata()
                .withName(leaseName)
                .withNamespace(namespace)
                .endMetadata()
                .withSpec(newSpec(now, now))
                .build();
        try {
            client.leases().inNamespace(namespace).resource(lease).create();
            log.info("✓ Leadership ACQUIRED by {}", identity);
            setLeader(true);
        } catch (RuntimeException e) {
            log.warn("Failed to create lease (another instance may have created it): {}", e.getMessage());
            setLeader(false);
        }
    }

    private void renewLease(Lease lease) {
        LeaseSpec current = lease.getSpec();
        lease.setSpec(new LeaseSpecBuilder(current)
                .withLeaseDurationSeconds((int) leaseDuration.getSeconds())
                .withRenewTime(now())
                .build());
        try {
            client.leases().inNamespace(namespace).resource(lease).update();
            if (!isLeader.get()) {
                log.info("✓ Leadership RENEWED by {}", identity);
            }
            log.debug("Lease renewed by leader {}", identity);
            setLeader(true);
        } catch (RuntimeException e) {
            log.error("Failed to renew lease - dropping leadership: {}", e.getMessage());
            setLeader(false);
        }
    }

    private void acquireLease(Lease lease) {
        ZonedDateTime now = now();
        lease.setSpec(newSpec(now, now));
        try {
            // update() carries the observed resourceVersion; a concurrent taker makes this fail
            client.leases().inNamespace(namespace).resource(lease).update();
            log.info("✓ Leadership ACQUIRED by {}", identity);
            setLeader(true);
        } catch (RuntimeException e) {
            log.warn("Failed to acquire expired lease (another instance may have acquired it): {}", e.getMessage());
            setLeader(false);
        }
    }

    private LeaseSpec newSpec(ZonedDateTime acquired, ZonedDateTime renewed) {
        return new LeaseSpecBuilder()
                .withHolderIdentity(identity)
                .withLeaseDurationSeconds((int) leaseDuration.getSeconds())
                .withAcquireTime(acquired)
                .withRenewTime(renewed)
                .build();
    }

    private void setLeader(boolean leader) {
        boolean previous = isLeader.getAndSet(leader);
        if (previous != leader) {
            listeners.forEach(l -> l.accept(leader));
        }
    }

    @Override
    public boolean isLeader() {
        return isLeader.get();
    }

    @Override
    public void addListener(Consumer<Boolean> listener) {
        listeners.add(listener);
    }

    /**
     * Stops renewing and releases the lease if held.
     */
    @Override
    public void stop() {
        if (leaseRenewalTask != null) {
            leaseRenewalTask.dispose();
        }

        if (isLeader.get()) {
            try {
                client.leases().inNamespace(namespace).withName(leaseName).delete();
                log.info("Lease released by {}", identity);
            } catch (RuntimeException e) {
                log.warn("Failed to release lease during shutdown: {}", e.getMessage());
            }
            setLeader(false);
        }
        log.info("Leader election service stopped");
    }
}
