package com.llmorch.orchestrator.reconcile;

import com.llmorch.core.crd.LlmWorkload;
import com.llmorch.core.crd.WorkloadPhase;
import com.llmorch.core.model.WorkloadKey;
import com.llmorch.orchestrator.error.OrchestratorException;
import com.llmorch.orchestrator.k8s.ILeaderElection;
import com.llmorch.orchestrator.k8s.IPlatformClient;
import com.llmorch.orchestrator.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feeds workload keys to the reconciler with bounded concurrency.
 * <p>
 * Events for a key that is already queued are coalesced; events for a key that
 * is being reconciled mark it dirty so that exactly one more pass follows.
 * A key is therefore never reconciled by two workers at once. Only the leader
 * reconciles: keys dequeued by a follower are dropped and a full resync runs
 * when leadership is acquired.
 * </p>
 */
public class ReconcileDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ReconcileDispatcher.class);

    private final IReconciler reconciler;
    private final IPlatformClient platform;
    private final ILeaderElection leaderElection;
    private final OrchestratorMetrics metrics;
    private final int maxConcurrent;
    private final Duration resyncInterval;
    private final Duration reconcileTimeout;
    private final Scheduler scheduler;
    private final Clock clock;

    private final Object lock = new Object();
    // guarded by lock
    private final Set<WorkloadKey> queued = new LinkedHashSet<>();
    private final Set<WorkloadKey> inFlight = new HashSet<>();
    private final Set<WorkloadKey> dirty = new HashSet<>();

    private final Map<WorkloadKey, ReconcileContext> running = new ConcurrentHashMap<>();
    private final Sinks.Many<WorkloadKey> sink = Sinks.many().unicast().onBackpressureBuffer();
    // at most one pending requeue per key; a newer requeue replaces the older one
    private final Map<WorkloadKey, Disposable> requeueTimers = new ConcurrentHashMap<>();
    private final List<Closeable> watches = new ArrayList<>();

    private volatile boolean stopping;
    private Disposable workers;
    private Disposable resyncTask;

    public ReconcileDispatcher(IReconciler reconciler,
                               IPlatformClient platform,
                               ILeaderElection leaderElection,
                               OrchestratorMetrics metrics,
                               int maxConcurrent,
                               Duration resyncInterval,
                               Duration reconcileTimeout,
                               Scheduler scheduler,
                               Clock clock) {
        this.reconciler = reconciler;
        this.platform = platform;
        this.leaderElection = leaderElection;
        this.metrics = metrics;
        this.maxConcurrent = maxConcurrent;
        this.resyncInterval = resyncInterval;
        this.reconcileTimeout = reconcileTimeout;
        this.scheduler = scheduler;
        this.clock = clock;

        metrics.registerQueueDepth(this::depth);
        leaderElection.addListener(isLeader -> {
            metrics.setLeader(isLeader);
            if (isLeader && !stopping) {
                log.info("Leadership acquired, resyncing all workloads");
                resync();
            }
        });
        log.info("Reconcile dispatcher initialized (max concurrent {}, resync every {})", maxConcurrent, resyncInterval);
    }

    /**
     * Starts the workers, the periodic resync and the platform watches.
     */
    public void start() {
        workers = sink.asFlux()
                .flatMap(key -> Mono.fromRunnable(() -> process(key))
                        .subscribeOn(scheduler)
                        .onErrorResume(e -> {
                            log.error("✗ Reconcile worker failed for {}", key, e);
                            return Mono.empty();
                        }), maxConcurrent)
                .subscribe();

        resyncTask = Flux.interval(resyncInterval, resyncInterval)
                .onBackpressureDrop()
                .subscribe(tick -> resync());

        watches.add(platform.watchWorkloads(this::enqueue));
        watches.add(platform.watchOwnedDeployments(this::enqueue));
        log.info("✓ Reconcile dispatcher started");
    }

    /**
     * Queues {@code key} for reconciliation unless it is already queued.
     */
    public void enqueue(WorkloadKey key) {
        if (stopping) {
            return;
        }
        synchronized (lock) {
            if (inFlight.contains(key)) {
                dirty.add(key);
                return;
            }
            if (!queued.add(key)) {
                return;
            }
            Sinks.EmitResult result = sink.tryEmitNext(key);
            if (result.isFailure()) {
                queued.remove(key);
                log.warn("Could not queue {}: {}", key, result);
            }
        }
    }

    /**
     * Queues every known workload and refreshes the per-phase gauges.
     */
    public void resync() {
        List<LlmWorkload> workloads;
        try {
            workloads = platform.listWorkloads();
        } catch (OrchestratorException e) {
            log.warn("✗ Resync failed: {}", e.getMessage());
            return;
        }
        Map<WorkloadPhase, Long> phases = new EnumMap<>(WorkloadPhase.class);
        for (LlmWorkload workload : workloads) {
            WorkloadPhase phase = workload.getStatus() != null && workload.getStatus().getPhase() != null
                    ? workload.getStatus().getPhase() : WorkloadPhase.PENDING;
            phases.merge(phase, 1L, Long::sum);
        }
        metrics.updatePhaseCounts(phases);

        if (!leaderElection.isLeader()) {
            return;
        }
        log.debug("Resync: {} workloads", workloads.size());
        workloads.forEach(w -> enqueue(w.key()));
    }

    /**
     * Stops accepting work, waits up to {@code drain} for in-flight reconciles
     * and cancels whatever is still running after that.
     *
     * @return true when every in-flight reconcile finished within the drain period
     */
    public boolean stop(Duration drain) {
        stopping = true;
        for (Closeable watch : watches) {
            try {
                watch.close();
            } catch (IOException e) {
                log.warn("Error closing watch: {}", e.getMessage());
            }
        }
        if (resyncTask != null) {
            resyncTask.dispose();
        }
        requeueTimers.values().forEach(Disposable::dispose);
        requeueTimers.clear();
        synchronized (lock) {
            queued.clear();
            dirty.clear();
        }

        Boolean drained = Mono.fromCallable(this::isIdle)
                .filter(idle -> idle)
                .repeatWhenEmpty(repeat -> repeat.delayElements(Duration.ofMillis(50)))
                .timeout(drain, Mono.just(false))
                .block();
        boolean clean = Boolean.TRUE.equals(drained);
        if (!clean) {
            log.warn("Drain period of {} elapsed, cancelling {} reconciles", drain, running.size());
            running.values().forEach(ReconcileContext::cancel);
        }
        sink.tryEmitComplete();
        if (workers != null) {
            workers.dispose();
        }
        log.info("Reconcile dispatcher stopped (drained={})", clean);
        return clean;
    }

    public int depth() {
        synchronized (lock) {
            return queued.size() + inFlight.size();
        }
    }

    public int pendingRequeues() {
        return requeueTimers.size();
    }

    public boolean isIdle() {
        synchronized (lock) {
            return inFlight.isEmpty();
        }
    }

    private void process(WorkloadKey key) {
        synchronized (lock) {
            queued.remove(key);
            inFlight.add(key);
        }
        ReconcileResult result = null;
        try {
            if (stopping) {
                return;
            }
            if (!leaderElection.isLeader()) {
                log.debug("Not leader, dropping {}", key);
                return;
            }
            ReconcileContext ctx = ReconcileContext.withTimeout(reconcileTimeout, clock);
            running.put(key, ctx);
            try {
                result = reconciler.reconcile(key, ctx);
            } finally {
                running.remove(key);
            }
        } finally {
            boolean again;
            synchronized (lock) {
                inFlight.remove(key);
                again = dirty.remove(key);
            }
            if (again) {
                enqueue(key);
            } else if (result != null && result.isRequeue()) {
                requeueAfter(key, result.getRequeueAfter());
            }
        }
    }

    private void requeueAfter(WorkloadKey key, Duration delay) {
        if (stopping) {
            return;
        }
        log.debug("Requeue {} in {}", key, delay);
        Disposable.Swap slot = Disposables.swap();
        Disposable previous = requeueTimers.put(key, slot);
        if (previous != null) {
            previous.dispose();
        }
        slot.update(Mono.delay(delay, scheduler)
                .doFinally(signal -> requeueTimers.remove(key, slot))
                .subscribe(tick -> enqueue(key)));
    }
}
