package com.llmorch.orchestrator.reconcile;

import com.llmorch.orchestrator.error.ReconcileCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token and deadline of one reconcile. The reconciler calls
 * {@link #checkpoint(String)} before every platform write.
 */
public class ReconcileContext {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Instant deadline;
    private final Clock clock;

    public ReconcileContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static ReconcileContext withTimeout(Duration timeout, Clock clock) {
        return new ReconcileContext(clock.instant().plus(timeout), clock);
    }

    /**
     * Context that is never cancelled and has no deadline.
     */
    public static ReconcileContext unbounded(Clock clock) {
        return new ReconcileContext(Instant.MAX, clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || clock.instant().isAfter(deadline);
    }

    /**
     * @throws ReconcileCancelledException when cancelled or past the deadline
     */
    public void checkpoint(String step) {
        if (cancelled.get()) {
            throw new ReconcileCancelledException("Cancelled before " + step);
        }
        if (clock.instant().isAfter(deadline)) {
            throw ReconcileCancelledException.deadline("Deadline passed before " + step);
        }
    }
}
