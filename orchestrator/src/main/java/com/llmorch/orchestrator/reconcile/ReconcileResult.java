package com.llmorch.orchestrator.reconcile;

import lombok.Value;

import java.time.Duration;

/**
 * Outcome of one reconcile pass.
 */
@Value
public class ReconcileResult {
    public enum Outcome {
        /**
         * Converged, or waiting for the next event or resync.
         */
        DONE("success"),
        REQUEUE("requeue"),
        /**
         * Terminal until the spec changes.
         */
        FAILED("failed"),
        /**
         * Result dropped; the workload is picked up again on the next tick.
         */
        CANCELLED("cancelled");

        private final String label;

        Outcome(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    Outcome outcome;
    Duration requeueAfter;
    String reason;

    public static ReconcileResult done() {
        return new ReconcileResult(Outcome.DONE, null, null);
    }

    public static ReconcileResult requeue(Duration after, String reason) {
        return new ReconcileResult(Outcome.REQUEUE, after, reason);
    }

    public static ReconcileResult failed(String reason) {
        return new ReconcileResult(Outcome.FAILED, null, reason);
    }

    public static ReconcileResult cancelled() {
        return new ReconcileResult(Outcome.CANCELLED, null, null);
    }

    public boolean isRequeue() {
        return outcome == Outcome.REQUEUE;
    }
}
