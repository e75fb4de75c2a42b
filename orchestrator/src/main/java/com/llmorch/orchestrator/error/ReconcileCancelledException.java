package com.llmorch.orchestrator.error;

/**
 * The reconcile's cancellation token fired or its deadline passed before the next write.
 * <p>
 * A passed deadline is a timeout and is retried with back-off; an explicit
 * cancellation comes from shutdown and is not.
 * </p>
 */
public class ReconcileCancelledException extends OrchestratorException {
    public static final String REASON = "Cancelled";
    public static final String DEADLINE_REASON = "DeadlineExceeded";

    private final boolean deadlineExceeded;

    public ReconcileCancelledException(String message) {
        this(message, false);
    }

    public ReconcileCancelledException(String message, boolean deadlineExceeded) {
        super(deadlineExceeded ? DEADLINE_REASON : REASON, true, message);
        this.deadlineExceeded = deadlineExceeded;
    }

    public static ReconcileCancelledException deadline(String message) {
        return new ReconcileCancelledException(message, true);
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}
