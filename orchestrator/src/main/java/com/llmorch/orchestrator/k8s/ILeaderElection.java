package com.llmorch.orchestrator.k8s;

import java.util.function.Consumer;

/**
 * Leadership gate for the reconcile loop. Only the leader issues writes.
 */
public interface ILeaderElection {

    void start();

    void stop();

    boolean isLeader();

    /**
     * Registers a callback invoked with the new value on every leadership transition.
     */
    void addListener(Consumer<Boolean> listener);
}
