package com.llmorch.orchestrator.reconcile;

import com.llmorch.core.model.WorkloadKey;

/**
 * One reconcile pass of a single workload.
 */
public interface IReconciler {

    /**
     * Drives the workload toward its spec. Never throws; every failure is
     * classified into the returned result.
     */
    ReconcileResult reconcile(WorkloadKey key, ReconcileContext ctx);
}
