package io.routeweave.core.reconcile;

import io.routeweave.core.fetch.UpstreamException;

/** One reconciliation pass of upstream state into storage. */
public interface Reconciler {

    /** Short name used in logs and thread names. */
    String name();

    /**
     * Runs one cycle.
     *
     * @throws UpstreamException    if the upstream state could not be fetched;
     *                              storage is left untouched
     * @throws InterruptedException if the calling thread is interrupted
     */
    ReconcileResult reconcile() throws UpstreamException, InterruptedException;
}
