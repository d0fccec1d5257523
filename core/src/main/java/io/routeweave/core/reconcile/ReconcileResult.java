package io.routeweave.core.reconcile;

/**
 * Counters of one reconciliation cycle.
 *
 * @param created  rows created
 * @param updated  rows refreshed from upstream
 * @param disabled rows disabled because they vanished upstream
 * @param skipped  upstream items ignored (no host, no service, unchanged)
 * @param failed   items whose write failed
 */
public record ReconcileResult(int created, int updated, int disabled, int skipped, int failed) {}
