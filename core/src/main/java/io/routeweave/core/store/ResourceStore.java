package io.routeweave.core.store;

import io.routeweave.core.model.DiscoveredRoute;
import io.routeweave.core.model.Resource;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link Resource} rows.
 *
 * <p>
 * Every mutating method runs in its own transaction. Lookups return the
 * internal id only; reconciliation never needs the full row.
 */
public interface ResourceStore {

    /** Internal ids of all active resources. Rows that cannot be read are skipped. */
    List<String> activeIds();

    /** Active resource currently known under {@code upstreamId}. */
    Optional<String> findActiveByUpstreamId(String upstreamId);

    /** Active resource routing {@code host}. */
    Optional<String> findActiveByHost(String host);

    /**
     * Resource created before upstream ids were tracked: its internal id
     * equals {@code upstreamId}, or it has no upstream id and routes
     * {@code host}. Matches regardless of status.
     */
    Optional<String> findLegacy(String upstreamId, String host);

    Optional<Resource> findById(String id);

    List<Resource> findAll();

    /** Inserts a new row. */
    void create(Resource resource);

    /**
     * Applies the upstream-owned fields of {@code route} to an existing row
     * and marks it active. The priority is taken over only when it is
     * positive and the row's priority was not set manually.
     *
     * <p>
     * Any other active row already routing the route's host is disabled in
     * the same transaction, so a host never has two active resources.
     *
     * @param id         internal id of the row
     * @param upstreamId normalized upstream id to record
     * @param route      the observed route
     * @return ids of the rows disabled because they held the host
     */
    List<String> refreshFromUpstream(String id, String upstreamId, DiscoveredRoute route);

    /**
     * Rewrites the administrator-owned fields of an existing row (priority,
     * headers, mTLS, security flags).
     */
    void updateSettings(Resource resource);

    /** Marks the row disabled. Returns false when no such row exists. */
    boolean disable(String id);

    /** Hard-deletes the row and its assignments. */
    boolean delete(String id);
}
