package io.routeweave.core.store;

import io.routeweave.core.model.ActiveResource;
import io.routeweave.core.model.MiddlewareRecord;
import java.util.List;

/** Administrator-defined middlewares and their assignment to resources. */
public interface OverrideStore {

    /** All stored middlewares, ordered by id. Rows that cannot be read are skipped. */
    List<MiddlewareRecord> middlewares();

    /** Inserts or replaces a middleware definition. */
    void saveMiddleware(MiddlewareRecord middleware);

    boolean deleteMiddleware(String id);

    /** Attaches a middleware to a resource, replacing the priority of an existing assignment. */
    void assignMiddleware(String resourceId, String middlewareId, int priority);

    boolean unassignMiddleware(String resourceId, String middlewareId);

    /** Routes a resource to a stored service instead of its upstream one; null clears the assignment. */
    void assignService(String resourceId, String serviceId);

    /**
     * Active resources with their middleware assignments (highest priority
     * first, then by middleware id) and custom service, ordered by resource id.
     */
    List<ActiveResource> activeResources();
}
