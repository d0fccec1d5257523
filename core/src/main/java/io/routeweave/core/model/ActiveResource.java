package io.routeweave.core.model;

import java.util.List;

/**
 * An active resource together with the overrides assigned to it.
 *
 * @param resource        the resource row
 * @param middlewares     assigned middlewares, highest priority first
 * @param customServiceId assigned custom service, or null
 */
public record ActiveResource(Resource resource, List<MiddlewareAssignment> middlewares, String customServiceId) {

    public ActiveResource {
        middlewares = List.copyOf(middlewares);
    }
}
