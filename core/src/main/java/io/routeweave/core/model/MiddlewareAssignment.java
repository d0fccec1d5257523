package io.routeweave.core.model;

/**
 * A middleware attached to a resource. Higher priorities run earlier in the
 * router's chain.
 */
public record MiddlewareAssignment(String middlewareId, int priority) {}
