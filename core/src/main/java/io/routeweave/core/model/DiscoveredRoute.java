package io.routeweave.core.model;

/**
 * A routable router surfaced by an upstream fetch, reduced to the fields
 * reconciliation needs.
 *
 * @param upstreamId  router identifier as reported upstream (may churn)
 * @param host        host extracted from the router rule, never empty
 * @param serviceId   service the router points at
 * @param entrypoints comma-joined entrypoint names
 * @param tlsDomains  comma-joined TLS domains (main and SANs)
 * @param priority    router priority, 0 when the upstream did not say
 * @param sourceType  {@link DataSourceType#value()} of the fetcher
 */
public record DiscoveredRoute(
        String upstreamId,
        String host,
        String serviceId,
        String entrypoints,
        String tlsDomains,
        int priority,
        String sourceType) {}
