package io.routeweave.core.fetch;

import io.routeweave.core.model.RoutingSnapshot;

/**
 * Endpoints of the proxy's management API read by {@link NativeFetcher}.
 * Collection endpoints map onto one section of the routing document;
 * metadata endpoints do not.
 */
public enum NativeEndpoint {
    HTTP_ROUTERS("http_routers", "/api/http/routers", RoutingSnapshot.HTTP, RoutingSnapshot.ROUTERS, true),
    HTTP_SERVICES("http_services", "/api/http/services", RoutingSnapshot.HTTP, RoutingSnapshot.SERVICES, false),
    HTTP_MIDDLEWARES(
            "http_middlewares", "/api/http/middlewares", RoutingSnapshot.HTTP, RoutingSnapshot.MIDDLEWARES, false),
    TCP_ROUTERS("tcp_routers", "/api/tcp/routers", RoutingSnapshot.TCP, RoutingSnapshot.ROUTERS, false),
    TCP_SERVICES("tcp_services", "/api/tcp/services", RoutingSnapshot.TCP, RoutingSnapshot.SERVICES, false),
    TCP_MIDDLEWARES("tcp_middlewares", "/api/tcp/middlewares", RoutingSnapshot.TCP, RoutingSnapshot.MIDDLEWARES, false),
    UDP_ROUTERS("udp_routers", "/api/udp/routers", RoutingSnapshot.UDP, RoutingSnapshot.ROUTERS, false),
    UDP_SERVICES("udp_services", "/api/udp/services", RoutingSnapshot.UDP, RoutingSnapshot.SERVICES, false),
    OVERVIEW("overview", "/api/overview", null, null, false),
    VERSION("version", "/api/version", null, null, true),
    ENTRYPOINTS("entrypoints", "/api/entrypoints", null, null, false);

    private final String key;
    private final String path;
    private final String protocol;
    private final String kind;
    private final boolean critical;

    NativeEndpoint(String key, String path, String protocol, String kind, boolean critical) {
        this.key = key;
        this.path = path;
        this.protocol = protocol;
        this.kind = kind;
        this.critical = critical;
    }

    /** Name used in logs and aggregated error messages. */
    public String key() {
        return key;
    }

    public String path() {
        return path;
    }

    /** Document protocol section, null for metadata endpoints. */
    public String protocol() {
        return protocol;
    }

    /** Document collection within {@link #protocol()}, null for metadata endpoints. */
    public String kind() {
        return kind;
    }

    /** A failure of a critical endpoint aborts the whole fetch. */
    public boolean critical() {
        return critical;
    }

    /** Collection endpoints return array-or-map shaped payloads. */
    public boolean isCollection() {
        return protocol != null || this == ENTRYPOINTS;
    }
}
