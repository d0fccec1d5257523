package io.routeweave.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one upstream fetch.
 *
 * <p>
 * The routing document keeps the proxy's own shape
 * ({@code http}/{@code tcp}/{@code udp}/{@code tls}) as an open Jackson tree,
 * so fields contributed by plugins survive re-serialization untouched. Every
 * collection section is present, possibly empty, so consumers never branch
 * on absence.
 *
 * <p>
 * The document is copied on the way in and on the way out;
 * {@link #section(String, String)} returns a read view that callers must
 * not mutate.
 */
public final class RoutingSnapshot {

    public static final String HTTP = "http";
    public static final String TCP = "tcp";
    public static final String UDP = "udp";
    public static final String TLS = "tls";

    public static final String ROUTERS = "routers";
    public static final String SERVICES = "services";
    public static final String MIDDLEWARES = "middlewares";
    public static final String OPTIONS = "options";

    private final String sourceType;
    private final ObjectNode document;
    private final List<DiscoveredRoute> routes;
    private final List<DiscoveredRoute> tcpRoutes;
    private final JsonNode version;
    private final JsonNode entrypoints;
    private final JsonNode overview;
    private final Instant fetchedAt;

    public RoutingSnapshot(
            String sourceType,
            ObjectNode document,
            List<DiscoveredRoute> routes,
            List<DiscoveredRoute> tcpRoutes,
            JsonNode version,
            JsonNode entrypoints,
            JsonNode overview,
            Instant fetchedAt) {
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType");
        this.document = ensureSections(Objects.requireNonNull(document, "document").deepCopy());
        this.routes = List.copyOf(routes);
        this.tcpRoutes = List.copyOf(tcpRoutes);
        this.version = version != null ? version : MissingNode.getInstance();
        this.entrypoints = entrypoints != null ? entrypoints : MissingNode.getInstance();
        this.overview = overview != null ? overview : MissingNode.getInstance();
        this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt");
    }

    /** Returns a document with every collection section present and empty. */
    public static ObjectNode emptyDocument() {
        return ensureSections(JsonNodeFactory.instance.objectNode());
    }

    /**
     * Initializes any absent (or non-object) collection section of the given
     * document to an empty object, in place.
     *
     * @return the same document
     */
    public static ObjectNode ensureSections(ObjectNode document) {
        ObjectNode http = objectChild(document, HTTP);
        objectChild(http, ROUTERS);
        objectChild(http, SERVICES);
        objectChild(http, MIDDLEWARES);

        ObjectNode tcp = objectChild(document, TCP);
        objectChild(tcp, ROUTERS);
        objectChild(tcp, SERVICES);
        objectChild(tcp, MIDDLEWARES);

        ObjectNode udp = objectChild(document, UDP);
        objectChild(udp, ROUTERS);
        objectChild(udp, SERVICES);

        ObjectNode tls = objectChild(document, TLS);
        objectChild(tls, OPTIONS);
        return document;
    }

    private static ObjectNode objectChild(ObjectNode parent, String name) {
        JsonNode child = parent.get(name);
        if (child instanceof ObjectNode object) {
            return object;
        }
        return parent.putObject(name);
    }

    /** Returns a private, mutable deep copy of the routing document. */
    public ObjectNode copyDocument() {
        return document.deepCopy();
    }

    /**
     * Returns one collection of the document, e.g. {@code section("http", "routers")}.
     * Missing sections yield a {@link MissingNode}.
     */
    public JsonNode section(String protocol, String kind) {
        return document.path(protocol).path(kind);
    }

    public JsonNode httpRouters() {
        return section(HTTP, ROUTERS);
    }

    public JsonNode httpServices() {
        return section(HTTP, SERVICES);
    }

    public JsonNode httpMiddlewares() {
        return section(HTTP, MIDDLEWARES);
    }

    public String sourceType() {
        return sourceType;
    }

    /** Routable HTTP routes, system routers already excluded. */
    public List<DiscoveredRoute> routes() {
        return routes;
    }

    /** Routable TCP routes, keyed by SNI host. */
    public List<DiscoveredRoute> tcpRoutes() {
        return tcpRoutes;
    }

    public JsonNode version() {
        return version;
    }

    public JsonNode entrypoints() {
        return entrypoints;
    }

    public JsonNode overview() {
        return overview;
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }

    @Override
    public String toString() {
        return "RoutingSnapshot[source=" + sourceType + ", routes=" + routes.size() + ", tcpRoutes="
                + tcpRoutes.size() + ", httpServices=" + httpServices().size() + ", httpMiddlewares="
                + httpMiddlewares().size() + ", fetchedAt=" + fetchedAt + "]";
    }
}
