package io.routeweave.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds RFC 9457 Problem Details bodies for errors raised while serving the
 * merged document.
 *
 * <pre>{@code
 * {
 * "type": "urn:routeweave:upstream-unavailable",
 * "title": "Upstream Unavailable",
 * "status": 502,
 * "detail": "Failed to fetch upstream config: Connection refused",
 * "instance": "/api/v1/traefik-config"
 * }
 * }</pre>
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String CONTENT_TYPE = "application/problem+json";

    static final String URN_UPSTREAM_UNAVAILABLE = "urn:routeweave:upstream-unavailable";
    static final String URN_THROTTLED = "urn:routeweave:fetch-throttled";
    static final String URN_INTERNAL_ERROR = "urn:routeweave:internal-error";

    private ProblemDetail() {
        // utility class
    }

    /** The upstream authority could not be read and nothing is cached. */
    public static JsonNode upstreamUnavailable(String detail, String instancePath) {
        return build(URN_UPSTREAM_UNAVAILABLE, "Upstream Unavailable", 502, detail, instancePath);
    }

    /** First fetch refused by the minimum interval; the client should retry. */
    public static JsonNode throttled(String detail, String instancePath) {
        return build(URN_THROTTLED, "Service Unavailable", 503, detail, instancePath);
    }

    /** Storage failure or any unexpected error. */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
