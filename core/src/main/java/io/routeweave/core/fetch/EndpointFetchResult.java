package io.routeweave.core.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Outcome of one endpoint call within a native fetch. Exactly one of
 * {@code items}/{@code payload} or {@code error} is meaningful.
 *
 * @param endpoint the endpoint
 * @param items    decoded collection items, empty for metadata endpoints
 * @param payload  raw payload for metadata endpoints
 * @param error    the failure, or null on success
 */
record EndpointFetchResult(NativeEndpoint endpoint, List<ObjectNode> items, JsonNode payload, UpstreamException error) {

    static EndpointFetchResult success(NativeEndpoint endpoint, List<ObjectNode> items, JsonNode payload) {
        return new EndpointFetchResult(endpoint, items, payload, null);
    }

    static EndpointFetchResult failure(NativeEndpoint endpoint, UpstreamException error) {
        return new EndpointFetchResult(endpoint, List.of(), null, error);
    }

    boolean failed() {
        return error != null;
    }

    boolean critical() {
        return endpoint.critical();
    }
}
