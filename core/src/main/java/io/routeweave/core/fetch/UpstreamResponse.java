package io.routeweave.core.fetch;

import java.util.Map;

/**
 * Upstream HTTP response.
 *
 * @param statusCode HTTP status code
 * @param headers    response headers, lowercase names, first value only
 * @param body       response body as UTF-8 text, never null
 */
public record UpstreamResponse(int statusCode, Map<String, String> headers, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
