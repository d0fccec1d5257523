package io.routeweave.core.fetch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown by the native fetcher when one or more critical endpoints failed.
 * The message names every failing critical endpoint, e.g.
 * {@code critical endpoints failed: http_routers: ...; version: ...}.
 */
public final class CriticalEndpointException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    private final transient Map<String, UpstreamException> failures;

    public CriticalEndpointException(Map<String, UpstreamException> failures) {
        super(message(failures), failures.values().iterator().next());
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /** Failing endpoint names mapped to their cause, in endpoint order. */
    public Map<String, UpstreamException> failures() {
        return failures;
    }

    /**
     * Returns {@code true} when every critical failure was a transport
     * failure, i.e. the base URL itself is likely wrong or unreachable.
     */
    public boolean isConnectivityFailure() {
        return failures.values().stream().allMatch(UpstreamConnectException.class::isInstance);
    }

    private static String message(Map<String, UpstreamException> failures) {
        List<String> parts = failures.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue().getMessage())
                .toList();
        return "critical endpoints failed: " + String.join("; ", parts);
    }
}
