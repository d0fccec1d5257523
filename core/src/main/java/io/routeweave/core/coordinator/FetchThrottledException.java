package io.routeweave.core.coordinator;

import io.routeweave.core.fetch.UpstreamException;
import java.time.Duration;

/**
 * Thrown when a fetch is requested inside the minimum interval and no
 * previous snapshot exists to answer it with.
 */
public final class FetchThrottledException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    private final Duration retryAfter;

    public FetchThrottledException(Duration retryAfter) {
        super("Fetch throttled, no cached snapshot available; retry in " + retryAfter.toMillis() + " ms");
        this.retryAfter = retryAfter;
    }

    /** Time left until the next fetch is allowed. */
    public Duration retryAfter() {
        return retryAfter;
    }
}
