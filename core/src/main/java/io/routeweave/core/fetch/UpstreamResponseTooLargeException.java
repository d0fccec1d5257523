package io.routeweave.core.fetch;

/** Thrown when an upstream response body exceeds the configured limit. */
public final class UpstreamResponseTooLargeException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamResponseTooLargeException(String message) {
        super(message);
    }
}
