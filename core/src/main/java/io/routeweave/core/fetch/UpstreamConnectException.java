package io.routeweave.core.fetch;

/**
 * Thrown when the upstream cannot be reached: connection refused, DNS
 * failure, TLS handshake failure or connect timeout. This is the only
 * failure that makes the native fetcher try its fallback URLs.
 */
public final class UpstreamConnectException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
