package io.routeweave.core.fetch;

/** Thrown when the upstream accepts the connection but does not answer in time. */
public final class UpstreamTimeoutException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
