package io.routeweave.core.fetch;

/**
 * Base exception for failures talking to the upstream routing authority.
 * Subclasses let callers tell transport, protocol and payload failures
 * apart.
 */
public abstract class UpstreamException extends Exception {

    private static final long serialVersionUID = 1L;

    protected UpstreamException(String message) {
        super(message);
    }

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
