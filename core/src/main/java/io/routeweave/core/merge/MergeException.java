package io.routeweave.core.merge;

/**
 * Thrown when no merged document can be produced: the upstream fetch failed
 * with nothing cached, or stored overrides could not be read.
 */
public final class MergeException extends Exception {

    private static final long serialVersionUID = 1L;

    private final boolean upstreamFailure;

    public MergeException(String message, Throwable cause, boolean upstreamFailure) {
        super(message, cause);
        this.upstreamFailure = upstreamFailure;
    }

    /** True when the cause is an upstream fetch failure rather than a storage failure. */
    public boolean isUpstreamFailure() {
        return upstreamFailure;
    }
}
