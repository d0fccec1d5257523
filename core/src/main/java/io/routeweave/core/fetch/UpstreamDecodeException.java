package io.routeweave.core.fetch;

/** Thrown when an upstream payload is not the JSON shape that was expected. */
public final class UpstreamDecodeException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamDecodeException(String message) {
        super(message);
    }

    public UpstreamDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
