package io.routeweave.core.fetch;

/** Thrown when the upstream answers with a non-2xx status. */
public final class UpstreamStatusException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    /** Longest body excerpt carried in the message. */
    private static final int MAX_EXCERPT = 256;

    private final int statusCode;

    public UpstreamStatusException(String url, int statusCode, String body) {
        super("Unexpected status " + statusCode + " from " + url + excerpt(body));
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    private static String excerpt(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_EXCERPT ? trimmed.substring(0, MAX_EXCERPT) + "..." : trimmed);
    }
}
