package io.routeweave.core.rule;

/**
 * Normalizes upstream router and service identifiers so that the same
 * object keeps one identity across providers and naming glitches.
 */
public final class IdNormalizer {

    private static final String AUTH_SUFFIX = "-auth";

    private IdNormalizer() {
        // utility class
    }

    /**
     * Strips the {@code @provider} suffix and collapses repeated
     * {@code -auth} suffixes: {@code svc-auth-auth@docker} becomes
     * {@code svc-auth}, {@code r-redirect-auth} becomes {@code r-redirect}.
     *
     * @param id upstream identifier, may be null
     * @return the normalized identifier, empty for null input
     */
    public static String normalize(String id) {
        String normalized = stripProvider(id);
        while (normalized.endsWith(AUTH_SUFFIX + AUTH_SUFFIX)) {
            normalized = normalized.substring(0, normalized.length() - AUTH_SUFFIX.length());
        }
        if (normalized.endsWith("-redirect" + AUTH_SUFFIX)) {
            normalized = normalized.substring(0, normalized.length() - AUTH_SUFFIX.length());
        }
        return normalized;
    }

    /** Removes everything from the first {@code @}. */
    public static String stripProvider(String id) {
        if (id == null) {
            return "";
        }
        int at = id.indexOf('@');
        return at >= 0 ? id.substring(0, at) : id;
    }

    /** Returns the {@code @provider} suffix including the {@code @}, or an empty string. */
    public static String providerSuffix(String id) {
        if (id == null) {
            return "";
        }
        int at = id.indexOf('@');
        return at >= 0 ? id.substring(at) : "";
    }
}
