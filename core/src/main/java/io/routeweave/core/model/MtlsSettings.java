package io.routeweave.core.model;

/**
 * Global mTLS settings and the whitelist plugin defaults applied to every
 * mTLS-enabled resource.
 *
 * @param enabled         global mTLS switch
 * @param caCertPath      CA certificate path, empty when no CA exists
 * @param rules           default whitelist rules, raw JSON array or empty
 * @param requestHeaders  default request header templates, raw JSON object or empty
 * @param rejectMessage   default reject message
 * @param refreshInterval default refresh interval in seconds, 0 for unset
 */
public record MtlsSettings(
        boolean enabled,
        String caCertPath,
        String rules,
        String requestHeaders,
        String rejectMessage,
        int refreshInterval) {

    public static final MtlsSettings DISABLED = new MtlsSettings(false, "", "", "", "", 0);

    public boolean hasCa() {
        return caCertPath != null && !caCertPath.isEmpty();
    }

    /** Projects these settings onto the narrow {@link MtlsStatus} contract. */
    public MtlsStatus status() {
        return new MtlsStatus(enabled, hasCa(), caCertPath == null ? "" : caCertPath);
    }
}
