package io.routeweave.core.model;

/**
 * Per-resource mTLS whitelist overrides. String fields hold raw JSON as
 * stored; empty means "inherit the global default".
 *
 * @param enabled         require a whitelisted client certificate
 * @param rules           whitelist rules, JSON array
 * @param requestHeaders  request header templates, JSON object
 * @param rejectMessage   message returned on rejection
 * @param rejectCode      status code returned on rejection
 * @param refreshInterval refresh interval, e.g. {@code 300s}
 * @param externalData    external data source descriptor, JSON object
 */
public record ResourceMtls(
        boolean enabled,
        String rules,
        String requestHeaders,
        String rejectMessage,
        int rejectCode,
        String refreshInterval,
        String externalData) {

    public static final int DEFAULT_REJECT_CODE = 403;

    public static final ResourceMtls NONE = new ResourceMtls(false, "", "", "", DEFAULT_REJECT_CODE, "", "");

    /** Returns an enabled override set with no per-resource overrides. */
    public static ResourceMtls enabledWithDefaults() {
        return new ResourceMtls(true, "", "", "", DEFAULT_REJECT_CODE, "", "");
    }
}
