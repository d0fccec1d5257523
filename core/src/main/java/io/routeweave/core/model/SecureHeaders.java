package io.routeweave.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values for the secure response headers middleware. Empty values are
 * omitted from the published middleware.
 */
public record SecureHeaders(
        String xContentTypeOptions,
        String xFrameOptions,
        String xXssProtection,
        String hsts,
        String referrerPolicy,
        String contentSecurityPolicy,
        String permissionsPolicy) {

    public static final SecureHeaders DEFAULTS = new SecureHeaders(
            "nosniff",
            "SAMEORIGIN",
            "1; mode=block",
            "max-age=31536000; includeSubDomains",
            "strict-origin-when-cross-origin",
            "",
            "");

    /** Returns the non-empty headers keyed by their HTTP names, in a fixed order. */
    public Map<String, String> toHeaderMap() {
        Map<String, String> headers = new LinkedHashMap<>();
        putIfPresent(headers, "X-Content-Type-Options", xContentTypeOptions);
        putIfPresent(headers, "X-Frame-Options", xFrameOptions);
        putIfPresent(headers, "X-XSS-Protection", xXssProtection);
        putIfPresent(headers, "Strict-Transport-Security", hsts);
        putIfPresent(headers, "Referrer-Policy", referrerPolicy);
        putIfPresent(headers, "Content-Security-Policy", contentSecurityPolicy);
        putIfPresent(headers, "Permissions-Policy", permissionsPolicy);
        return headers;
    }

    private static void putIfPresent(Map<String, String> headers, String name, String value) {
        if (value != null && !value.isEmpty()) {
            headers.put(name, value);
        }
    }
}
