package io.routeweave.core.model;

/**
 * Global security switches.
 *
 * @param tlsHardeningEnabled  attach hardened TLS options to every router
 * @param secureHeadersEnabled attach the secure response headers middleware
 *                             to every router
 * @param headers              header values used by that middleware
 */
public record SecuritySettings(boolean tlsHardeningEnabled, boolean secureHeadersEnabled, SecureHeaders headers) {

    public static final SecuritySettings DEFAULTS = new SecuritySettings(false, false, SecureHeaders.DEFAULTS);
}
