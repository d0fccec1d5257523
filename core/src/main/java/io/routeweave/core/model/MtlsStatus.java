package io.routeweave.core.model;

/**
 * Narrow view of the certificate authority state.
 *
 * @param enabled    global mTLS switch
 * @param hasCa      whether a CA certificate has been provisioned
 * @param caCertPath path of the CA certificate as seen by the proxy
 */
public record MtlsStatus(boolean enabled, boolean hasCa, String caCertPath) {}
