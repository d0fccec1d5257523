package io.routeweave.core.fetch;

import java.net.Socket;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * Accepts every server certificate, including hostname mismatches. Only
 * installed when a data source is configured with {@code skip-tls-verify}.
 */
final class TrustAllTrustManager extends X509ExtendedTrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        failWhenUsedOnServer();
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        failWhenUsedOnServer();
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
        failWhenUsedOnServer();
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }

    private static void failWhenUsedOnServer() {
        throw new IllegalStateException("TrustAllTrustManager is client-only");
    }
}
