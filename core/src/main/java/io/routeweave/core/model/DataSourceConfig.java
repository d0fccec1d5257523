package io.routeweave.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for the upstream routing authority.
 *
 * @param type                 which authority (and therefore which fetcher)
 * @param url                  base URL, without trailing slash
 * @param username             basic auth user, null or empty for none
 * @param password             basic auth password
 * @param skipTlsVerify        accept any server certificate (native API only)
 * @param includeNonTlsRouters surface routers that carry no certificate resolver
 * @param timeout              per-request timeout
 */
public record DataSourceConfig(
        DataSourceType type,
        String url,
        String username,
        String password,
        boolean skipTlsVerify,
        boolean includeNonTlsRouters,
        Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public DataSourceConfig {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(url, "url");
        url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    /** Convenience factory for an unauthenticated source with default options. */
    public static DataSourceConfig of(DataSourceType type, String url) {
        return new DataSourceConfig(type, url, null, null, false, true, DEFAULT_TIMEOUT);
    }

    /** Returns {@code true} when basic auth credentials are configured. */
    public boolean hasBasicAuth() {
        return username != null && !username.isEmpty();
    }

    /** Returns a copy pointing at a different base URL. */
    public DataSourceConfig withUrl(String newUrl) {
        return new DataSourceConfig(type, newUrl, username, password, skipTlsVerify, includeNonTlsRouters, timeout);
    }

    @Override
    public String toString() {
        return "DataSourceConfig[type=" + type + ", url=" + url + ", basicAuth=" + hasBasicAuth()
                + ", skipTlsVerify=" + skipTlsVerify + ", includeNonTlsRouters=" + includeNonTlsRouters
                + ", timeout=" + timeout + "]";
    }
}
