package io.routeweave.core.fetch;

import io.routeweave.core.model.DataSourceConfig;
import io.routeweave.core.model.DataSourceType;

/** Builds the fetcher matching a configured data source type. */
public final class FetcherFactory {

    private FetcherFactory() {
        // utility class
    }

    /**
     * Creates an unthrottled fetcher for the given data source. Basic auth
     * applies to both types; TLS verification can only be skipped for the
     * native management API.
     */
    public static UpstreamFetcher create(DataSourceConfig config) {
        boolean skipTlsVerify = config.type() == DataSourceType.TRAEFIK && config.skipTlsVerify();
        UpstreamClient client = new UpstreamClient(
                config.timeout(),
                config.username(),
                config.password(),
                skipTlsVerify,
                UpstreamClient.DEFAULT_MAX_BODY_BYTES);
        return switch (config.type()) {
            case TRAEFIK -> new NativeFetcher(config, client);
            case PANGOLIN -> new AggregatorFetcher(config, client);
        };
    }
}
