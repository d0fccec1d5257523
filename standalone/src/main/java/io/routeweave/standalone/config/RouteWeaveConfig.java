package io.routeweave.standalone.config;

import io.routeweave.core.model.DataSourceConfig;
import io.routeweave.core.model.DataSourceType;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration of a routeweave instance.
 *
 * <p>
 * Every field has a default; use {@link #builder()} to override selectively.
 *
 * @param serverHost                     bind address of the HTTP server
 * @param serverPort                     listen port, 0 for an ephemeral port
 * @param configPath                     path serving the merged document
 * @param invalidatePath                 path that expires the merged cache
 * @param datasourceType                 upstream authority kind
 * @param datasourceUrl                  upstream base URL
 * @param datasourceUsername             basic auth user, may be null
 * @param datasourcePassword             basic auth password, may be null
 * @param datasourceSkipTlsVerify        accept any upstream certificate
 * @param datasourceIncludeNonTlsRouters surface routers without a cert resolver
 * @param datasourceTimeoutMs            per-request upstream timeout
 * @param fetchMinIntervalMs             minimum spacing of upstream fetches
 * @param mergeCacheTtlMs                lifetime of a merged document
 * @param watcherEnabled                 run the reconciliation watchers
 * @param watcherIntervalMs              delay between reconciliation cycles
 * @param databaseUrl                    JDBC URL of the store
 * @param databaseUsername               JDBC user
 * @param databasePassword               JDBC password
 * @param databaseMaxPoolSize            connection pool size
 * @param loggingFormat                  {@code json} or {@code text}
 * @param loggingLevel                   root log level
 * @param loggingLoggers                 level per logger name, applied over the root level
 */
public record RouteWeaveConfig(
        String serverHost,
        int serverPort,
        String configPath,
        String invalidatePath,
        DataSourceType datasourceType,
        String datasourceUrl,
        String datasourceUsername,
        String datasourcePassword,
        boolean datasourceSkipTlsVerify,
        boolean datasourceIncludeNonTlsRouters,
        int datasourceTimeoutMs,
        int fetchMinIntervalMs,
        int mergeCacheTtlMs,
        boolean watcherEnabled,
        int watcherIntervalMs,
        String databaseUrl,
        String databaseUsername,
        String databasePassword,
        int databaseMaxPoolSize,
        String loggingFormat,
        String loggingLevel,
        Map<String, String> loggingLoggers) {

    public RouteWeaveConfig {
        loggingLoggers = Map.copyOf(loggingLoggers);
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Upstream connection settings for the fetcher factory. */
    public DataSourceConfig dataSource() {
        return new DataSourceConfig(
                datasourceType,
                datasourceUrl,
                datasourceUsername,
                datasourcePassword,
                datasourceSkipTlsVerify,
                datasourceIncludeNonTlsRouters,
                Duration.ofMillis(datasourceTimeoutMs));
    }

    public Duration fetchMinInterval() {
        return Duration.ofMillis(fetchMinIntervalMs);
    }

    public Duration mergeCacheTtl() {
        return Duration.ofMillis(mergeCacheTtlMs);
    }

    public Duration watcherInterval() {
        return Duration.ofMillis(watcherIntervalMs);
    }

    @Override
    public String toString() {
        return "RouteWeaveConfig[server=" + serverHost + ":" + serverPort + ", configPath=" + configPath
                + ", datasource=" + dataSource() + ", database=" + databaseUrl + ", watcherEnabled="
                + watcherEnabled + "]";
    }

    /** Builder for {@link RouteWeaveConfig}. */
    public static final class Builder {
        private String serverHost = "0.0.0.0";
        private int serverPort = 3456;
        private String configPath = "/api/v1/traefik-config";
        private String invalidatePath = "/admin/invalidate";
        private DataSourceType datasourceType = DataSourceType.PANGOLIN;
        private String datasourceUrl = "http://pangolin:3001/api/v1";
        private String datasourceUsername;
        private String datasourcePassword;
        private boolean datasourceSkipTlsVerify = false;
        private boolean datasourceIncludeNonTlsRouters = true;
        private int datasourceTimeoutMs = 5000;
        private int fetchMinIntervalMs = 5000;
        private int mergeCacheTtlMs = 5000;
        private boolean watcherEnabled = true;
        private int watcherIntervalMs = 30000;
        private String databaseUrl = "jdbc:h2:file:./data/routeweave";
        private String databaseUsername = "sa";
        private String databasePassword = "";
        private int databaseMaxPoolSize = 4;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private final Map<String, String> loggingLoggers = new LinkedHashMap<>();

        Builder() {}

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder configPath(String configPath) {
            this.configPath = configPath;
            return this;
        }

        public Builder invalidatePath(String invalidatePath) {
            this.invalidatePath = invalidatePath;
            return this;
        }

        public Builder datasourceType(DataSourceType datasourceType) {
            this.datasourceType = datasourceType;
            return this;
        }

        public Builder datasourceUrl(String datasourceUrl) {
            this.datasourceUrl = datasourceUrl;
            return this;
        }

        public Builder datasourceUsername(String datasourceUsername) {
            this.datasourceUsername = datasourceUsername;
            return this;
        }

        public Builder datasourcePassword(String datasourcePassword) {
            this.datasourcePassword = datasourcePassword;
            return this;
        }

        public Builder datasourceSkipTlsVerify(boolean datasourceSkipTlsVerify) {
            this.datasourceSkipTlsVerify = datasourceSkipTlsVerify;
            return this;
        }

        public Builder datasourceIncludeNonTlsRouters(boolean datasourceIncludeNonTlsRouters) {
            this.datasourceIncludeNonTlsRouters = datasourceIncludeNonTlsRouters;
            return this;
        }

        public Builder datasourceTimeoutMs(int datasourceTimeoutMs) {
            this.datasourceTimeoutMs = datasourceTimeoutMs;
            return this;
        }

        public Builder fetchMinIntervalMs(int fetchMinIntervalMs) {
            this.fetchMinIntervalMs = fetchMinIntervalMs;
            return this;
        }

        public Builder mergeCacheTtlMs(int mergeCacheTtlMs) {
            this.mergeCacheTtlMs = mergeCacheTtlMs;
            return this;
        }

        public Builder watcherEnabled(boolean watcherEnabled) {
            this.watcherEnabled = watcherEnabled;
            return this;
        }

        public Builder watcherIntervalMs(int watcherIntervalMs) {
            this.watcherIntervalMs = watcherIntervalMs;
            return this;
        }

        public Builder databaseUrl(String databaseUrl) {
            this.databaseUrl = databaseUrl;
            return this;
        }

        public Builder databaseUsername(String databaseUsername) {
            this.databaseUsername = databaseUsername;
            return this;
        }

        public Builder databasePassword(String databasePassword) {
            this.databasePassword = databasePassword;
            return this;
        }

        public Builder databaseMaxPoolSize(int databaseMaxPoolSize) {
            this.databaseMaxPoolSize = databaseMaxPoolSize;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /** Sets the level of one logger; a later call for the same name wins. */
        public Builder loggerLevel(String logger, String level) {
            this.loggingLoggers.put(logger, level);
            return this;
        }

        public RouteWeaveConfig build() {
            return new RouteWeaveConfig(
                    serverHost,
                    serverPort,
                    configPath,
                    invalidatePath,
                    datasourceType,
                    datasourceUrl,
                    datasourceUsername,
                    datasourcePassword,
                    datasourceSkipTlsVerify,
                    datasourceIncludeNonTlsRouters,
                    datasourceTimeoutMs,
                    fetchMinIntervalMs,
                    mergeCacheTtlMs,
                    watcherEnabled,
                    watcherIntervalMs,
                    databaseUrl,
                    databaseUsername,
                    databasePassword,
                    databaseMaxPoolSize,
                    loggingFormat,
                    loggingLevel,
                    loggingLoggers);
        }
    }
}
