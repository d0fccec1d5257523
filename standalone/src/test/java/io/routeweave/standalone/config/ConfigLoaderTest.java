package io.routeweave.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routeweave.core.model.DataSourceConfig;
import io.routeweave.core.model.DataSourceType;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("Minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("Only the datasource URL is set, everything else takes its default")
        void defaultsApplied() throws Exception {
            RouteWeaveConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.datasourceUrl()).isEqualTo("http://pangolin.internal:3001/api/v1");

            assertThat(config.serverHost()).isEqualTo("0.0.0.0");
            assertThat(config.serverPort()).isEqualTo(3456);
            assertThat(config.configPath()).isEqualTo("/api/v1/traefik-config");
            assertThat(config.invalidatePath()).isEqualTo("/admin/invalidate");
            assertThat(config.datasourceType()).isEqualTo(DataSourceType.PANGOLIN);
            assertThat(config.datasourceUsername()).isNull();
            assertThat(config.datasourceSkipTlsVerify()).isFalse();
            assertThat(config.datasourceIncludeNonTlsRouters()).isTrue();
            assertThat(config.datasourceTimeoutMs()).isEqualTo(5000);
            assertThat(config.fetchMinIntervalMs()).isEqualTo(5000);
            assertThat(config.mergeCacheTtlMs()).isEqualTo(5000);
            assertThat(config.watcherEnabled()).isTrue();
            assertThat(config.watcherIntervalMs()).isEqualTo(30000);
            assertThat(config.databaseUrl()).isEqualTo("jdbc:h2:file:./data/routeweave");
            assertThat(config.databaseMaxPoolSize()).isEqualTo(4);
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.loggingLoggers()).isEmpty();
        }

        @Test
        @DisplayName("An empty file yields the builder defaults")
        void emptyFile(@TempDir Path dir) throws IOException {
            Path empty = Files.writeString(dir.resolve("empty.yaml"), "");

            RouteWeaveConfig config = ConfigLoader.load(empty, NO_ENV);

            assertThat(config).isEqualTo(RouteWeaveConfig.builder().build());
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("Every key is mapped")
        void allFieldsPopulated() throws Exception {
            RouteWeaveConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.serverHost()).isEqualTo("127.0.0.1");
            assertThat(config.serverPort()).isEqualTo(8088);
            assertThat(config.configPath()).isEqualTo("/traefik/config");
            assertThat(config.invalidatePath()).isEqualTo("/ops/invalidate");
            assertThat(config.datasourceType()).isEqualTo(DataSourceType.TRAEFIK);
            assertThat(config.datasourceUsername()).isEqualTo("admin");
            assertThat(config.datasourcePassword()).isEqualTo("s3cret");
            assertThat(config.datasourceSkipTlsVerify()).isTrue();
            assertThat(config.datasourceIncludeNonTlsRouters()).isFalse();
            assertThat(config.fetchMinInterval()).isEqualTo(Duration.ofSeconds(1));
            assertThat(config.mergeCacheTtl()).isEqualTo(Duration.ofSeconds(2));
            assertThat(config.watcherEnabled()).isFalse();
            assertThat(config.watcherInterval()).isEqualTo(Duration.ofMinutes(1));
            assertThat(config.databaseUrl()).isEqualTo("jdbc:h2:mem:full-config");
            assertThat(config.databaseUsername()).isEqualTo("routeweave");
            assertThat(config.databasePassword()).isEqualTo("changeit");
            assertThat(config.databaseMaxPoolSize()).isEqualTo(8);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.loggingLoggers())
                    .containsOnly(
                            Map.entry("com.zaxxer.hikari", "INFO"),
                            Map.entry("io.routeweave.core.reconcile", "DEBUG"));
        }

        @Test
        @DisplayName("dataSource() carries the upstream settings with the trailing slash removed")
        void dataSourceSettings() throws Exception {
            DataSourceConfig dataSource =
                    ConfigLoader.load(fixture("full-config.yaml"), NO_ENV).dataSource();

            assertThat(dataSource.type()).isEqualTo(DataSourceType.TRAEFIK);
            assertThat(dataSource.url()).isEqualTo("https://traefik.internal:8080");
            assertThat(dataSource.hasBasicAuth()).isTrue();
            assertThat(dataSource.skipTlsVerify()).isTrue();
            assertThat(dataSource.includeNonTlsRouters()).isFalse();
            assertThat(dataSource.timeout()).isEqualTo(Duration.ofMillis(2500));
        }

        @Test
        @DisplayName("toString does not leak the upstream password")
        void toStringHidesPassword() throws Exception {
            RouteWeaveConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.toString()).doesNotContain("s3cret").contains("traefik");
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvOverlay {

        @Test
        @DisplayName("Env vars win over YAML values")
        void envWins() throws Exception {
            Map<String, String> env = Map.of(
                    "SERVER_PORT", "9000",
                    "DATASOURCE_TYPE", "pangolin",
                    "DATASOURCE_URL", "http://other:3001/api/v1",
                    "WATCHER_ENABLED", "true",
                    "MERGE_CACHE_TTL_MS", "750",
                    "LOG_FORMAT", "text");

            RouteWeaveConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.serverPort()).isEqualTo(9000);
            assertThat(config.datasourceType()).isEqualTo(DataSourceType.PANGOLIN);
            assertThat(config.datasourceUrl()).isEqualTo("http://other:3001/api/v1");
            assertThat(config.watcherEnabled()).isTrue();
            assertThat(config.mergeCacheTtlMs()).isEqualTo(750);
            assertThat(config.loggingFormat()).isEqualTo("text");
            // untouched keys keep their YAML value
            assertThat(config.serverHost()).isEqualTo("127.0.0.1");
            assertThat(config.databaseMaxPoolSize()).isEqualTo(8);
        }

        @Test
        @DisplayName("Blank env vars count as unset")
        void blankIgnored() throws Exception {
            Map<String, String> env = Map.of("SERVER_HOST", "   ", "DATABASE_MAX_POOL_SIZE", "");

            RouteWeaveConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.serverHost()).isEqualTo("127.0.0.1");
            assertThat(config.databaseMaxPoolSize()).isEqualTo(8);
        }

        @Test
        @DisplayName("Values are trimmed")
        void trimmed() throws Exception {
            Map<String, String> env = Map.of("DATASOURCE_USERNAME", "  ops  ", "FETCH_MIN_INTERVAL_MS", " 250 ");

            RouteWeaveConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), env::get);

            assertThat(config.datasourceUsername()).isEqualTo("ops");
            assertThat(config.fetchMinIntervalMs()).isEqualTo(250);
        }

        @Test
        @DisplayName("LOG_LEVELS adds to and overrides the YAML logger levels")
        void loggerLevelsEnv() throws Exception {
            Map<String, String> env = Map.of("LOG_LEVELS", "com.zaxxer.hikari=ERROR, org.eclipse.jetty = DEBUG,");

            RouteWeaveConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.loggingLoggers())
                    .containsOnly(
                            Map.entry("com.zaxxer.hikari", "ERROR"),
                            Map.entry("io.routeweave.core.reconcile", "DEBUG"),
                            Map.entry("org.eclipse.jetty", "DEBUG"));
        }

        @Test
        @DisplayName("A LOG_LEVELS entry without a level is rejected")
        void malformedLoggerLevelsEnv() throws Exception {
            Path minimal = fixture("minimal-config.yaml");
            Map<String, String> env = Map.of("LOG_LEVELS", "com.zaxxer.hikari");

            assertThatThrownBy(() -> ConfigLoader.load(minimal, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("LOG_LEVELS")
                    .hasMessageContaining("com.zaxxer.hikari");
        }

        @Test
        @DisplayName("A non-numeric env var is rejected with its name")
        void nonNumericEnv() throws Exception {
            Path minimal = fixture("minimal-config.yaml");
            Map<String, String> env = Map.of("WATCHER_INTERVAL_MS", "often");

            assertThatThrownBy(() -> ConfigLoader.load(minimal, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("WATCHER_INTERVAL_MS")
                    .hasMessageContaining("often");
        }

        @Test
        @DisplayName("An unknown type in the environment is rejected")
        void unknownTypeEnv() throws Exception {
            Path minimal = fixture("minimal-config.yaml");
            Map<String, String> env = Map.of("DATASOURCE_TYPE", "nginx");

            assertThatThrownBy(() -> ConfigLoader.load(minimal, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("nginx");
        }
    }

    @Nested
    @DisplayName("Error handling")
    class Errors {

        @Test
        @DisplayName("Missing file names the path and the --config flag")
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found")
                    .hasMessageContaining("nope.yaml")
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("Malformed YAML is reported as a parse failure")
        void malformedYaml() throws Exception {
            Path invalid = fixture("invalid-yaml.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(invalid, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("Unknown datasource type is rejected")
        void unknownType() throws Exception {
            Path unknown = fixture("unknown-type.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(unknown, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("consul");
        }

        @Test
        @DisplayName("Non-numeric port is rejected with its key")
        void nonNumericPort() throws Exception {
            Path bad = fixture("non-numeric.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(bad, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("server.port")
                    .hasMessageContaining("eighty");
        }
    }

    @Nested
    @DisplayName("Config path resolution")
    class ResolveConfigPath {

        @Test
        void defaultsToRouteweaveYaml() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("routeweave.yaml"));
        }

        @Test
        void honoursConfigFlag() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--verbose", "--config", "/etc/rw.yaml"}))
                    .isEqualTo(Path.of("/etc/rw.yaml"));
        }

        @Test
        void rejectsDanglingFlag() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config requires");
        }
    }
}
