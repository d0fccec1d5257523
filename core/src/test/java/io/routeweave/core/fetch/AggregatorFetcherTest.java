package io.routeweave.core.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routeweave.core.model.DataSourceConfig;
import io.routeweave.core.model.DataSourceType;
import io.routeweave.core.model.DiscoveredRoute;
import io.routeweave.core.model.RoutingSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AggregatorFetcher")
class AggregatorFetcherTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private MockUpstream upstream;
    private AggregatorFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        upstream = new MockUpstream();
        fetcher = new AggregatorFetcher(
                DataSourceConfig.of(DataSourceType.PANGOLIN, upstream.baseUrl() + "/api/v1"),
                new UpstreamClient(TIMEOUT),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        upstream.close();
    }

    @Test
    @DisplayName("routers with a host become routes, aggregator system routers are dropped")
    void surfacesRoutableRouters() throws Exception {
        upstream.json("/api/v1/traefik-config", """
                {"http":{
                  "routers":{
                    "1-router":{"rule":"Host(`app.example.com`)","service":"1-service","entryPoints":["websecure"],
                                "tls":{"certResolver":"le","domains":[{"main":"example.com","sans":["*.example.com"]}]}},
                    "2-router":{"rule":"Host(`blog.example.com`)","service":"2-service","priority":250},
                    "api-router":{"rule":"Host(`pangolin.example.com`) && PathPrefix(`/api`)","service":"api"},
                    "broken":{"rule":"PathPrefix(`/x`)","service":"x"}
                  },
                  "services":{"1-service":{"loadBalancer":{"servers":[{"url":"http://10.0.0.1"}]}}}
                }}
                """);

        RoutingSnapshot snapshot = fetcher.fetch(TIMEOUT);

        assertThat(snapshot.sourceType()).isEqualTo("pangolin");
        assertThat(snapshot.fetchedAt()).isEqualTo(NOW);
        assertThat(snapshot.routes())
                .extracting(DiscoveredRoute::upstreamId)
                .containsExactly("1-router", "2-router");

        DiscoveredRoute first = snapshot.routes().get(0);
        assertThat(first.host()).isEqualTo("app.example.com");
        assertThat(first.serviceId()).isEqualTo("1-service");
        assertThat(first.entrypoints()).isEqualTo("websecure");
        assertThat(first.tlsDomains()).isEqualTo("example.com,*.example.com");
        assertThat(first.priority()).isEqualTo(100);
        assertThat(snapshot.routes().get(1).priority()).isEqualTo(250);

        assertThat(snapshot.httpRouters().has("api-router")).isTrue();
        assertThat(snapshot.httpServices().has("1-service")).isTrue();
    }

    @Test
    @DisplayName("absent sections are initialized empty")
    void absentSectionsAreEmpty() throws Exception {
        upstream.json("/api/v1/traefik-config", "{}");

        RoutingSnapshot snapshot = fetcher.fetch(TIMEOUT);

        assertThat(snapshot.routes()).isEmpty();
        assertThat(snapshot.httpMiddlewares().isObject()).isTrue();
        assertThat(snapshot.section(RoutingSnapshot.UDP, RoutingSnapshot.SERVICES).isObject()).isTrue();
        assertThat(snapshot.section(RoutingSnapshot.TLS, RoutingSnapshot.OPTIONS).isObject()).isTrue();
    }

    @Test
    @DisplayName("TCP routers surface their SNI host")
    void tcpRoutesBySni() throws Exception {
        upstream.json("/api/v1/traefik-config", """
                {"tcp":{"routers":{"db":{"rule":"HostSNI(`db.example.com`)","service":"db-svc"}}}}
                """);

        RoutingSnapshot snapshot = fetcher.fetch(TIMEOUT);

        assertThat(snapshot.tcpRoutes()).singleElement().satisfies(r -> {
            assertThat(r.host()).isEqualTo("db.example.com");
            assertThat(r.serviceId()).isEqualTo("db-svc");
        });
    }

    @Test
    @DisplayName("non-object body → UpstreamDecodeException")
    void nonObjectBodyRejected() {
        upstream.json("/api/v1/traefik-config", "[]");

        assertThatThrownBy(() -> fetcher.fetch(TIMEOUT)).isInstanceOf(UpstreamDecodeException.class);
    }

    @Test
    @DisplayName("error status propagates")
    void errorStatusPropagates() {
        upstream.status("/api/v1/traefik-config", 503);

        assertThatThrownBy(() -> fetcher.fetch(TIMEOUT)).isInstanceOf(UpstreamStatusException.class);
    }
}
