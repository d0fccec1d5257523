package io.routeweave.core.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeweave.core.MutableClock;
import io.routeweave.core.fetch.UpstreamConnectException;
import io.routeweave.core.fetch.UpstreamException;
import io.routeweave.core.fetch.UpstreamFetcher;
import io.routeweave.core.model.ActiveResource;
import io.routeweave.core.model.DataSourceType;
import io.routeweave.core.model.MiddlewareAssignment;
import io.routeweave.core.model.MiddlewareRecord;
import io.routeweave.core.model.MtlsSettings;
import io.routeweave.core.model.Resource;
import io.routeweave.core.model.RoutingSnapshot;
import io.routeweave.core.model.SecuritySettings;
import io.routeweave.core.store.OverrideStore;
import io.routeweave.core.store.ServiceStore;
import io.routeweave.core.store.StoreException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigMergeEngine")
class ConfigMergeEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration TTL = Duration.ofSeconds(5);

    private final SourceStub source = new SourceStub();
    private final OverrideStore overrides = mock(OverrideStore.class);
    private final ServiceStore services = mock(ServiceStore.class);
    private MutableClock clock;
    private ConfigMergeEngine engine;

    /** Upstream returning a fixed document; counts fetches and can be switched to failing. */
    static final class SourceStub implements UpstreamFetcher {
        final AtomicInteger fetches = new AtomicInteger();
        final AtomicInteger invalidations = new AtomicInteger();
        volatile boolean failing;
        ObjectNode document;

        @Override
        public RoutingSnapshot fetch(Duration timeout) throws UpstreamException {
            fetches.incrementAndGet();
            if (failing) {
                throw new UpstreamConnectException("connection refused", null);
            }
            return new RoutingSnapshot("pangolin", document, List.of(), List.of(), null, null, null, Instant.EPOCH);
        }

        @Override
        public DataSourceType sourceType() {
            return DataSourceType.PANGOLIN;
        }

        @Override
        public void invalidate() {
            invalidations.incrementAndGet();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        source.document = (ObjectNode) MAPPER.readTree("""
                {"http":{
                  "routers":{
                    "2-router":{"rule":"Host(`b.example.com`)","service":"2-service","entryPoints":["websecure"]},
                    "1-router":{"service":"1-service","rule":"Host(`a.example.com`)","entryPoints":["websecure"],
                                "tls":{"certResolver":"letsencrypt"}}
                  },
                  "services":{"1-service":{"loadBalancer":{"servers":[{"url":"http://10.0.0.1"}]}}}
                },
                "tcp":{"routers":{},"services":{}}}
                """);
        when(overrides.middlewares()).thenReturn(List.of());
        when(overrides.activeResources()).thenReturn(List.of());
        when(services.findActive()).thenReturn(List.of());
        clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
        engine = engine(MtlsSettings.DISABLED, SecuritySettings.DEFAULTS);
    }

    private ConfigMergeEngine engine(MtlsSettings mtls, SecuritySettings security) {
        return new ConfigMergeEngine(
                source, overrides, services, () -> mtls, () -> security, TTL, Duration.ofSeconds(2), clock);
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        @DisplayName("one upstream fetch per TTL window")
        void cachedWithinTtl() throws Exception {
            MergedConfig first = engine.getMergedConfig();
            clock.advance(Duration.ofSeconds(4));
            MergedConfig second = engine.getMergedConfig();

            assertThat(second).isSameAs(first);
            assertThat(source.fetches.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("expired entry refetched, unchanged input gives byte-identical output")
        void refetchAfterTtl() throws Exception {
            MergedConfig first = engine.getMergedConfig();
            clock.advance(TTL);
            MergedConfig second = engine.getMergedConfig();

            assertThat(source.fetches.get()).isEqualTo(2);
            assertThat(second).isNotSameAs(first);
            assertThat(second.json()).isEqualTo(first.json());
        }

        @Test
        @DisplayName("invalidate forces exactly one new fetch and resets the upstream throttle")
        void invalidateForcesFetch() throws Exception {
            engine.getMergedConfig();

            engine.invalidateCache();
            engine.getMergedConfig();
            engine.getMergedConfig();

            assertThat(source.fetches.get()).isEqualTo(2);
            assertThat(source.invalidations.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("upstream failure with a cached document → stale document served")
        void staleOnFailure() throws Exception {
            MergedConfig first = engine.getMergedConfig();
            clock.advance(TTL);
            source.failing = true;

            assertThat(engine.getMergedConfig()).isSameAs(first);
            assertThat(engine.lastMerged()).containsSame(first);
        }

        @Test
        @DisplayName("upstream failure with nothing cached → MergeException flagged upstream")
        void failureWithoutCache() {
            source.failing = true;

            assertThatThrownBy(engine::getMergedConfig)
                    .isInstanceOfSatisfying(MergeException.class, e -> assertThat(e.isUpstreamFailure()).isTrue())
                    .hasMessageContaining("connection refused");
            assertThat(engine.lastMerged()).isEmpty();
        }

        @Test
        @DisplayName("storage failure → MergeException not flagged upstream")
        void storageFailure() {
            when(overrides.activeResources()).thenThrow(new StoreException("db locked"));

            assertThatThrownBy(engine::getMergedConfig)
                    .isInstanceOfSatisfying(MergeException.class, e -> assertThat(e.isUpstreamFailure()).isFalse());
        }
    }

    @Nested
    @DisplayName("merged document")
    class Document {

        @Test
        @DisplayName("empty sections pruned, routers sorted and fields in canonical order")
        void canonicalForm() throws Exception {
            MergedConfig merged = engine.getMergedConfig();

            assertThat(merged.sourceType()).isEqualTo("pangolin");
            assertThat(merged.document().has("tcp")).isFalse();
            assertThat(merged.document().has("udp")).isFalse();
            assertThat(merged.document().has("tls")).isFalse();
            assertThat(merged.json()).startsWith("{\"http\":{\"routers\":{\"1-router\":{\"entryPoints\":[\"websecure\"],"
                    + "\"service\":\"1-service\",\"rule\":\"Host(`a.example.com`)\",\"tls\":");
        }

        @Test
        @DisplayName("stored middlewares and resource overrides applied")
        void overridesApplied() throws Exception {
            when(overrides.middlewares()).thenReturn(List.of(
                    new MiddlewareRecord("auth", "auth", "basicAuth", MAPPER.readTree("{\"users\":[\"u:p\"]}"))));
            Resource resource = Resource.builder()
                    .id("res-a")
                    .upstreamId("1-router")
                    .host("a.example.com")
                    .serviceId("1-service")
                    .routerPriority(250)
                    .build();
            when(overrides.activeResources()).thenReturn(List.of(
                    new ActiveResource(resource, List.of(new MiddlewareAssignment("auth", 100)), null)));

            MergedConfig merged = engine(MtlsSettings.DISABLED, new SecuritySettings(true, true, SecuritySettings.DEFAULTS.headers()))
                    .getMergedConfig();

            JsonNode router = merged.document().path("http").path("routers").path("1-router");
            assertThat(router.path("middlewares").get(0).asText()).isEqualTo("secure-headers");
            assertThat(router.path("middlewares").get(1).asText()).isEqualTo("auth");
            assertThat(router.path("priority").asInt()).isEqualTo(250);
            assertThat(router.path("tls").path("options").asText()).isEqualTo(TlsOptions.TLS_HARDENED);
            assertThat(merged.document().path("tls").path("options").has(TlsOptions.TLS_HARDENED)).isTrue();
            assertThat(merged.document().path("http").path("middlewares").has("auth")).isTrue();
        }

        @Test
        @DisplayName("merging never mutates the snapshot")
        void snapshotUntouched() throws Exception {
            RoutingSnapshot snapshot = source.fetch(Duration.ofSeconds(1));
            String before = snapshot.copyDocument().toString();

            engine.merge(snapshot);

            assertThat(snapshot.copyDocument().toString()).isEqualTo(before);
        }
    }
}
