package io.routeweave.core.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeweave.core.model.DataSourceConfig;
import io.routeweave.core.model.DataSourceType;
import io.routeweave.core.model.DiscoveredRoute;
import io.routeweave.core.model.RoutingSnapshot;
import io.routeweave.core.rule.IdNormalizer;
import io.routeweave.core.rule.RuleParser;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the proxy's own management API, one endpoint per collection.
 *
 * <p>
 * All {@link NativeEndpoint endpoints} are requested concurrently as one
 * task group bound to the caller's deadline, on a pool of one thread per
 * endpoint that lives until {@link #close()}. Every task runs to completion
 * (or to the deadline); results are classified only once all are in. A
 * failed critical endpoint aborts the fetch with a
 * {@link CriticalEndpointException} naming every failure; a failed
 * non-critical endpoint is logged and its collection left empty.
 *
 * <p>
 * When the primary base URL is unreachable, each fallback URL is tried once,
 * in order. A fallback that works is reported as a suggested configuration
 * change; the configured URL itself is never changed.
 *
 * <p>
 * The republished document drops the management API's runtime fields and
 * the proxy's internal objects, and keys each object by its name without the
 * {@code @provider} suffix.
 */
public final class NativeFetcher implements UpstreamFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(NativeFetcher.class);

    /** Base URLs tried, in order, when the configured one cannot be reached. */
    public static final List<String> DEFAULT_FALLBACK_URLS = List.of(
            "http://host.docker.internal:8080",
            "http://localhost:8080",
            "http://127.0.0.1:8080",
            "http://traefik:8080");

    /** Fields of the management API that are runtime state, not configuration. */
    private static final Set<String> RUNTIME_FIELDS =
            Set.of("name", "provider", "status", "using", "usedBy", "error", "serverStatus", "type");

    private static final String INTERNAL_PROVIDER = "internal";

    private final DataSourceConfig config;
    private final UpstreamClient client;
    private final List<String> fallbackUrls;
    private final Clock clock;
    private final ExecutorService group;
    private volatile String suggestedUrl;

    public NativeFetcher(DataSourceConfig config, UpstreamClient client) {
        this(config, client, DEFAULT_FALLBACK_URLS, Clock.systemUTC());
    }

    NativeFetcher(DataSourceConfig config, UpstreamClient client, List<String> fallbackUrls, Clock clock) {
        this.config = config;
        this.client = client;
        this.fallbackUrls = List.copyOf(fallbackUrls);
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.group = Executors.newFixedThreadPool(NativeEndpoint.values().length, r -> {
            Thread t = new Thread(r, "native-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public DataSourceType sourceType() {
        return DataSourceType.TRAEFIK;
    }

    /**
     * Returns the fallback base URL that last answered when the configured
     * one did not, or null if the configured URL works.
     */
    public String suggestedUrl() {
        return suggestedUrl;
    }

    @Override
    public RoutingSnapshot fetch(Duration timeout) throws UpstreamException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        String primary = config.url();
        try {
            RoutingSnapshot snapshot = fetchFrom(primary, deadline);
            suggestedUrl = null;
            return snapshot;
        } catch (CriticalEndpointException e) {
            if (!e.isConnectivityFailure()) {
                throw e;
            }
            LOG.warn("Failed to connect to primary native API URL {}: {}", primary, e.getMessage());
            return fetchFromFallbacks(primary, deadline, e);
        }
    }

    private RoutingSnapshot fetchFromFallbacks(String primary, long deadline, UpstreamException primaryFailure)
            throws UpstreamException, InterruptedException {
        UpstreamException lastFailure = primaryFailure;
        for (String fallback : fallbackUrls) {
            if (fallback.equals(primary)) {
                continue;
            }
            if (System.nanoTime() >= deadline) {
                LOG.warn("Deadline reached before trying fallback URL {}", fallback);
                break;
            }
            LOG.info("Trying fallback native API URL: {}", fallback);
            try {
                RoutingSnapshot snapshot = fetchFrom(fallback, deadline);
                suggestedUrl = fallback;
                LOG.warn(
                        "Native API reachable at {} but not at the configured {}; consider updating datasource.url",
                        fallback,
                        primary);
                return snapshot;
            } catch (CriticalEndpointException e) {
                lastFailure = e;
                LOG.warn("Fallback URL {} failed: {}", fallback, e.getMessage());
            }
        }
        throw new UpstreamConnectException(
                "All native API connection attempts failed, last error: " + lastFailure.getMessage(), lastFailure);
    }

    /** Runs one task group against {@code baseUrl} and assembles the snapshot. */
    RoutingSnapshot fetchFrom(String baseUrl, long deadline) throws UpstreamException, InterruptedException {
        Map<NativeEndpoint, EndpointFetchResult> results = fetchAll(baseUrl, deadline);

        Map<String, UpstreamException> criticalFailures = new LinkedHashMap<>();
        int nonCriticalFailures = 0;
        for (EndpointFetchResult result : results.values()) {
            if (!result.failed()) {
                continue;
            }
            if (result.critical()) {
                criticalFailures.put(result.endpoint().key(), result.error());
            } else {
                nonCriticalFailures++;
                LOG.warn(
                        "Non-critical endpoint failed: {}: {}",
                        result.endpoint().key(),
                        result.error().getMessage());
            }
        }
        if (!criticalFailures.isEmpty()) {
            throw new CriticalEndpointException(criticalFailures);
        }
        if (nonCriticalFailures > 0) {
            LOG.info("{} non-critical endpoints failed, continuing with available data", nonCriticalFailures);
        }

        return assemble(results);
    }

    private Map<NativeEndpoint, EndpointFetchResult> fetchAll(String baseUrl, long deadline)
            throws InterruptedException {
        NativeEndpoint[] endpoints = NativeEndpoint.values();
        List<Callable<EndpointFetchResult>> tasks = new ArrayList<>(endpoints.length);
        for (NativeEndpoint endpoint : endpoints) {
            tasks.add(() -> fetchEndpoint(baseUrl, endpoint, deadline));
        }

        if (group.isShutdown()) {
            throw new IllegalStateException("NativeFetcher is closed");
        }
        // invokeAll cancels whatever is still running at the deadline
        long remaining = Math.max(0, deadline - System.nanoTime());
        List<Future<EndpointFetchResult>> futures = group.invokeAll(tasks, remaining, TimeUnit.NANOSECONDS);

        Map<NativeEndpoint, EndpointFetchResult> results = new EnumMap<>(NativeEndpoint.class);
        for (int i = 0; i < endpoints.length; i++) {
            results.put(endpoints[i], collect(endpoints[i], futures.get(i), baseUrl));
        }
        return results;
    }

    /** Stops the endpoint pool, interrupting fetches still in flight. */
    @Override
    public void close() {
        group.shutdownNow();
    }

    private static EndpointFetchResult collect(
            NativeEndpoint endpoint, Future<EndpointFetchResult> future, String baseUrl)
            throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            return EndpointFetchResult.failure(
                    endpoint,
                    new UpstreamTimeoutException("Deadline exceeded for " + baseUrl + endpoint.path(), e));
        } catch (ExecutionException e) {
            return EndpointFetchResult.failure(
                    endpoint,
                    new UpstreamDecodeException(
                            "Unexpected failure reading " + baseUrl + endpoint.path() + ": " + e.getCause(),
                            e.getCause()));
        }
    }

    private EndpointFetchResult fetchEndpoint(String baseUrl, NativeEndpoint endpoint, long deadline)
            throws InterruptedException {
        try {
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            JsonNode payload = client.getJson(baseUrl + endpoint.path(), remaining);
            if (endpoint.isCollection()) {
                return EndpointFetchResult.success(endpoint, ArrayOrMapDecoder.decode(payload), payload);
            }
            return EndpointFetchResult.success(endpoint, List.of(), payload);
        } catch (UpstreamException e) {
            return EndpointFetchResult.failure(endpoint, e);
        }
    }

    private RoutingSnapshot assemble(Map<NativeEndpoint, EndpointFetchResult> results) {
        ObjectNode document = RoutingSnapshot.emptyDocument();
        for (EndpointFetchResult result : results.values()) {
            NativeEndpoint endpoint = result.endpoint();
            if (result.failed() || endpoint.protocol() == null) {
                continue;
            }
            ObjectNode section = (ObjectNode) document.path(endpoint.protocol()).path(endpoint.kind());
            for (ObjectNode item : result.items()) {
                String name = item.path(ArrayOrMapDecoder.NAME_FIELD).asText("");
                if (name.isEmpty() || INTERNAL_PROVIDER.equals(item.path("provider").asText())) {
                    continue;
                }
                section.set(IdNormalizer.stripProvider(name), configurationOnly(item));
            }
        }

        List<DiscoveredRoute> routes = httpRoutes(results.get(NativeEndpoint.HTTP_ROUTERS).items());
        List<DiscoveredRoute> tcpRoutes = tcpRoutes(results.get(NativeEndpoint.TCP_ROUTERS).items());

        JsonNode version = payloadOf(results.get(NativeEndpoint.VERSION));
        if (version != null) {
            LOG.info(
                    "Connected to native API {} ({})",
                    version.path("Version").asText("unknown"),
                    version.path("Codename").asText("unknown"));
        }
        ArrayNode entrypoints = JsonNodeFactory.instance.arrayNode();
        results.get(NativeEndpoint.ENTRYPOINTS).items().forEach(entrypoints::add);

        RoutingSnapshot snapshot = new RoutingSnapshot(
                sourceType().value(),
                document,
                routes,
                tcpRoutes,
                version,
                entrypoints,
                payloadOf(results.get(NativeEndpoint.OVERVIEW)),
                clock.instant());
        LOG.info(
                "Fetched {} HTTP routers ({} routable), {} TCP routers, {} UDP routers, {} HTTP services, {} HTTP middlewares",
                results.get(NativeEndpoint.HTTP_ROUTERS).items().size(),
                routes.size(),
                results.get(NativeEndpoint.TCP_ROUTERS).items().size(),
                results.get(NativeEndpoint.UDP_ROUTERS).items().size(),
                snapshot.httpServices().size(),
                snapshot.httpMiddlewares().size());
        return snapshot;
    }

    private List<DiscoveredRoute> httpRoutes(List<ObjectNode> routers) {
        List<DiscoveredRoute> routes = new ArrayList<>();
        for (ObjectNode router : routers) {
            String name = router.path(ArrayOrMapDecoder.NAME_FIELD).asText("");
            if (name.isEmpty() || INTERNAL_PROVIDER.equals(router.path("provider").asText())) {
                continue;
            }
            if (RouterFields.certResolver(router).isEmpty() && !config.includeNonTlsRouters()) {
                continue;
            }
            if (SystemRouters.isNativeSystemRouter(name)) {
                continue;
            }
            String rule = router.path("rule").asText("");
            String host = RuleParser.extractHost(rule);
            if (host.isEmpty()) {
                LOG.debug("Could not extract host from rule of router {}: {}", name, rule);
                continue;
            }
            routes.add(new DiscoveredRoute(
                    name,
                    host,
                    router.path("service").asText(""),
                    RouterFields.entrypoints(router),
                    RouterFields.tlsDomains(router),
                    router.path("priority").asInt(0),
                    sourceType().value()));
        }
        return routes;
    }

    private List<DiscoveredRoute> tcpRoutes(List<ObjectNode> routers) {
        List<DiscoveredRoute> routes = new ArrayList<>();
        for (ObjectNode router : routers) {
            String name = router.path(ArrayOrMapDecoder.NAME_FIELD).asText("");
            if (name.isEmpty() || INTERNAL_PROVIDER.equals(router.path("provider").asText())) {
                continue;
            }
            String host = RuleParser.extractSniHost(router.path("rule").asText(""));
            if (host.isEmpty()) {
                continue;
            }
            routes.add(new DiscoveredRoute(
                    name,
                    host,
                    router.path("service").asText(""),
                    RouterFields.entrypoints(router),
                    "",
                    router.path("priority").asInt(0),
                    sourceType().value()));
        }
        return routes;
    }

    private static ObjectNode configurationOnly(ObjectNode item) {
        ObjectNode copy = item.deepCopy();
        copy.remove(RUNTIME_FIELDS);
        return copy;
    }

    private static JsonNode payloadOf(EndpointFetchResult result) {
        return result.failed() ? null : result.payload();
    }
}
