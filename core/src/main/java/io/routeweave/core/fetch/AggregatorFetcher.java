package io.routeweave.core.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeweave.core.model.DataSourceConfig;
import io.routeweave.core.model.DataSourceType;
import io.routeweave.core.model.DiscoveredRoute;
import io.routeweave.core.model.Resource;
import io.routeweave.core.model.RoutingSnapshot;
import io.routeweave.core.rule.RuleParser;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the aggregator's pre-assembled configuration document from
 * {@code GET {base}/traefik-config}.
 *
 * <p>
 * Absent collections are initialized to empty objects. The aggregator's own
 * dashboard routers stay in the document but are not surfaced as routes.
 * A router priority of 0 is reported as the default 100.
 */
public final class AggregatorFetcher implements UpstreamFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(AggregatorFetcher.class);

    static final String CONFIG_PATH = "/traefik-config";

    private final DataSourceConfig config;
    private final UpstreamClient client;
    private final Clock clock;

    public AggregatorFetcher(DataSourceConfig config, UpstreamClient client) {
        this(config, client, Clock.systemUTC());
    }

    AggregatorFetcher(DataSourceConfig config, UpstreamClient client, Clock clock) {
        this.config = config;
        this.client = client;
        this.clock = clock;
    }

    @Override
    public DataSourceType sourceType() {
        return DataSourceType.PANGOLIN;
    }

    @Override
    public RoutingSnapshot fetch(Duration timeout) throws UpstreamException, InterruptedException {
        String url = config.url() + CONFIG_PATH;
        LOG.debug("Fetching aggregator config from {}", url);

        JsonNode body = client.getJson(url, timeout);
        if (!body.isObject()) {
            throw new UpstreamDecodeException("Expected a JSON object from " + url + " but got " + body.getNodeType());
        }
        ObjectNode document = RoutingSnapshot.ensureSections((ObjectNode) body);

        List<DiscoveredRoute> routes = httpRoutes(document.path(RoutingSnapshot.HTTP).path(RoutingSnapshot.ROUTERS));
        List<DiscoveredRoute> tcpRoutes = tcpRoutes(document.path(RoutingSnapshot.TCP).path(RoutingSnapshot.ROUTERS));

        RoutingSnapshot snapshot =
                new RoutingSnapshot(sourceType().value(), document, routes, tcpRoutes, null, null, null, clock.instant());
        LOG.info(
                "Fetched {} routes, {} services, {} middlewares from aggregator",
                routes.size(),
                snapshot.httpServices().size(),
                snapshot.httpMiddlewares().size());
        return snapshot;
    }

    private List<DiscoveredRoute> httpRoutes(JsonNode routers) {
        List<DiscoveredRoute> routes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = routers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String id = entry.getKey();
            JsonNode router = entry.getValue();

            String host = RuleParser.extractHost(router.path("rule").asText(""));
            if (host.isEmpty()) {
                LOG.debug("Skipping router {}: no host in rule", id);
                continue;
            }
            if (SystemRouters.isAggregatorSystemRouter(id)) {
                continue;
            }

            int priority = router.path("priority").asInt(0);
            routes.add(new DiscoveredRoute(
                    id,
                    host,
                    router.path("service").asText(""),
                    RouterFields.entrypoints(router),
                    RouterFields.tlsDomains(router),
                    priority == 0 ? Resource.DEFAULT_PRIORITY : priority,
                    sourceType().value()));
        }
        return routes;
    }

    private List<DiscoveredRoute> tcpRoutes(JsonNode routers) {
        List<DiscoveredRoute> routes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = routers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode router = entry.getValue();
            String host = RuleParser.extractSniHost(router.path("rule").asText(""));
            if (host.isEmpty()) {
                continue;
            }
            routes.add(new DiscoveredRoute(
                    entry.getKey(),
                    host,
                    router.path("service").asText(""),
                    RouterFields.entrypoints(router),
                    "",
                    router.path("priority").asInt(0),
                    sourceType().value()));
        }
        return routes;
    }
}
