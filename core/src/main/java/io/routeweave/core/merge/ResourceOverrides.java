package io.routeweave.core.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeweave.core.model.ActiveResource;
import io.routeweave.core.model.MiddlewareAssignment;
import io.routeweave.core.model.MtlsSettings;
import io.routeweave.core.model.Resource;
import io.routeweave.core.model.ResourceMtls;
import io.routeweave.core.model.RoutingSnapshot;
import io.routeweave.core.model.SecuritySettings;
import io.routeweave.core.rule.RuleParser;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies per-resource overrides to the upstream router that serves the
 * resource's host.
 *
 * <p>
 * The middleware chain is assembled in a fixed order: mTLS whitelist,
 * secure headers, custom request headers, then assigned middlewares by
 * descending priority. The TLS option reference is {@code mtls-verify} for
 * mTLS resources and {@code tls-hardened} for hardened ones; a resource with
 * mTLS enabled never gets the hardened reference. The chain is prefixed onto
 * the router's own middlewares.
 */
final class ResourceOverrides {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceOverrides.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SECURE_HEADERS_MIDDLEWARE = "secure-headers";
    static final String MTLS_SUFFIX = "-mtls";
    static final String CUSTOM_HEADERS_SUFFIX = "-customheaders";
    static final String MTLS_PLUGIN = "mtlswhitelist";

    private final ObjectNode document;
    private final MtlsSettings mtls;
    private final SecuritySettings security;
    private boolean hardenedReferenced;

    ResourceOverrides(ObjectNode document, MtlsSettings mtls, SecuritySettings security) {
        this.document = document;
        this.mtls = mtls;
        this.security = security;
    }

    /** Applies every resource; returns the number of routers changed. */
    int apply(List<ActiveResource> resources) {
        if (mtls.enabled() && mtls.hasCa()) {
            tlsOptions().set(TlsOptions.MTLS_VERIFY, TlsOptions.mtlsVerify(mtls.caCertPath()));
        } else if (mtls.enabled()) {
            LOG.warn("mTLS enabled but no CA certificate path configured");
        }

        int applied = 0;
        for (ActiveResource active : resources) {
            Resource resource = active.resource();
            String routerKey = findRouter(resource.host());
            if (routerKey == null) {
                LOG.debug("No matching router found for resource {} (host: {})", resource.id(), resource.host());
                continue;
            }
            apply(active, (ObjectNode) routers().get(routerKey));
            applied++;
            LOG.debug("Applied overrides to router {} (resource: {})", routerKey, resource.id());
        }

        if (hardenedReferenced) {
            tlsOptions().set(TlsOptions.TLS_HARDENED, TlsOptions.hardened());
        }
        return applied;
    }

    private void apply(ActiveResource active, ObjectNode router) {
        Resource resource = active.resource();
        List<String> chain = new ArrayList<>();

        boolean mtlsRequested = resource.mtls().enabled();
        if (mtlsRequested) {
            if (mtls.enabled() && mtls.hasCa()) {
                String name = resource.id() + MTLS_SUFFIX;
                middlewares().set(name, mtlsMiddleware(resource.mtls()));
                chain.add(name);
                routerTls(router, true).put("options", TlsOptions.MTLS_VERIFY);
            } else {
                LOG.warn(
                        "mTLS enabled for resource {} but global mTLS is disabled or has no CA, skipping",
                        resource.id());
            }
        } else if (security.tlsHardeningEnabled() || resource.tlsHardeningEnabled()) {
            ObjectNode tls = routerTls(router, false);
            if (tls != null) {
                tls.put("options", TlsOptions.TLS_HARDENED);
                hardenedReferenced = true;
            }
        }

        if (security.secureHeadersEnabled() || resource.secureHeadersEnabled()) {
            Map<String, String> headers = security.headers().toHeaderMap();
            if (!headers.isEmpty()) {
                ObjectNode middleware = JsonNodeFactory.instance.objectNode();
                ObjectNode response = middleware.putObject("headers").putObject("customResponseHeaders");
                headers.forEach(response::put);
                middlewares().set(SECURE_HEADERS_MIDDLEWARE, middleware);
                chain.add(SECURE_HEADERS_MIDDLEWARE);
            }
        }

        if (!resource.customHeaders().isEmpty()) {
            String name = resource.id() + CUSTOM_HEADERS_SUFFIX;
            ObjectNode middleware = JsonNodeFactory.instance.objectNode();
            ObjectNode request = middleware.putObject("headers").putObject("customRequestHeaders");
            new TreeMap<>(resource.customHeaders()).forEach(request::put);
            middlewares().set(name, middleware);
            chain.add(name);
        }

        List<MiddlewareAssignment> assigned = new ArrayList<>(active.middlewares());
        assigned.sort(Comparator.comparingInt(MiddlewareAssignment::priority).reversed());
        for (MiddlewareAssignment assignment : assigned) {
            chain.add(assignment.middlewareId());
        }

        Set<String> merged = new LinkedHashSet<>(chain);
        for (JsonNode existing : router.path("middlewares")) {
            if (existing.isTextual()) {
                merged.add(existing.asText());
            }
        }
        if (!merged.isEmpty()) {
            ArrayNode list = router.putArray("middlewares");
            merged.forEach(list::add);
        }

        if (resource.routerPriority() != Resource.DEFAULT_PRIORITY) {
            router.put("priority", resource.routerPriority());
        }
        if (active.customServiceId() != null && !active.customServiceId().isEmpty()) {
            router.put("service", active.customServiceId());
        }
    }

    /**
     * Builds the whitelist plugin config from the global defaults with the
     * resource's overrides on top. Global rules and headers are copied before
     * being overridden.
     */
    ObjectNode mtlsMiddleware(ResourceMtls overrides) {
        ObjectNode config = JsonNodeFactory.instance.objectNode();
        config.putArray("caFiles").add(mtls.caCertPath());

        JsonNode rules = parse("rules", overrides.rules());
        if (!rules.isArray() || rules.isEmpty()) {
            rules = parse("rules", mtls.rules());
        }
        if (rules.isArray() && !rules.isEmpty()) {
            config.set("rules", rules.deepCopy());
        }

        ObjectNode headers = JsonNodeFactory.instance.objectNode();
        JsonNode globalHeaders = parse("requestHeaders", mtls.requestHeaders());
        if (globalHeaders.isObject()) {
            headers.setAll((ObjectNode) globalHeaders.deepCopy());
        }
        JsonNode resourceHeaders = parse("requestHeaders", overrides.requestHeaders());
        if (resourceHeaders.isObject()) {
            headers.setAll((ObjectNode) resourceHeaders.deepCopy());
        }
        if (!headers.isEmpty()) {
            config.set("requestHeaders", headers);
        }

        String rejectMessage = notEmpty(overrides.rejectMessage()) ? overrides.rejectMessage() : mtls.rejectMessage();
        if (notEmpty(rejectMessage)) {
            config.put("rejectMessage", rejectMessage);
        }
        if (overrides.rejectCode() > 0) {
            config.put("rejectCode", overrides.rejectCode());
        }

        if (notEmpty(overrides.refreshInterval())) {
            config.put("refreshInterval", overrides.refreshInterval());
        } else if (mtls.refreshInterval() > 0) {
            config.put("refreshInterval", mtls.refreshInterval() + "s");
        }

        JsonNode externalData = parse("externalData", overrides.externalData());
        if (externalData.isObject() && !externalData.isEmpty()) {
            config.set("externalData", externalData);
        }

        ObjectNode middleware = JsonNodeFactory.instance.objectNode();
        middleware.putObject("plugin").set(MTLS_PLUGIN, config);
        return middleware;
    }

    /** First router, in document order, whose rule routes {@code host}. */
    private String findRouter(String host) {
        Iterator<Map.Entry<String, JsonNode>> entries = routers().fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isObject()) {
                continue;
            }
            String routerHost = RuleParser.extractHost(entry.getValue().path("rule").asText(""));
            if (!routerHost.isEmpty() && routerHost.equalsIgnoreCase(host)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /** The router's tls object; created only when {@code create} is set, else null if absent. */
    private static ObjectNode routerTls(ObjectNode router, boolean create) {
        JsonNode tls = router.get("tls");
        if (tls instanceof ObjectNode object) {
            return object;
        }
        return create ? router.putObject("tls") : null;
    }

    private ObjectNode routers() {
        return (ObjectNode) document.path(RoutingSnapshot.HTTP).path(RoutingSnapshot.ROUTERS);
    }

    private ObjectNode middlewares() {
        return (ObjectNode) document.path(RoutingSnapshot.HTTP).path(RoutingSnapshot.MIDDLEWARES);
    }

    private ObjectNode tlsOptions() {
        return (ObjectNode) document.path(RoutingSnapshot.TLS).path(RoutingSnapshot.OPTIONS);
    }

    private static JsonNode parse(String field, String json) {
        if (!notEmpty(json)) {
            return MissingNode.getInstance();
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring invalid mTLS {} JSON: {}", field, e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
