package io.routeweave.core.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeweave.core.model.MiddlewareRecord;
import io.routeweave.core.model.RoutingSnapshot;
import io.routeweave.core.model.ServiceRecord;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Adds stored middleware and service definitions to a routing document. */
final class StoredDefinitions {

    private static final Logger LOG = LoggerFactory.getLogger(StoredDefinitions.class);

    private static final String LOAD_BALANCER = "loadBalancer";

    private StoredDefinitions() {
        // utility class
    }

    /** Stored middlewares go to {@code http.middlewares}, replacing upstream ones of the same id. */
    static void addMiddlewares(ObjectNode document, List<MiddlewareRecord> middlewares) {
        ObjectNode section = (ObjectNode) document.path(RoutingSnapshot.HTTP).path(RoutingSnapshot.MIDDLEWARES);
        for (MiddlewareRecord middleware : middlewares) {
            section.set(middleware.id(), wrap(middleware.type(), middleware.config()));
            LOG.debug("Added middleware {} ({})", middleware.id(), middleware.type());
        }
    }

    /** Stored services go to the protocol section their definition implies. */
    static void addServices(ObjectNode document, List<ServiceRecord> services) {
        for (ServiceRecord service : services) {
            String protocol = protocolOf(service.type(), service.config());
            ObjectNode section = (ObjectNode) document.path(protocol).path(RoutingSnapshot.SERVICES);
            if (RoutingSnapshot.UDP.equals(protocol)) {
                ObjectNode entry = wrap(publishedUdpType(service.type()), service.config());
                ((ObjectNode) entry.elements().next()).remove("protocol");
                section.set(service.id(), entry);
            } else {
                section.set(service.id(), wrap(service.type(), service.config()));
            }
            LOG.debug("Added service {} ({}, {})", service.id(), service.type(), protocol);
        }
    }

    /**
     * UDP when the type is {@code udp}-prefixed or the config says
     * {@code protocol: udp}; TCP for a load balancer whose first server
     * carries an {@code address}; HTTP otherwise.
     */
    static String protocolOf(String type, JsonNode config) {
        if (type.toLowerCase(Locale.ROOT).startsWith(RoutingSnapshot.UDP)
                || RoutingSnapshot.UDP.equalsIgnoreCase(config.path("protocol").asText(""))) {
            return RoutingSnapshot.UDP;
        }
        if (LOAD_BALANCER.equals(type)) {
            for (JsonNode server : config.path("servers")) {
                if (server.has("address")) {
                    return RoutingSnapshot.TCP;
                }
                if (server.has("url")) {
                    return RoutingSnapshot.HTTP;
                }
            }
        }
        return RoutingSnapshot.HTTP;
    }

    /**
     * {@code udpLoadBalancer} is published as {@code loadBalancer}; a bare
     * {@code udp} type names no kind and also becomes {@code loadBalancer}.
     */
    static String publishedUdpType(String type) {
        if (RoutingSnapshot.UDP.equalsIgnoreCase(type)) {
            return LOAD_BALANCER;
        }
        if (type.length() > 3 && type.regionMatches(true, 0, RoutingSnapshot.UDP, 0, 3)) {
            String rest = type.substring(3);
            return Character.toLowerCase(rest.charAt(0)) + rest.substring(1);
        }
        return type;
    }

    private static ObjectNode wrap(String type, JsonNode config) {
        ObjectNode entry = JsonNodeFactory.instance.objectNode();
        entry.set(type, config != null && config.isObject() ? config.deepCopy() : JsonNodeFactory.instance.objectNode());
        return entry;
    }
}
