package io.routeweave.core.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeweave.core.model.RoutingSnapshot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final pass over a merged document: prunes empty sections, fixes key order
 * and repairs fields strict consumers reject.
 *
 * <p>
 * Output depends only on the document's content, not on the order in which
 * its keys were inserted.
 */
final class DocumentCanonicalizer {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentCanonicalizer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Top-level sections in output order; unknown sections follow alphabetically. */
    static final List<String> SECTION_ORDER =
            List.of(RoutingSnapshot.HTTP, RoutingSnapshot.TCP, RoutingSnapshot.UDP, RoutingSnapshot.TLS);

    /** Router fields in the order the proxy itself emits them; the rest follow alphabetically. */
    static final List<String> ROUTER_FIELD_ORDER = List.of(
            "entryPoints", "middlewares", "service", "rule", "ruleSyntax", "priority", "tls", "observability");

    /** Middleware kinds whose config is a flat option set and can be key-sorted safely. */
    static final Set<String> SIMPLE_MIDDLEWARE_TYPES = Set.of(
            "addPrefix",
            "basicAuth",
            "buffering",
            "chain",
            "circuitBreaker",
            "compress",
            "digestAuth",
            "forwardAuth",
            "headers",
            "inFlightReq",
            "ipAllowList",
            "ipWhiteList",
            "rateLimit",
            "redirectRegex",
            "redirectScheme",
            "replacePath",
            "replacePathRegex",
            "retry",
            "stripPrefix",
            "stripPrefixRegex");

    private DocumentCanonicalizer() {
        // utility class
    }

    static void canonicalize(ObjectNode document) {
        prune(document);
        sortCollections(document);
        sanitizeMtlsHeaders(document);
    }

    /**
     * Drops empty collections of the TCP, UDP and TLS sections, and each
     * section that ends up empty. The HTTP section is always kept. The
     * surviving sections are put in {@link #SECTION_ORDER}.
     */
    static void prune(ObjectNode document) {
        for (String protocol : List.of(RoutingSnapshot.TCP, RoutingSnapshot.UDP, RoutingSnapshot.TLS)) {
            JsonNode section = document.get(protocol);
            if (!(section instanceof ObjectNode object)) {
                document.remove(protocol);
                continue;
            }
            List<String> empty = new ArrayList<>();
            object.fieldNames().forEachRemaining(name -> {
                JsonNode child = object.get(name);
                if (child.isContainerNode() && child.isEmpty()) {
                    empty.add(name);
                }
            });
            object.remove(empty);
            if (object.isEmpty()) {
                document.remove(protocol);
            }
        }
        orderSections(document);
    }

    private static void orderSections(ObjectNode document) {
        Map<String, JsonNode> ordered = new LinkedHashMap<>();
        for (String section : SECTION_ORDER) {
            if (document.has(section)) {
                ordered.put(section, document.get(section));
            }
        }
        List<String> rest = new ArrayList<>();
        document.fieldNames().forEachRemaining(name -> {
            if (!ordered.containsKey(name)) {
                rest.add(name);
            }
        });
        Collections.sort(rest);
        for (String name : rest) {
            ordered.put(name, document.get(name));
        }
        document.removeAll();
        document.setAll(ordered);
    }

    private static void sortCollections(ObjectNode document) {
        Iterator<Map.Entry<String, JsonNode>> sections = document.fields();
        while (sections.hasNext()) {
            JsonNode section = sections.next().getValue();
            if (!(section instanceof ObjectNode sectionObject)) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> collections = sectionObject.fields();
            while (collections.hasNext()) {
                Map.Entry<String, JsonNode> collection = collections.next();
                if (collection.getValue() instanceof ObjectNode items) {
                    sortKeys(items);
                    if (RoutingSnapshot.ROUTERS.equals(collection.getKey())) {
                        items.elements().forEachRemaining(DocumentCanonicalizer::orderRouter);
                    } else if (RoutingSnapshot.MIDDLEWARES.equals(collection.getKey())) {
                        items.elements().forEachRemaining(DocumentCanonicalizer::orderSimpleMiddleware);
                    }
                }
            }
        }
    }

    private static void orderRouter(JsonNode router) {
        if (!(router instanceof ObjectNode object)) {
            return;
        }
        Map<String, JsonNode> ordered = new LinkedHashMap<>();
        for (String field : ROUTER_FIELD_ORDER) {
            if (object.has(field)) {
                ordered.put(field, object.get(field));
            }
        }
        List<String> rest = new ArrayList<>();
        object.fieldNames().forEachRemaining(name -> {
            if (!ordered.containsKey(name)) {
                rest.add(name);
            }
        });
        Collections.sort(rest);
        for (String name : rest) {
            ordered.put(name, object.get(name));
        }
        object.removeAll();
        object.setAll(ordered);
    }

    private static void orderSimpleMiddleware(JsonNode middleware) {
        if (!(middleware instanceof ObjectNode object) || object.size() != 1) {
            return;
        }
        String type = object.fieldNames().next();
        if (SIMPLE_MIDDLEWARE_TYPES.contains(type) && object.get(type) instanceof ObjectNode config) {
            sortKeys(config);
            config.elements().forEachRemaining(value -> {
                if (value instanceof ObjectNode nested) {
                    sortKeys(nested);
                }
            });
        }
    }

    /**
     * Forces {@code plugin.mtlswhitelist.requestHeaders} to be a string map:
     * a JSON string holding an object is parsed, any other shape becomes an
     * empty object, non-string values are rendered as text.
     */
    static void sanitizeMtlsHeaders(ObjectNode document) {
        JsonNode middlewares = document.path(RoutingSnapshot.HTTP).path(RoutingSnapshot.MIDDLEWARES);
        Iterator<Map.Entry<String, JsonNode>> entries = middlewares.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode plugin = entry.getValue().path("plugin").path(ResourceOverrides.MTLS_PLUGIN);
            if (!(plugin instanceof ObjectNode config) || !config.has("requestHeaders")) {
                continue;
            }
            config.set("requestHeaders", asStringMap(entry.getKey(), config.get("requestHeaders")));
        }
    }

    private static ObjectNode asStringMap(String middleware, JsonNode headers) {
        JsonNode candidate = headers;
        if (headers.isTextual()) {
            try {
                candidate = MAPPER.readTree(headers.asText());
            } catch (JsonProcessingException e) {
                LOG.warn("Middleware {} has unparseable requestHeaders, replacing with empty map", middleware);
                candidate = null;
            }
        }
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        if (candidate == null || !candidate.isObject()) {
            if (candidate != null) {
                LOG.warn("Middleware {} requestHeaders is not a map, replacing with empty map", middleware);
            }
            return result;
        }
        candidate.fields().forEachRemaining(header -> result.put(
                header.getKey(),
                header.getValue().isTextual() ? header.getValue().asText() : header.getValue().toString()));
        return result;
    }

    private static void sortKeys(ObjectNode object) {
        List<String> names = new ArrayList<>();
        object.fieldNames().forEachRemaining(names::add);
        Collections.sort(names);
        Map<String, JsonNode> sorted = new LinkedHashMap<>();
        for (String name : names) {
            sorted.put(name, object.get(name));
        }
        object.removeAll();
        object.setAll(sorted);
    }
}
