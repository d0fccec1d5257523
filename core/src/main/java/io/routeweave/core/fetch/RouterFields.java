package io.routeweave.core.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/** Reads the loosely typed router fields shared by both fetchers. */
final class RouterFields {

    private RouterFields() {
        // utility class
    }

    /** Joins {@code entryPoints} into a comma-separated string. */
    static String entrypoints(JsonNode router) {
        return join(router.path("entryPoints"));
    }

    /** Joins every {@code tls.domains[].main} and {@code sans} into a comma-separated string. */
    static String tlsDomains(JsonNode router) {
        List<String> domains = new ArrayList<>();
        for (JsonNode domain : router.path("tls").path("domains")) {
            String main = domain.path("main").asText("");
            if (!main.isEmpty()) {
                domains.add(main);
            }
            for (JsonNode san : domain.path("sans")) {
                if (!san.asText("").isEmpty()) {
                    domains.add(san.asText());
                }
            }
        }
        return String.join(",", domains);
    }

    static String certResolver(JsonNode router) {
        return router.path("tls").path("certResolver").asText("");
    }

    private static String join(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : array) {
            values.add(value.asText());
        }
        return String.join(",", values);
    }
}
