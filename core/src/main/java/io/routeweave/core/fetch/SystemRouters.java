package io.routeweave.core.fetch;

import java.util.List;

/**
 * Recognizes routers that belong to the proxy or the aggregator itself and
 * must never be reconciled into resources.
 */
final class SystemRouters {

    /** Built-in routers of the proxy's management plane. */
    private static final List<String> NATIVE_SYSTEM_IDS =
            List.of("api@internal", "dashboard@internal", "acme-http@internal", "noop@internal");

    /** User-defined routers whose names merely look like system routers. */
    private static final List<String> NATIVE_USER_PATTERNS =
            List.of("-router", "api-router@file", "next-router@file", "ws-router@file");

    /** Routers the aggregator adds for its own dashboard and API. */
    private static final List<String> AGGREGATOR_SYSTEM_IDS = List.of("api-router", "next-router", "ws-router");

    private SystemRouters() {
        // utility class
    }

    static boolean isNativeSystemRouter(String routerId) {
        for (String pattern : NATIVE_USER_PATTERNS) {
            if (routerId.contains(pattern)) {
                return false;
            }
        }
        for (String systemId : NATIVE_SYSTEM_IDS) {
            if (routerId.contains(systemId)) {
                return true;
            }
        }
        return false;
    }

    static boolean isAggregatorSystemRouter(String routerId) {
        for (String systemId : AGGREGATOR_SYSTEM_IDS) {
            if (routerId.contains(systemId)) {
                return true;
            }
        }
        return false;
    }
}
