package io.routeweave.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A stored service definition, either administrator-defined
 * ({@link #SOURCE_MANUAL}) or mirrored from the upstream authority.
 *
 * @param id         normalized identifier
 * @param name       display name
 * @param type       service type, e.g. {@code loadBalancer} or {@code weighted}
 * @param config     opaque body placed under {@code type}
 * @param sourceType origin of the row
 * @param status     active or disabled
 */
public record ServiceRecord(
        String id, String name, String type, JsonNode config, String sourceType, ResourceStatus status) {

    /** Source type of services created by administrators; never reconciled. */
    public static final String SOURCE_MANUAL = "manual";

    public boolean isManual() {
        return SOURCE_MANUAL.equals(sourceType);
    }
}
