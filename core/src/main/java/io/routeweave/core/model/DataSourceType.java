package io.routeweave.core.model;

import java.util.Locale;

/**
 * The upstream routing authority a deployment reads from. The value doubles
 * as the {@code source_type} written on reconciled rows.
 */
public enum DataSourceType {
    /** Aggregator API serving one pre-assembled configuration document. */
    PANGOLIN("pangolin"),
    /** The proxy's own management API, read endpoint by endpoint. */
    TRAEFIK("traefik");

    private final String value;

    DataSourceType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a configured type name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DataSourceType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DataSourceType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown data source type: '" + value + "' (expected pangolin or traefik)");
    }
}
