package io.routeweave.core.model;

/** Lifecycle state of a {@link Resource}. Resources are never hard-deleted by reconciliation. */
public enum ResourceStatus {
    ACTIVE("active"),
    DISABLED("disabled");

    private final String value;

    ResourceStatus(String value) {
        this.value = value;
    }

    /** Returns the value stored in the {@code status} column. */
    public String value() {
        return value;
    }

    /**
     * Parses a stored status value. Unknown values are treated as disabled so
     * that a corrupt row never surfaces as a routable resource.
     */
    public static ResourceStatus fromValue(String value) {
        return "active".equalsIgnoreCase(value) ? ACTIVE : DISABLED;
    }
}
