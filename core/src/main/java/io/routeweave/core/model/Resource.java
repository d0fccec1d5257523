package io.routeweave.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * A discovered route as tracked in storage.
 *
 * <p>
 * {@code id} is assigned once and survives upstream identifier churn;
 * {@code upstreamId} is whatever the upstream authority currently calls the
 * router. At most one active resource exists per host.
 *
 * @param id                   stable internal identifier
 * @param upstreamId           identifier as last reported upstream, may be null for legacy rows
 * @param host                 routed host
 * @param serviceId            upstream service the router points at
 * @param orgId                owning organisation, {@code unknown} for reconciled rows
 * @param siteId               owning site, {@code unknown} for reconciled rows
 * @param status               lifecycle status
 * @param sourceType           origin of the row
 * @param entrypoints          comma-joined entrypoints
 * @param tlsDomains           comma-joined TLS domains
 * @param routerPriority       router priority
 * @param routerPriorityManual when set, upstream priority updates are ignored
 * @param customHeaders        extra request headers for this resource
 * @param mtls                 mTLS whitelist overrides
 * @param tlsHardeningEnabled  attach hardened TLS options
 * @param secureHeadersEnabled attach the secure response headers middleware
 * @param createdAt            creation time
 * @param updatedAt            last modification time
 */
public record Resource(
        String id,
        String upstreamId,
        String host,
        String serviceId,
        String orgId,
        String siteId,
        ResourceStatus status,
        String sourceType,
        String entrypoints,
        String tlsDomains,
        int routerPriority,
        boolean routerPriorityManual,
        Map<String, String> customHeaders,
        ResourceMtls mtls,
        boolean tlsHardeningEnabled,
        boolean secureHeadersEnabled,
        Instant createdAt,
        Instant updatedAt) {

    /** Priority assumed when none is configured; never written to the document. */
    public static final int DEFAULT_PRIORITY = 100;

    public static final String DEFAULT_ENTRYPOINTS = "websecure";
    public static final String UNKNOWN = "unknown";

    public Resource {
        customHeaders = customHeaders == null ? Map.of() : Map.copyOf(customHeaders);
        mtls = mtls == null ? ResourceMtls.NONE : mtls;
    }

    public boolean isActive() {
        return status == ResourceStatus.ACTIVE;
    }

    /** Creates a new builder with the defaults used for freshly discovered routes. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Resource}. Defaults: status active, entrypoints
     * {@code websecure}, org/site {@code unknown}, priority 100.
     */
    public static final class Builder {
        private String id;
        private String upstreamId;
        private String host;
        private String serviceId;
        private String orgId = UNKNOWN;
        private String siteId = UNKNOWN;
        private ResourceStatus status = ResourceStatus.ACTIVE;
        private String sourceType = "";
        private String entrypoints = DEFAULT_ENTRYPOINTS;
        private String tlsDomains = "";
        private int routerPriority = DEFAULT_PRIORITY;
        private boolean routerPriorityManual;
        private Map<String, String> customHeaders = Map.of();
        private ResourceMtls mtls = ResourceMtls.NONE;
        private boolean tlsHardeningEnabled;
        private boolean secureHeadersEnabled;
        private Instant createdAt;
        private Instant updatedAt;

        Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder upstreamId(String upstreamId) {
            this.upstreamId = upstreamId;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder serviceId(String serviceId) {
            this.serviceId = serviceId;
            return this;
        }

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder siteId(String siteId) {
            this.siteId = siteId;
            return this;
        }

        public Builder status(ResourceStatus status) {
            this.status = status;
            return this;
        }

        public Builder sourceType(String sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder entrypoints(String entrypoints) {
            this.entrypoints = entrypoints;
            return this;
        }

        public Builder tlsDomains(String tlsDomains) {
            this.tlsDomains = tlsDomains;
            return this;
        }

        public Builder routerPriority(int routerPriority) {
            this.routerPriority = routerPriority;
            return this;
        }

        public Builder routerPriorityManual(boolean routerPriorityManual) {
            this.routerPriorityManual = routerPriorityManual;
            return this;
        }

        public Builder customHeaders(Map<String, String> customHeaders) {
            this.customHeaders = customHeaders;
            return this;
        }

        public Builder mtls(ResourceMtls mtls) {
            this.mtls = mtls;
            return this;
        }

        public Builder tlsHardeningEnabled(boolean tlsHardeningEnabled) {
            this.tlsHardeningEnabled = tlsHardeningEnabled;
            return this;
        }

        public Builder secureHeadersEnabled(boolean secureHeadersEnabled) {
            this.secureHeadersEnabled = secureHeadersEnabled;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Resource build() {
            if (id == null || id.isEmpty()) {
                throw new IllegalStateException("resource id is required");
            }
            if (host == null) {
                throw new IllegalStateException("resource host is required");
            }
            return new Resource(
                    id,
                    upstreamId,
                    host,
                    serviceId == null ? "" : serviceId,
                    orgId,
                    siteId,
                    status,
                    sourceType,
                    entrypoints,
                    tlsDomains,
                    routerPriority,
                    routerPriorityManual,
                    customHeaders,
                    mtls,
                    tlsHardeningEnabled,
                    secureHeadersEnabled,
                    createdAt,
                    updatedAt);
        }
    }
}
