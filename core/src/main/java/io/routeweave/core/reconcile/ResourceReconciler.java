package io.routeweave.core.reconcile;

import io.routeweave.core.fetch.UpstreamException;
import io.routeweave.core.fetch.UpstreamFetcher;
import io.routeweave.core.model.DiscoveredRoute;
import io.routeweave.core.model.Resource;
import io.routeweave.core.rule.IdNormalizer;
import io.routeweave.core.store.ResourceStore;
import io.routeweave.core.store.StoreException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mirrors the upstream route list into the {@code resources} table.
 *
 * <p>
 * Each surfaced route is mapped to a stable internal id by a lookup cascade:
 * <ol>
 * <li>active row with the same upstream id;</li>
 * <li>active row routing the same host, whose upstream id is then replaced
 * (the upstream renamed its router);</li>
 * <li>legacy row whose internal id is the upstream id, or which has no
 * upstream id and routes the same host;</li>
 * <li>otherwise a new row with a fresh UUID.</li>
 * </ol>
 * A row that takes over a host disables any other active row on that host,
 * so each host keeps a single active resource. Active rows not touched by
 * the cycle are disabled, never deleted. Each
 * upsert runs in its own transaction; a failing one is logged and the cycle
 * moves on.
 */
public final class ResourceReconciler implements Reconciler {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceReconciler.class);

    private final UpstreamFetcher fetcher;
    private final ResourceStore store;
    private final Duration timeout;
    private final Supplier<String> idGenerator;

    public ResourceReconciler(UpstreamFetcher fetcher, ResourceStore store, Duration timeout) {
        this(fetcher, store, timeout, () -> UUID.randomUUID().toString());
    }

    ResourceReconciler(UpstreamFetcher fetcher, ResourceStore store, Duration timeout, Supplier<String> idGenerator) {
        this.fetcher = fetcher;
        this.store = store;
        this.timeout = timeout;
        this.idGenerator = idGenerator;
    }

    @Override
    public String name() {
        return "resource";
    }

    @Override
    public ReconcileResult reconcile() throws UpstreamException, InterruptedException {
        List<DiscoveredRoute> routes = fetcher.routes(timeout);
        List<String> existing = store.activeIds();

        int created = 0;
        int updated = 0;
        int skipped = 0;
        int failed = 0;
        int disabled = 0;
        Set<String> touched = new HashSet<>();
        Set<String> displaced = new HashSet<>();

        if (routes.isEmpty()) {
            LOG.info("No routes found upstream, disabling {} active resources", existing.size());
        }
        for (DiscoveredRoute route : routes) {
            if (isBlank(route.host()) || isBlank(route.serviceId())) {
                skipped++;
                continue;
            }
            try {
                Upsert upsert = upsert(route);
                touched.add(upsert.id());
                for (String other : upsert.displaced()) {
                    if (displaced.add(other)) {
                        disabled++;
                    }
                }
                if (upsert.created()) {
                    created++;
                } else {
                    updated++;
                }
            } catch (StoreException e) {
                failed++;
                LOG.warn("Failed to reconcile route {} ({}): {}", route.upstreamId(), route.host(), e.getMessage());
            }
        }

        for (String id : existing) {
            if (touched.contains(id) || displaced.contains(id)) {
                continue;
            }
            try {
                if (store.disable(id)) {
                    disabled++;
                    LOG.info("Resource {} no longer exists upstream, marked disabled", id);
                }
            } catch (StoreException e) {
                failed++;
                LOG.warn("Failed to disable resource {}: {}", id, e.getMessage());
            }
        }

        ReconcileResult result = new ReconcileResult(created, updated, disabled, skipped, failed);
        LOG.info(
                "Resource reconciliation finished: created={}, updated={}, disabled={}, skipped={}, failed={}",
                created,
                updated,
                disabled,
                skipped,
                failed);
        return result;
    }

    private Upsert upsert(DiscoveredRoute route) {
        String upstreamId = IdNormalizer.normalize(route.upstreamId());

        Optional<String> match = store.findActiveByUpstreamId(upstreamId);
        if (match.isPresent()) {
            LOG.debug("Found resource {} by upstream id {}", match.get(), upstreamId);
            return refresh(match.get(), upstreamId, route);
        }
        match = store.findActiveByHost(route.host());
        if (match.isPresent()) {
            LOG.info("Found resource {} by host {}, upstream id is now {}", match.get(), route.host(), upstreamId);
            return refresh(match.get(), upstreamId, route);
        }
        match = store.findLegacy(upstreamId, route.host());
        if (match.isPresent()) {
            LOG.info("Found legacy resource {}, adopting upstream id {}", match.get(), upstreamId);
            return refresh(match.get(), upstreamId, route);
        }

        String id = idGenerator.get();
        store.create(Resource.builder()
                .id(id)
                .upstreamId(upstreamId)
                .host(route.host())
                .serviceId(route.serviceId())
                .sourceType(route.sourceType())
                .entrypoints(isBlank(route.entrypoints()) ? Resource.DEFAULT_ENTRYPOINTS : route.entrypoints())
                .tlsDomains(route.tlsDomains() == null ? "" : route.tlsDomains())
                .routerPriority(route.priority() > 0 ? route.priority() : Resource.DEFAULT_PRIORITY)
                .build());
        LOG.info("Added new resource {} (internal: {}, upstream: {})", route.host(), id, upstreamId);
        return new Upsert(id, true, List.of());
    }

    private Upsert refresh(String id, String upstreamId, DiscoveredRoute route) {
        List<String> displaced = store.refreshFromUpstream(id, upstreamId, route);
        for (String other : displaced) {
            LOG.warn("Resource {} took over host {}, disabled resource {}", id, route.host(), other);
        }
        return new Upsert(id, false, displaced);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Upsert(String id, boolean created, List<String> displaced) {}
}
