package io.routeweave.core.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import io.routeweave.core.fetch.UpstreamException;
import io.routeweave.core.fetch.UpstreamFetcher;
import io.routeweave.core.model.ResourceStatus;
import io.routeweave.core.model.ServiceRecord;
import io.routeweave.core.rule.IdNormalizer;
import io.routeweave.core.store.ServiceStore;
import io.routeweave.core.store.StoreException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mirrors upstream HTTP services into the {@code services} table.
 *
 * <p>
 * Services are keyed by normalized id. An existing row is rewritten only
 * when its type or config changed, or when it had been disabled. Rows that
 * came from this upstream and vanished are disabled; administrator-defined
 * ({@code manual}) rows are never touched.
 */
public final class ServiceReconciler implements Reconciler {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceReconciler.class);

    /** Service kinds in detection order. */
    static final List<String> SERVICE_TYPES = List.of("loadBalancer", "weighted", "mirroring", "failover");

    private final UpstreamFetcher fetcher;
    private final ServiceStore store;
    private final Duration timeout;

    public ServiceReconciler(UpstreamFetcher fetcher, ServiceStore store, Duration timeout) {
        this.fetcher = fetcher;
        this.store = store;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "service";
    }

    @Override
    public ReconcileResult reconcile() throws UpstreamException, InterruptedException {
        JsonNode services = fetcher.services(timeout);
        String sourceType = fetcher.sourceType().value();

        int created = 0;
        int updated = 0;
        int skipped = 0;
        int failed = 0;
        Set<String> seen = new HashSet<>();

        Iterator<Map.Entry<String, JsonNode>> entries = services.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String id = IdNormalizer.normalize(entry.getKey());
            Optional<String> type = detectType(entry.getValue());
            if (id.isEmpty() || type.isEmpty()) {
                LOG.debug("Skipping service {}: unknown service type", entry.getKey());
                skipped++;
                continue;
            }
            seen.add(id);
            JsonNode config = entry.getValue().get(type.get());
            try {
                Optional<ServiceRecord> existing = store.findById(id);
                if (existing.isEmpty()) {
                    store.save(new ServiceRecord(id, id, type.get(), config, sourceType, ResourceStatus.ACTIVE));
                    created++;
                    LOG.info("Added new service {} ({})", id, type.get());
                } else if (existing.get().isManual()) {
                    skipped++;
                } else if (changed(existing.get(), type.get(), config)) {
                    store.updateDefinition(id, type.get(), config);
                    updated++;
                    LOG.info("Updated service {} ({})", id, type.get());
                } else {
                    skipped++;
                }
            } catch (StoreException e) {
                failed++;
                LOG.warn("Failed to reconcile service {}: {}", id, e.getMessage());
            }
        }

        int disabled = 0;
        for (String id : store.activeIdsBySourceType(sourceType)) {
            if (seen.contains(id)) {
                continue;
            }
            try {
                if (store.disable(id)) {
                    disabled++;
                    LOG.info("Service {} no longer exists upstream, marked disabled", id);
                }
            } catch (StoreException e) {
                failed++;
                LOG.warn("Failed to disable service {}: {}", id, e.getMessage());
            }
        }

        LOG.info(
                "Service reconciliation finished: created={}, updated={}, disabled={}, skipped={}, failed={}",
                created,
                updated,
                disabled,
                skipped,
                failed);
        return new ReconcileResult(created, updated, disabled, skipped, failed);
    }

    /** Returns the first known service kind present as a key of {@code service}. */
    static Optional<String> detectType(JsonNode service) {
        for (String type : SERVICE_TYPES) {
            if (service.path(type).isObject()) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static boolean changed(ServiceRecord existing, String type, JsonNode config) {
        return existing.status() != ResourceStatus.ACTIVE
                || !type.equals(existing.type())
                || !config.equals(existing.config());
    }
}
