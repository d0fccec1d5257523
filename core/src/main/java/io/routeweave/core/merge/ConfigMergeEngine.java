package io.routeweave.core.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeweave.core.fetch.UpstreamException;
import io.routeweave.core.fetch.UpstreamFetcher;
import io.routeweave.core.model.ActiveResource;
import io.routeweave.core.model.MtlsSettings;
import io.routeweave.core.model.RoutingSnapshot;
import io.routeweave.core.model.SecuritySettings;
import io.routeweave.core.store.MtlsSettingsProvider;
import io.routeweave.core.store.OverrideStore;
import io.routeweave.core.store.SecuritySettingsProvider;
import io.routeweave.core.store.ServiceStore;
import io.routeweave.core.store.StoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the published routing document: the upstream snapshot with stored
 * definitions and per-resource overrides merged in.
 *
 * <p>
 * Results are cached for a TTL independent of the fetch throttle. One
 * caller at a time refreshes an expired entry; concurrent callers get the
 * expired entry meanwhile rather than waiting, unless nothing has been
 * produced yet. When the upstream fetch fails the previous document is
 * served again.
 */
public final class ConfigMergeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigMergeEngine.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);

    private final UpstreamFetcher source;
    private final OverrideStore overrides;
    private final ServiceStore services;
    private final MtlsSettingsProvider mtlsSettings;
    private final SecuritySettingsProvider securitySettings;
    private final Duration cacheTtl;
    private final Duration fetchTimeout;
    private final Clock clock;

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private MergedConfig cached;
    private Instant expiresAt = Instant.MIN;

    public ConfigMergeEngine(
            UpstreamFetcher source,
            OverrideStore overrides,
            ServiceStore services,
            MtlsSettingsProvider mtlsSettings,
            SecuritySettingsProvider securitySettings,
            Duration cacheTtl,
            Duration fetchTimeout,
            Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.overrides = Objects.requireNonNull(overrides, "overrides");
        this.services = Objects.requireNonNull(services, "services");
        this.mtlsSettings = Objects.requireNonNull(mtlsSettings, "mtlsSettings");
        this.securitySettings = Objects.requireNonNull(securitySettings, "securitySettings");
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the merged document, from cache when fresh.
     *
     * @throws MergeException       if nothing is cached and the upstream fetch
     *                              or a storage read fails
     * @throws InterruptedException if interrupted while waiting for the first
     *                              document
     */
    public MergedConfig getMergedConfig() throws MergeException, InterruptedException {
        MergedConfig fresh = freshEntry();
        if (fresh != null) {
            return fresh;
        }

        if (!refreshLock.tryLock()) {
            MergedConfig stale = cachedEntry();
            if (stale != null) {
                LOG.debug("Refresh in progress, serving previous document");
                return stale;
            }
            refreshLock.lockInterruptibly();
        }
        try {
            fresh = freshEntry();
            if (fresh != null) {
                return fresh;
            }
            return refresh();
        } finally {
            refreshLock.unlock();
        }
    }

    /** Expires the cached document and resets the upstream throttle; the next call fetches. */
    public void invalidateCache() {
        cacheLock.writeLock().lock();
        try {
            expiresAt = Instant.MIN;
        } finally {
            cacheLock.writeLock().unlock();
        }
        source.invalidate();
        LOG.info("Merged config cache invalidated");
    }

    /** The last produced document, fresh or not. */
    public Optional<MergedConfig> lastMerged() {
        return Optional.ofNullable(cachedEntry());
    }

    private MergedConfig refresh() throws MergeException, InterruptedException {
        RoutingSnapshot snapshot;
        try {
            snapshot = source.fetch(fetchTimeout);
        } catch (UpstreamException e) {
            MergedConfig stale = cachedEntry();
            if (stale != null) {
                LOG.warn("Upstream fetch failed, using stale cache: {}", e.getMessage());
                return stale;
            }
            throw new MergeException("Failed to fetch upstream config: " + e.getMessage(), e, true);
        }

        MergedConfig merged;
        try {
            merged = merge(snapshot);
        } catch (StoreException e) {
            throw new MergeException("Failed to merge stored overrides: " + e.getMessage(), e, false);
        }

        cacheLock.writeLock().lock();
        try {
            cached = merged;
            expiresAt = clock.instant().plus(cacheTtl);
        } finally {
            cacheLock.writeLock().unlock();
        }
        return merged;
    }

    /** Runs the merge pipeline over one snapshot. Does not touch the cache. */
    MergedConfig merge(RoutingSnapshot snapshot) {
        ObjectNode document = snapshot.copyDocument();

        StoredDefinitions.addMiddlewares(document, overrides.middlewares());
        StoredDefinitions.addServices(document, services.findActive());

        List<ActiveResource> resources = overrides.activeResources();
        MtlsSettings mtls = mtlsSettings.mtlsSettings();
        SecuritySettings security = securitySettings.securitySettings();
        int applied = new ResourceOverrides(document, mtls, security).apply(resources);

        DocumentCanonicalizer.canonicalize(document);

        String json;
        try {
            json = MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize merged document", e);
        }
        LOG.info(
                "Merged config from {}: {} active resources, {} routers overridden",
                snapshot.sourceType(),
                resources.size(),
                applied);
        return new MergedConfig(document, json, snapshot.sourceType(), clock.instant());
    }

    private MergedConfig freshEntry() {
        cacheLock.readLock().lock();
        try {
            return cached != null && clock.instant().isBefore(expiresAt) ? cached : null;
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    private MergedConfig cachedEntry() {
        cacheLock.readLock().lock();
        try {
            return cached;
        } finally {
            cacheLock.readLock().unlock();
        }
    }
}
