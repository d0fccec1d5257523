package io.routeweave.core.coordinator;

import io.routeweave.core.fetch.UpstreamException;
import io.routeweave.core.fetch.UpstreamFetcher;
import io.routeweave.core.model.DataSourceType;
import io.routeweave.core.model.RoutingSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a fetcher with request deduplication, a minimum interval between
 * completed fetches and a last-known-good snapshot.
 *
 * <p>
 * Concurrent callers share one in-flight fetch. A call inside the minimum
 * interval after the previous completion, successful or not, is answered
 * with the last successful snapshot, or fails with
 * {@link FetchThrottledException} when there is none yet. The last
 * successful snapshot is only ever replaced by a newer one, never expired.
 *
 * <p>
 * Thread-safe. The read-write lock guards only the snapshot and completion
 * time; it is never held across network I/O.
 */
public final class FetchCoordinator implements UpstreamFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(FetchCoordinator.class);

    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(5);

    private static final String SNAPSHOT_KEY = "snapshot";

    private final UpstreamFetcher delegate;
    private final Duration minInterval;
    private final Clock clock;
    private final InFlightRequests<String, RoutingSnapshot> inFlight = new InFlightRequests<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private RoutingSnapshot lastSnapshot;
    private Instant lastCompletedAt;

    public FetchCoordinator(UpstreamFetcher delegate) {
        this(delegate, DEFAULT_MIN_INTERVAL, Clock.systemUTC());
    }

    public FetchCoordinator(UpstreamFetcher delegate, Duration minInterval, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.minInterval = Objects.requireNonNull(minInterval, "minInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public DataSourceType sourceType() {
        return delegate.sourceType();
    }

    @Override
    public RoutingSnapshot fetch(Duration timeout) throws UpstreamException, InterruptedException {
        RoutingSnapshot throttled = throttledAnswer();
        if (throttled != null) {
            return throttled;
        }
        return inFlight.execute(SNAPSHOT_KEY, timeout, () -> fetchAndRecord(timeout));
    }

    /** The last successful snapshot, if any. */
    public Optional<RoutingSnapshot> lastSnapshot() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lastSnapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Opens the throttle window so the next call goes upstream. The last snapshot is kept. */
    @Override
    public void invalidate() {
        lock.writeLock().lock();
        try {
            lastCompletedAt = null;
        } finally {
            lock.writeLock().unlock();
        }
        delegate.invalidate();
        LOG.debug("Fetch throttle reset");
    }

    @Override
    public void close() {
        delegate.close();
    }

    /**
     * Returns the cached snapshot when inside the throttle window, null when
     * a fetch is allowed.
     *
     * @throws FetchThrottledException inside the window with nothing cached
     */
    private RoutingSnapshot throttledAnswer() throws FetchThrottledException {
        lock.readLock().lock();
        try {
            if (lastCompletedAt == null) {
                return null;
            }
            Duration elapsed = Duration.between(lastCompletedAt, clock.instant());
            if (elapsed.compareTo(minInterval) >= 0) {
                return null;
            }
            if (lastSnapshot != null) {
                LOG.debug("Within minimum fetch interval, returning cached snapshot");
                return lastSnapshot;
            }
            throw new FetchThrottledException(minInterval.minus(elapsed));
        } finally {
            lock.readLock().unlock();
        }
    }

    private RoutingSnapshot fetchAndRecord(Duration timeout) throws UpstreamException, InterruptedException {
        // a caller that passed the throttle check just before the previous leader completed
        RoutingSnapshot throttled = throttledAnswer();
        if (throttled != null) {
            return throttled;
        }
        try {
            RoutingSnapshot snapshot = delegate.fetch(timeout);
            lock.writeLock().lock();
            try {
                lastSnapshot = snapshot;
                lastCompletedAt = clock.instant();
            } finally {
                lock.writeLock().unlock();
            }
            return snapshot;
        } catch (UpstreamException e) {
            lock.writeLock().lock();
            try {
                lastCompletedAt = clock.instant();
            } finally {
                lock.writeLock().unlock();
            }
            throw e;
        }
    }
}
