package io.routeweave.core.reconcile;

import io.routeweave.core.fetch.UpstreamException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link Reconciler} on a daemon thread at a fixed delay, starting
 * immediately.
 *
 * <p>
 * A failing cycle is logged and the next one still runs. {@link #start()}
 * and {@link #stop()} are idempotent.
 */
public final class PollingWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(PollingWatcher.class);

    private final Reconciler reconciler;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedCycles = new AtomicLong();

    private ScheduledExecutorService scheduler;

    public PollingWatcher(Reconciler reconciler, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        this.reconciler = reconciler;
        this.interval = interval;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("{} watcher already running", reconciler.name());
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, reconciler.name() + "-watcher");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runCycle, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("{} watcher started, checking every {}", reconciler.name(), interval);
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdownNow();
        LOG.info("{} watcher stopped", reconciler.name());
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Number of cycles that have run to completion or failure. */
    public long completedCycles() {
        return completedCycles.get();
    }

    private void runCycle() {
        try {
            reconciler.reconcile();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("{} reconciliation interrupted", reconciler.name());
        } catch (UpstreamException e) {
            LOG.warn("{} reconciliation failed: {}", reconciler.name(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("{} reconciliation failed", reconciler.name(), e);
        } finally {
            completedCycles.incrementAndGet();
        }
    }
}
