package io.routeweave.core.coordinator;

import io.routeweave.core.fetch.UpstreamException;
import io.routeweave.core.fetch.UpstreamFetcher;
import io.routeweave.core.model.DataSourceType;
import io.routeweave.core.model.RoutingSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Counts fetches; can hold them on a gate or fail them on demand. */
final class StubFetcher implements UpstreamFetcher {

    final AtomicInteger fetches = new AtomicInteger();
    final AtomicInteger invalidations = new AtomicInteger();
    final AtomicInteger closes = new AtomicInteger();
    final CountDownLatch entered = new CountDownLatch(1);
    volatile CountDownLatch gate;
    volatile UpstreamException failure;

    @Override
    public RoutingSnapshot fetch(Duration timeout) throws UpstreamException, InterruptedException {
        int n = fetches.incrementAndGet();
        entered.countDown();
        CountDownLatch current = gate;
        if (current != null && !current.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("gate never opened");
        }
        if (failure != null) {
            throw failure;
        }
        return new RoutingSnapshot(
                "traefik", RoutingSnapshot.emptyDocument(), List.of(), List.of(), null, null, null,
                Instant.ofEpochSecond(n));
    }

    @Override
    public DataSourceType sourceType() {
        return DataSourceType.TRAEFIK;
    }

    @Override
    public void invalidate() {
        invalidations.incrementAndGet();
    }

    @Override
    public void close() {
        closes.incrementAndGet();
    }
}
