package io.routeweave.core.coordinator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.routeweave.core.MutableClock;
import io.routeweave.core.fetch.UpstreamConnectException;
import io.routeweave.core.model.RoutingSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FetchCoordinator")
class FetchCoordinatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration INTERVAL = Duration.ofSeconds(5);

    private StubFetcher delegate;
    private MutableClock clock;
    private FetchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        delegate = new StubFetcher();
        clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
        coordinator = new FetchCoordinator(delegate, INTERVAL, clock);
    }

    @Nested
    @DisplayName("request collapsing")
    class Collapsing {

        private ExecutorService callers;

        @BeforeEach
        void startCallers() {
            callers = Executors.newFixedThreadPool(5);
        }

        @AfterEach
        void stopCallers() {
            callers.shutdownNow();
        }

        @Test
        @DisplayName("concurrent callers share one upstream fetch and one result")
        void concurrentCallersShareFetch() throws Exception {
            delegate.gate = new CountDownLatch(1);
            List<Thread> joiners = new ArrayList<>();

            Future<RoutingSnapshot> leader = callers.submit(() -> coordinator.fetch(TIMEOUT));
            assertThat(delegate.entered.await(5, TimeUnit.SECONDS)).isTrue();

            List<Future<RoutingSnapshot>> joined = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                joined.add(callers.submit(() -> {
                    synchronized (joiners) {
                        joiners.add(Thread.currentThread());
                    }
                    return coordinator.fetch(TIMEOUT);
                }));
            }
            await().atMost(Duration.ofSeconds(5)).until(() -> {
                synchronized (joiners) {
                    return joiners.size() == 4
                            && joiners.stream().allMatch(t -> t.getState() == Thread.State.TIMED_WAITING);
                }
            });
            delegate.gate.countDown();

            RoutingSnapshot result = leader.get(5, TimeUnit.SECONDS);
            for (Future<RoutingSnapshot> f : joined) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(result);
            }
            assertThat(delegate.fetches.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("joiners observe the leader's failure")
        void joinersSeeSameFailure() throws Exception {
            delegate.gate = new CountDownLatch(1);
            delegate.failure = new UpstreamConnectException("down", null);
            List<Thread> joiners = new ArrayList<>();

            Future<RoutingSnapshot> leader = callers.submit(() -> coordinator.fetch(TIMEOUT));
            assertThat(delegate.entered.await(5, TimeUnit.SECONDS)).isTrue();
            Future<RoutingSnapshot> joiner = callers.submit(() -> {
                synchronized (joiners) {
                    joiners.add(Thread.currentThread());
                }
                return coordinator.fetch(TIMEOUT);
            });
            await().atMost(Duration.ofSeconds(5)).until(() -> {
                synchronized (joiners) {
                    return joiners.size() == 1 && joiners.get(0).getState() == Thread.State.TIMED_WAITING;
                }
            });
            delegate.gate.countDown();

            assertThatThrownBy(() -> leader.get(5, TimeUnit.SECONDS)).hasCauseReference(delegate.failure);
            assertThatThrownBy(() -> joiner.get(5, TimeUnit.SECONDS)).hasCauseReference(delegate.failure);
            assertThat(delegate.fetches.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("throttling")
    class Throttling {

        @Test
        @DisplayName("inside the minimum interval → cached snapshot, no upstream call")
        void cachedInsideWindow() throws Exception {
            RoutingSnapshot first = coordinator.fetch(TIMEOUT);
            clock.advance(Duration.ofSeconds(4));

            assertThat(coordinator.fetch(TIMEOUT)).isSameAs(first);
            assertThat(delegate.fetches.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("after the minimum interval → fresh fetch")
        void freshAfterWindow() throws Exception {
            RoutingSnapshot first = coordinator.fetch(TIMEOUT);
            clock.advance(INTERVAL);

            RoutingSnapshot second = coordinator.fetch(TIMEOUT);

            assertThat(second).isNotSameAs(first);
            assertThat(delegate.fetches.get()).isEqualTo(2);
            assertThat(coordinator.lastSnapshot()).containsSame(second);
        }

        @Test
        @DisplayName("failure with nothing cached → FetchThrottledException inside the window")
        void throttledWithoutCache() {
            delegate.failure = new UpstreamConnectException("down", null);
            assertThatThrownBy(() -> coordinator.fetch(TIMEOUT)).isSameAs(delegate.failure);

            clock.advance(Duration.ofSeconds(2));

            assertThatThrownBy(() -> coordinator.fetch(TIMEOUT))
                    .isInstanceOfSatisfying(FetchThrottledException.class, e -> assertThat(e.retryAfter())
                            .isEqualTo(Duration.ofSeconds(3)));
            assertThat(delegate.fetches.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("failure after a success → last snapshot served inside the window")
        void failureCountsTowardsWindow() throws Exception {
            RoutingSnapshot first = coordinator.fetch(TIMEOUT);
            clock.advance(INTERVAL);
            delegate.failure = new UpstreamConnectException("down", null);
            assertThatThrownBy(() -> coordinator.fetch(TIMEOUT)).isSameAs(delegate.failure);

            clock.advance(Duration.ofSeconds(1));

            assertThat(coordinator.fetch(TIMEOUT)).isSameAs(first);
            assertThat(delegate.fetches.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("invalidate → next call goes upstream and the delegate is reset")
        void invalidateOpensWindow() throws Exception {
            coordinator.fetch(TIMEOUT);

            coordinator.invalidate();
            coordinator.fetch(TIMEOUT);

            assertThat(delegate.fetches.get()).isEqualTo(2);
            assertThat(delegate.invalidations.get()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("close is passed on to the wrapped fetcher")
    void closeReachesDelegate() {
        coordinator.close();

        assertThat(delegate.closes.get()).isEqualTo(1);
    }
}
