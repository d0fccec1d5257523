package io.routeweave.core.coordinator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routeweave.core.fetch.UpstreamTimeoutException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InFlightRequests")
class InFlightRequestsTest {

    private final InFlightRequests<String, String> requests = new InFlightRequests<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("key is released once the call completes")
    void keyReleasedAfterCompletion() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        requests.execute("k", Duration.ofSeconds(1), () -> "v" + calls.incrementAndGet());
        String second = requests.execute("k", Duration.ofSeconds(1), () -> "v" + calls.incrementAndGet());

        assertThat(second).isEqualTo("v2");
        assertThat(requests.size()).isZero();
    }

    @Test
    @DisplayName("different keys do not share executions")
    void keysAreIndependent() throws Exception {
        assertThat(requests.execute("a", Duration.ofSeconds(1), () -> "A")).isEqualTo("A");
        assertThat(requests.execute("b", Duration.ofSeconds(1), () -> "B")).isEqualTo("B");
    }

    @Test
    @DisplayName("joiner bounded by its own timeout while the leader keeps running")
    void joinerTimesOut() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> leader = executor.submit(() -> requests.execute("k", Duration.ofSeconds(5), () -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "done";
        }));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> requests.execute("k", Duration.ofMillis(100), () -> "unused"))
                .isInstanceOf(UpstreamTimeoutException.class)
                .hasMessageContaining("in-flight");

        release.countDown();
        assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo("done");
        assertThat(requests.size()).isZero();
    }

    @Test
    @DisplayName("runtime failures propagate to the leader and release the key")
    void runtimeFailureReleasesKey() {
        assertThatThrownBy(() -> requests.execute("k", Duration.ofSeconds(1), () -> {
                    throw new IllegalStateException("boom");
                }))
                .isInstanceOf(IllegalStateException.class);

        assertThat(requests.size()).isZero();
    }
}
