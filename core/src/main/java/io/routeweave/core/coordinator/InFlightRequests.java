package io.routeweave.core.coordinator;

import io.routeweave.core.fetch.UpstreamException;
import io.routeweave.core.fetch.UpstreamTimeoutException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collapses concurrent calls for the same key into one execution.
 *
 * <p>
 * The first caller for a key runs the call on its own thread; callers that
 * arrive while it is outstanding wait on the same future, each bounded by
 * its own timeout, and observe the same result or the same exception
 * instance. The key is released as soon as the call completes, so the next
 * caller after completion starts a fresh execution.
 *
 * @param <K> request key
 * @param <V> result type
 */
final class InFlightRequests<K, V> {

    /** A unit of upstream work. */
    @FunctionalInterface
    interface Call<V> {
        V call() throws UpstreamException, InterruptedException;
    }

    private final Lock lock = new ReentrantLock();
    private final Map<K, CompletableFuture<V>> inFlight = new HashMap<>();

    V execute(K key, Duration timeout, Call<V> call) throws UpstreamException, InterruptedException {
        CompletableFuture<V> future;
        boolean leader;
        lock.lock();
        try {
            future = inFlight.get(key);
            leader = future == null;
            if (leader) {
                future = new CompletableFuture<>();
                inFlight.put(key, future);
            }
        } finally {
            lock.unlock();
        }

        if (!leader) {
            return await(future, timeout);
        }
        try {
            V value = call.call();
            future.complete(value);
            return value;
        } catch (Throwable t) {
            future.completeExceptionally(t);
            throw t;
        } finally {
            lock.lock();
            try {
                inFlight.remove(key, future);
            } finally {
                lock.unlock();
            }
        }
    }

    /** Number of keys with an outstanding execution. */
    int size() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    private V await(CompletableFuture<V> future, Duration timeout) throws UpstreamException, InterruptedException {
        try {
            return future.get(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new UpstreamTimeoutException(
                    "Timed out after " + timeout.toMillis() + " ms waiting for in-flight fetch", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UpstreamException upstream) {
                throw upstream;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new UpstreamTimeoutException("In-flight fetch was interrupted", cause);
        }
    }
}
