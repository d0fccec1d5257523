package io.routeweave.core.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import io.routeweave.core.model.DataSourceType;
import io.routeweave.core.model.DiscoveredRoute;
import io.routeweave.core.model.RoutingSnapshot;
import java.time.Duration;
import java.util.List;

/**
 * Reads the current routing state from an upstream authority.
 *
 * <p>
 * The narrower accessors are views over {@link #fetch(Duration)}; wrap an
 * implementation in a {@link io.routeweave.core.coordinator.FetchCoordinator}
 * so that repeated calls share one network round trip.
 */
public interface UpstreamFetcher extends AutoCloseable {

    /**
     * Fetches a complete snapshot.
     *
     * @param timeout upper bound for the whole fetch, including fallbacks
     * @return the snapshot, never null
     * @throws UpstreamException    if no usable snapshot could be produced
     * @throws InterruptedException if the calling thread is interrupted
     */
    RoutingSnapshot fetch(Duration timeout) throws UpstreamException, InterruptedException;

    /** The authority this fetcher reads from. */
    DataSourceType sourceType();

    default List<DiscoveredRoute> routes(Duration timeout) throws UpstreamException, InterruptedException {
        return fetch(timeout).routes();
    }

    default JsonNode services(Duration timeout) throws UpstreamException, InterruptedException {
        return fetch(timeout).httpServices();
    }

    default JsonNode middlewares(Duration timeout) throws UpstreamException, InterruptedException {
        return fetch(timeout).httpMiddlewares();
    }

    /** Drops any cached or throttling state so the next fetch goes upstream. */
    default void invalidate() {}

    /** Releases threads or connections held by the fetcher. */
    @Override
    default void close() {}
}
