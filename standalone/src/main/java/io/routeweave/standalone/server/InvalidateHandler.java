package io.routeweave.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.routeweave.core.merge.ConfigMergeEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST} endpoint that expires the merged document so the next read
 * fetches upstream, regardless of TTL or throttle. Used by the management
 * side after editing overrides.
 */
public final class InvalidateHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(InvalidateHandler.class);
    private static final String INVALIDATED_RESPONSE = "{\"status\":\"invalidated\"}";

    private final ConfigMergeEngine mergeEngine;

    public InvalidateHandler(ConfigMergeEngine mergeEngine) {
        this.mergeEngine = mergeEngine;
    }

    @Override
    public void handle(Context ctx) {
        LOG.info("Cache invalidation requested via POST {}", ctx.path());
        mergeEngine.invalidateCache();
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(INVALIDATED_RESPONSE);
    }
}
