package io.routeweave.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.routeweave.core.coordinator.FetchThrottledException;
import io.routeweave.core.merge.ConfigMergeEngine;
import io.routeweave.core.merge.MergeException;
import io.routeweave.core.merge.MergedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the merged routing document polled by the proxy's HTTP provider.
 *
 * <p>
 * Responses:
 * <ul>
 * <li>{@code 200} with the document as JSON</li>
 * <li>{@code 502} problem+json when the upstream cannot be read and nothing
 * is cached</li>
 * <li>{@code 503} problem+json with {@code Retry-After} when the very first
 * fetch is refused by the minimum interval</li>
 * <li>{@code 500} problem+json when stored overrides cannot be read</li>
 * </ul>
 */
public final class ConfigDocumentHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigDocumentHandler.class);

    private final ConfigMergeEngine mergeEngine;

    public ConfigDocumentHandler(ConfigMergeEngine mergeEngine) {
        this.mergeEngine = mergeEngine;
    }

    @Override
    public void handle(Context ctx) {
        try {
            MergedConfig merged = mergeEngine.getMergedConfig();
            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(merged.json());
        } catch (MergeException e) {
            if (e.getCause() instanceof FetchThrottledException throttled) {
                long seconds = Math.max(1, (throttled.retryAfter().toMillis() + 999) / 1000);
                ctx.header("Retry-After", Long.toString(seconds));
                problem(ctx, 503, ProblemDetail.throttled(e.getMessage(), ctx.path()).toString());
            } else if (e.isUpstreamFailure()) {
                LOG.warn("No routing document available: {}", e.getMessage());
                problem(ctx, 502, ProblemDetail.upstreamUnavailable(e.getMessage(), ctx.path()).toString());
            } else {
                LOG.error("Failed to merge routing document", e);
                problem(ctx, 500, ProblemDetail.internalError(e.getMessage(), ctx.path()).toString());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            problem(ctx, 500, ProblemDetail.internalError("Interrupted while merging", ctx.path()).toString());
        }
    }

    private static void problem(Context ctx, int status, String body) {
        ctx.status(status);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(body);
    }
}
