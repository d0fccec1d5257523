package io.routeweave.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Readiness probe.
 *
 * <p>
 * Returns {@code 200 {"status":"READY"}} once a merged document has been
 * produced at least once, {@code 503 {"status":"NOT_READY","reason":"no_document"}}
 * before that.
 */
public final class ReadinessHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ReadinessHandler.class);

    private static final String READY_RESPONSE = "{\"status\":\"READY\"}";
    private static final String NOT_READY_RESPONSE = "{\"status\":\"NOT_READY\",\"reason\":\"no_document\"}";

    private final BooleanSupplier documentAvailable;

    public ReadinessHandler(BooleanSupplier documentAvailable) {
        this.documentAvailable = documentAvailable;
    }

    @Override
    public void handle(Context ctx) {
        ctx.contentType("application/json");
        if (!documentAvailable.getAsBoolean()) {
            LOG.debug("Readiness check: no merged document yet");
            ctx.status(503);
            ctx.result(NOT_READY_RESPONSE);
            return;
        }
        ctx.status(200);
        ctx.result(READY_RESPONSE);
    }
}
