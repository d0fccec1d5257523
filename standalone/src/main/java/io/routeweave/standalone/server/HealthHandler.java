package io.routeweave.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/** Liveness probe: {@code 200 {"status":"UP"}} while the server runs. */
public final class HealthHandler implements Handler {

    private static final String HEALTH_RESPONSE = "{\"status\":\"UP\"}";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(HEALTH_RESPONSE);
    }
}
