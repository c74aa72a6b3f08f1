package io.wafgate.standalone.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.wafgate.core.lifecycle.LifecycleState;
import io.wafgate.core.lifecycle.WafLifecycle;

/**
 * Liveness probe: {@code 200 {"status":"UP"}} while the engine is ready,
 * {@code 503 {"status":"DOWN"}} otherwise.
 */
public final class HealthHandler implements Handler {

    static final String UP = "{\"status\":\"UP\"}";
    static final String DOWN = "{\"status\":\"DOWN\"}";

    private final WafLifecycle lifecycle;

    public HealthHandler(WafLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void handle(Context ctx) {
        boolean ready = lifecycle.state() == LifecycleState.READY;
        ctx.status(ready ? 200 : 503);
        ctx.contentType("application/json");
        ctx.result(ready ? UP : DOWN);
    }
}
