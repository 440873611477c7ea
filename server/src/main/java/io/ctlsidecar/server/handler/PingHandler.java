package io.ctlsidecar.server.handler;

import io.undertow.server.HttpServerExchange;

import java.util.Objects;

/**
 * GET /ping. Same checks and responses as the healthcheck.
 *
 * Latency is recorded only under the {@code ping} op. The Go sidecar this
 * service replaces also recorded a {@code healthcheck} sample for each ping;
 * here a ping no longer counts toward healthcheck latency.
 */
public final class PingHandler implements SidecarHandler {

    private final HealthcheckHandler healthcheck;

    public PingHandler(HealthcheckHandler healthcheck) {
        this.healthcheck = Objects.requireNonNull(healthcheck, "healthcheck");
    }

    @Override
    public void handle(HttpServerExchange exchange) throws Exception {
        healthcheck.handle(exchange);
    }
}
