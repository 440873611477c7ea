package io.ctlsidecar.server;

import io.ctlsidecar.server.handler.SidecarHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Records how long each handler invocation takes, as the {@code api-latency} timer
 * tagged with the operation name and the caller's User-Agent.
 *
 * Recording happens in a finally block and never alters the handler's outcome.
 */
public final class LatencyInstrumentation {
    public static final String METRIC = "api-latency";
    static final String UNKNOWN_AGENT = "unknown";

    private final MeterRegistry registry;

    public LatencyInstrumentation(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public SidecarHandler wrap(String op, SidecarHandler handler) {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(handler, "handler");
        return exchange -> {
            long start = System.nanoTime();
            try {
                handler.handle(exchange);
            } finally {
                observe(op, userAgent(exchange), System.nanoTime() - start);
            }
        };
    }

    private void observe(String op, String userAgent, long elapsedNanos) {
        Timer.builder(METRIC)
                .tag("op", op)
                .tag("user-agent", userAgent)
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    private static String userAgent(HttpServerExchange exchange) {
        String ua = exchange.getRequestHeaders().getFirst(Headers.USER_AGENT);
        return ua == null || ua.isBlank() ? UNKNOWN_AGENT : ua;
    }
}
