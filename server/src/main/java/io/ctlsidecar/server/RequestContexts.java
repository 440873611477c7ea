package io.ctlsidecar.server;

import io.ctlsidecar.core.ReadContext;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;

import java.time.Duration;

/**
 * Ties a {@link ReadContext} to each exchange.
 *
 * Each request gets a context bounded by the connection's write deadline.
 * While the handler runs, a {@link DisconnectWatch} cancels the context if the
 * client closes its connection, so a disconnect aborts the store work it started.
 */
public final class RequestContexts {
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private static final AttachmentKey<ReadContext> CONTEXT = AttachmentKey.create(ReadContext.class);

    private RequestContexts() {
        // utility
    }

    /** Wrap 'next' so every exchange carries a context before it is routed. */
    static HttpHandler attaching(Duration timeout, HttpHandler next) {
        return exchange -> {
            attach(exchange, timeout);
            next.handleRequest(exchange);
        };
    }

    /** Context for this exchange, attaching a default one if none is present yet. */
    public static ReadContext of(HttpServerExchange exchange) {
        ReadContext ctx = exchange.getAttachment(CONTEXT);
        return ctx != null ? ctx : attach(exchange, DEFAULT_TIMEOUT);
    }

    static ReadContext attach(HttpServerExchange exchange, Duration timeout) {
        ReadContext ctx = ReadContext.withTimeout(timeout);
        exchange.putAttachment(CONTEXT, ctx);
        if (exchange.getConnection() != null) {
            DisconnectWatch.start(exchange, ctx);
        }
        return ctx;
    }
}
