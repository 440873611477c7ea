package io.ctlsidecar.server.handler;

import io.undertow.server.HttpServerExchange;

/**
 * Uniform contract for every sidecar route.
 *
 * A handler either returns normally, having written the complete response
 * (status, headers, body), or throws. Thrown exceptions are turned into a 500
 * by {@link io.ctlsidecar.server.ErrorTranslator}. A handler that needs another
 * status (e.g. 404 for a missing row) sets it itself and returns normally.
 */
@FunctionalInterface
public interface SidecarHandler {
    void handle(HttpServerExchange exchange) throws Exception;
}
