// file: server/src/main/java/io/ctlsidecar/server/RequestLogger.java
package io.ctlsidecar.server;

import io.undertow.server.HttpServerExchange;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Access log: one line per completed exchange with method, path, status and latency.
 *
 * Failures are already logged with their cause by {@link ErrorTranslator}; this only
 * records the outcome. Successful requests log at FINE because healthchecks are frequent.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /** Register the access-log line on 'exchange'; it is written when the exchange completes. */
    static void track(HttpServerExchange exchange) {
        long start = System.nanoTime();
        exchange.addExchangeCompleteListener((ex, next) -> {
            try {
                long totalMillis = (System.nanoTime() - start) / 1_000_000L;
                logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), ex.getStatusCode(), totalMillis);
            } finally {
                next.proceed();
            }
        });
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method (GET, POST)
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     */
    public static void logRequest(String method, String path, int status, long totalMillis) {
        Level level = status >= 500 ? Level.WARNING : Level.FINE;
        if (!log.isLoggable(level)) {
            return;
        }
        log.log(level, String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis));
    }
}
