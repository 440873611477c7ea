package io.ctlsidecar.server;

import io.ctlsidecar.server.handler.SidecarHandler;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The one place where handler failures become HTTP responses.
 *
 * Every failure is logged once with the request URL. If the handler has not
 * started its response yet, the client gets a 500 whose plain-text body is the
 * failure message.
 */
public final class ErrorTranslator implements HttpHandler {
    private static final Logger log = Logger.getLogger(ErrorTranslator.class.getName());
    private static final HttpString CONTENT_TYPE_OPTIONS = new HttpString("X-Content-Type-Options");

    private final SidecarHandler delegate;

    public ErrorTranslator(SidecarHandler delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        try {
            delegate.handle(exchange);
        } catch (Exception e) {
            translate(exchange, e);
        }
    }

    static void translate(HttpServerExchange exchange, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.toString();
        log.log(Level.WARNING, "err=" + message + " url=" + requestUrl(exchange), e);

        if (exchange.isResponseStarted()) {
            return;
        }
        exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.getResponseHeaders().put(CONTENT_TYPE_OPTIONS, "nosniff");
        exchange.getResponseSender().send(message + "\n");
    }

    private static String requestUrl(HttpServerExchange exchange) {
        String query = exchange.getQueryString();
        return query == null || query.isEmpty()
                ? exchange.getRequestURI()
                : exchange.getRequestURI() + "?" + query;
    }
}
