package io.ctlsidecar.server;

import io.ctlsidecar.server.handler.SidecarHandler;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.ResponseCodeHandler;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;

import java.util.Objects;

/**
 * Maps (method, path template) pairs to sidecar handlers.
 *
 * Every route is finalized the same way: latency instrumentation inside the
 * {@link ErrorTranslator}. Unknown paths get Undertow's plain 404 (no
 * {@code X-Ctlstore} header), known paths with the wrong method get a 405.
 */
public final class Router {

    private final RoutingHandler routes = Handlers.routing();
    private final LatencyInstrumentation instrumentation;

    public Router(LatencyInstrumentation instrumentation) {
        this.instrumentation = Objects.requireNonNull(instrumentation, "instrumentation");
        this.routes.setInvalidMethodHandler(ResponseCodeHandler.HANDLE_405);
    }

    public Router get(String template, String op, SidecarHandler handler) {
        return add(Methods.GET, template, op, handler);
    }

    public Router post(String template, String op, SidecarHandler handler) {
        return add(Methods.POST, template, op, handler);
    }

    private Router add(HttpString method, String template, String op, SidecarHandler handler) {
        routes.add(method, template, new ErrorTranslator(instrumentation.wrap(op, handler)));
        return this;
    }

    public HttpHandler handler() {
        return routes;
    }
}
