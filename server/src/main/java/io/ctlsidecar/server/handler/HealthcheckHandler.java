package io.ctlsidecar.server.handler;

import io.ctlsidecar.core.Reader;
import io.ctlsidecar.core.ReaderException;
import io.ctlsidecar.server.RequestContexts;
import io.undertow.server.HttpServerExchange;

import java.util.Objects;

/**
 * GET /healthcheck
 *
 * Healthy means the reader can answer a ledger-latency query; the value itself is
 * ignored. 200 with an empty body on success.
 */
public final class HealthcheckHandler implements SidecarHandler {

    private final Reader reader;

    public HealthcheckHandler(Reader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    @Override
    public void handle(HttpServerExchange exchange) throws Exception {
        try {
            reader.ledgerLatency(RequestContexts.of(exchange));
        } catch (ReaderException e) {
            throw new HandlerException("healthcheck", e);
        }
    }
}
