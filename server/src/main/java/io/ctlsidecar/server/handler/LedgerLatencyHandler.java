package io.ctlsidecar.server.handler;

import io.ctlsidecar.core.Reader;
import io.ctlsidecar.core.ReaderException;
import io.ctlsidecar.server.RequestContexts;
import io.ctlsidecar.server.dto.LedgerLatencyResponse;
import io.undertow.server.HttpServerExchange;

import java.time.Duration;
import java.util.Objects;

/** GET /get-ledger-latency */
public final class LedgerLatencyHandler implements SidecarHandler {

    private final Reader reader;

    public LedgerLatencyHandler(Reader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    @Override
    public void handle(HttpServerExchange exchange) throws Exception {
        Duration latency;
        try {
            latency = reader.ledgerLatency(RequestContexts.of(exchange));
        } catch (ReaderException e) {
            throw new HandlerException("get ledger latency", e);
        }
        Exchanges.sendJson(exchange, LedgerLatencyResponse.of(latency));
    }
}
