package io.ctlsidecar.server.handler;

import io.ctlsidecar.core.KeyCodec;
import io.ctlsidecar.core.ReadContext;
import io.ctlsidecar.core.Reader;
import io.ctlsidecar.core.Row;
import io.ctlsidecar.server.RequestContexts;
import io.ctlsidecar.server.dto.ReadRequest;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * POST /get-row-by-key/{family}/{table}
 *
 * 200 with the row as a JSON object when found. When the reader finds nothing,
 * 404 with an empty body and {@code X-Ctlstore: Not Found}, so callers can tell a
 * missing row apart from an unknown route.
 */
public final class GetRowByKeyHandler implements SidecarHandler {
    public static final HttpString NOT_FOUND_HEADER = new HttpString("X-Ctlstore");
    public static final String NOT_FOUND_VALUE = "Not Found";

    private final Reader reader;

    public GetRowByKeyHandler(Reader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    @Override
    public void handle(HttpServerExchange exchange) throws Exception {
        String family = Exchanges.pathParam(exchange, "family");
        String table = Exchanges.pathParam(exchange, "table");

        ReadRequest req = Exchanges.readRequest(exchange);
        List<Object> key = KeyCodec.toPositionalArgs(req.segments());

        ReadContext ctx = RequestContexts.of(exchange);
        Optional<Row> row = reader.lookupByKey(ctx, family, table, key);
        if (row.isEmpty()) {
            exchange.getResponseHeaders().put(NOT_FOUND_HEADER, NOT_FOUND_VALUE);
            exchange.setStatusCode(StatusCodes.NOT_FOUND);
            return;
        }
        Exchanges.sendJson(exchange, row.get());
    }
}
