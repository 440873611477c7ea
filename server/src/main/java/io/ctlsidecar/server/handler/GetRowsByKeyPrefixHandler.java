package io.ctlsidecar.server.handler;

import io.ctlsidecar.core.KeyCodec;
import io.ctlsidecar.core.ReadContext;
import io.ctlsidecar.core.Reader;
import io.ctlsidecar.core.ReaderException;
import io.ctlsidecar.core.Row;
import io.ctlsidecar.core.RowCursor;
import io.ctlsidecar.server.RequestContexts;
import io.ctlsidecar.server.dto.ReadRequest;
import io.undertow.server.HttpServerExchange;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * POST /get-rows-by-key-prefix/{family}/{table}
 *
 * Buffers the whole scan before writing anything, so a failure midway never
 * leaks partial results. With a ceiling configured, the ceiling is checked after
 * each row is appended: the (ceiling+1)-th row is read before the scan is rejected.
 */
public final class GetRowsByKeyPrefixHandler implements SidecarHandler {

    private final Reader reader;
    private final int maxRows; // 0 = unbounded

    public GetRowsByKeyPrefixHandler(Reader reader, int maxRows) {
        this.reader = Objects.requireNonNull(reader, "reader");
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must be >= 0");
        }
        this.maxRows = maxRows;
    }

    @Override
    public void handle(HttpServerExchange exchange) throws Exception {
        String family = Exchanges.pathParam(exchange, "family");
        String table = Exchanges.pathParam(exchange, "table");

        ReadRequest req = Exchanges.readRequest(exchange);
        List<Object> prefix = KeyCodec.toPositionalArgs(req.segments());

        ReadContext ctx = RequestContexts.of(exchange);
        List<Row> rows = new ArrayList<>();
        try (RowCursor cursor = reader.scanByKeyPrefix(ctx, family, table, prefix)) {
            while (cursor.hasNext()) {
                rows.add(decode(cursor));
                if (maxRows > 0 && rows.size() > maxRows) {
                    throw new RowLimitExceededException(maxRows);
                }
            }
        }
        Exchanges.sendJson(exchange, rows);
    }

    private static Row decode(RowCursor cursor) throws HandlerException {
        try {
            return cursor.next();
        } catch (ReaderException e) {
            throw new HandlerException("scan", e);
        }
    }
}
